package com.wmevs.pipeline.condition;

import com.wmevs.pipeline.run.Run;

import java.util.ArrayList;
import java.util.List;

public class ConditionIndexer {

    /**
     * Run-local indices, ascending, of the trials matching {@code predicate}.
     */
    public List<Integer> indicesOf(Run run, TrialPredicate predicate) {
        return indicesOf(run, TrialPredicate.all(), predicate);
    }

    /**
     * Run-local indices, ascending, of the trials inside {@code scope} that
     * match {@code predicate}.
     */
    public List<Integer> indicesOf(Run run, TrialPredicate scope, TrialPredicate predicate) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < run.size(); i++) {
            if (scope.test(run.trial(i)) && predicate.test(run.trial(i))) {
                indices.add(i);
            }
        }
        return indices;
    }

    public List<Integer> indicesOf(Run run, Condition condition) {
        return indicesOf(run, condition.getRowScope(), condition.getPredicate());
    }
}
