package com.wmevs.pipeline.regressor;

import com.wmevs.pipeline.condition.Condition;
import com.wmevs.pipeline.condition.ConditionIndexer;
import com.wmevs.pipeline.condition.TrialPredicate;
import com.wmevs.pipeline.run.Run;
import com.wmevs.pipeline.timing.TrialTiming;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds flag-encoded regressor matrices. Every trial in the row scope gets a
 * row with its run-relative onset and duration; only the flag column depends
 * on the index set.
 */
public class RegressorMatrixBuilder {

    private final ConditionIndexer indexer;

    public RegressorMatrixBuilder(ConditionIndexer indexer) {
        this.indexer = indexer;
    }

    public RegressorMatrix build(Run run, Condition condition) {
        List<Integer> flagged = indexer.indicesOf(run, condition);
        return build(run, condition.getEventType(), condition.getRowScope(), flagged);
    }

    public RegressorMatrix build(Run run, EventType eventType, Collection<Integer> flaggedIndices) {
        return build(run, eventType, TrialPredicate.all(), flaggedIndices);
    }

    public RegressorMatrix build(Run run, EventType eventType, TrialPredicate rowScope,
            Collection<Integer> flaggedIndices) {
        Set<Integer> flagged = new HashSet<>(flaggedIndices);
        for (Integer index : flagged) {
            if (index == null || index < 0 || index >= run.size()) {
                throw new IllegalArgumentException("Index " + index + " is outside run " + run.getRunId()
                        + " of " + run.size() + " trials");
            }
        }

        List<RegressorRow> rows = new ArrayList<>();
        for (int i = 0; i < run.size(); i++) {
            if (!rowScope.test(run.trial(i))) {
                continue;
            }
            TrialTiming timing = run.timing(i);
            rows.add(new RegressorRow(eventType.onset(timing), eventType.duration(timing),
                    flagged.contains(i) ? 1 : 0));
        }
        return new RegressorMatrix(rows);
    }
}
