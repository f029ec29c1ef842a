package com.wmevs.pipeline.condition;

import com.wmevs.pipeline.trial.CueType;
import com.wmevs.pipeline.trial.ImagePair;
import com.wmevs.pipeline.trial.Trial;

/**
 * Condition over a classified trial. Predicates only ever see one trial, so a
 * condition cannot depend on trials outside the run being indexed.
 */
@FunctionalInterface
public interface TrialPredicate {

    boolean test(Trial trial);

    default TrialPredicate and(TrialPredicate other) {
        return trial -> test(trial) && other.test(trial);
    }

    static TrialPredicate all() {
        return trial -> true;
    }

    /** Trials without a recorded cue type match neither cue type. */
    static TrialPredicate cueType(CueType cueType) {
        return trial -> trial.getCueType() == cueType;
    }

    static TrialPredicate accuracy(AccuracyFilter filter) {
        return trial -> filter.matches(trial.getLabels().accuracy);
    }

    static TrialPredicate response(ResponseFilter filter) {
        return trial -> filter.matches(trial.getLabels().responsePresent);
    }

    static TrialPredicate cuedImage(int image) {
        return trial -> {
            Integer cued = trial.getLabels().cuedImage;
            return cued != null && cued == image;
        };
    }

    static TrialPredicate missingPair(ImagePair pair) {
        return trial -> pair.equals(trial.getLabels().missingPair);
    }
}
