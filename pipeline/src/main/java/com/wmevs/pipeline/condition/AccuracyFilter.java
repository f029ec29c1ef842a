package com.wmevs.pipeline.condition;

import com.wmevs.pipeline.trial.Accuracy;

public enum AccuracyFilter {
    CORRECT,
    INCORRECT,
    ANY;

    /** Undefined accuracy only passes {@link #ANY}. */
    public boolean matches(Accuracy accuracy) {
        switch (this) {
            case CORRECT:
                return accuracy == Accuracy.CORRECT;
            case INCORRECT:
                return accuracy == Accuracy.INCORRECT;
            default:
                return true;
        }
    }
}
