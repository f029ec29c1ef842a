package com.wmevs.pipeline.trial;

import com.wmevs.pipeline.EvPipelineException;

/**
 * A single trial's raw data cannot be labelled or timed.
 */
public class InvalidTrialException extends EvPipelineException {

    private final int trialOrdinal;

    public InvalidTrialException(int trialOrdinal, String message) {
        super("Trial " + trialOrdinal + ": " + message);
        this.trialOrdinal = trialOrdinal;
    }

    public int getTrialOrdinal() {
        return trialOrdinal;
    }
}
