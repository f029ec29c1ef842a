package com.wmevs.pipeline.regressor;

import com.wmevs.pipeline.timing.TrialTiming;

/**
 * The trial event a regressor is locked to.
 */
public enum EventType {
    MEMORY_ARRAY {
        @Override
        public double onset(TrialTiming timing) {
            return timing.memoryOnset;
        }

        @Override
        public double duration(TrialTiming timing) {
            return timing.memoryDuration;
        }
    },
    TEST_ARRAY {
        @Override
        public double onset(TrialTiming timing) {
            return timing.testOnset;
        }

        @Override
        public double duration(TrialTiming timing) {
            return timing.testDuration;
        }
    };

    public abstract double onset(TrialTiming timing);

    public abstract double duration(TrialTiming timing);
}
