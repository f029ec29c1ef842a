package com.wmevs.pipeline.timing;

/**
 * Run-relative onsets and durations of the two events of one trial, in seconds.
 */
public class TrialTiming {

    public final double memoryOnset;
    public final double memoryDuration;
    public final double testOnset;
    public final double testDuration;

    public TrialTiming(double memoryOnset, double memoryDuration, double testOnset, double testDuration) {
        this.memoryOnset = memoryOnset;
        this.memoryDuration = memoryDuration;
        this.testOnset = testOnset;
        this.testDuration = testDuration;
    }

    @Override
    public String toString() {
        return "TrialTiming{memory=" + memoryOnset + "+" + memoryDuration + ", test=" + testOnset + "+"
                + testDuration + "}";
    }
}
