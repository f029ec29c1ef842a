package com.wmevs.pipeline.timing;

import com.wmevs.pipeline.trial.InvalidTrialException;
import com.wmevs.pipeline.trial.Trial;
import com.wmevs.util.Rounding;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns experiment-clock onsets into onsets relative to the start of a run.
 *
 * Onsets and latencies are first rounded to 0.1 s; the anchor is the first
 * trial's rounded memory-array onset, so that trial always starts at 0.
 */
public class TimingNormalizer {

    private final double memoryRetentionDuration;

    public TimingNormalizer(double memoryRetentionDuration) {
        if (memoryRetentionDuration <= 0) {
            throw new IllegalArgumentException("Memory retention duration must be positive");
        }
        this.memoryRetentionDuration = memoryRetentionDuration;
    }

    public List<TrialTiming> normalize(List<Trial> runTrials) {
        if (runTrials.isEmpty()) {
            throw new IllegalArgumentException("Cannot normalize timing of an empty run");
        }
        double anchor = Rounding.round1(requireOnset(runTrials.get(0), runTrials.get(0).getMemoryOnset(), "memory"));

        List<TrialTiming> timings = new ArrayList<>(runTrials.size());
        for (Trial trial : runTrials) {
            double memoryOnset = Rounding.round1(requireOnset(trial, trial.getMemoryOnset(), "memory")) - anchor;
            double testOnset = Rounding.round1(requireOnset(trial, trial.getTestOnset(), "test")) - anchor;
            // no latency is recorded when the subject did not respond
            double testDuration = trial.getResponseTime() == null ? 0.0 : Rounding.round1(trial.getResponseTime());
            timings.add(new TrialTiming(memoryOnset, memoryRetentionDuration, testOnset, testDuration));
        }
        return timings;
    }

    public double getMemoryRetentionDuration() {
        return memoryRetentionDuration;
    }

    private static double requireOnset(Trial trial, Double onset, String event) {
        if (onset == null) {
            throw new InvalidTrialException(trial.getOrdinal(), event + "-array onset missing");
        }
        return onset;
    }
}
