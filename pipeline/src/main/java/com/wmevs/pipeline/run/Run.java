package com.wmevs.pipeline.run;

import com.wmevs.pipeline.timing.TrialTiming;
import com.wmevs.pipeline.trial.Trial;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One scan acquisition: a contiguous block of trials plus the run-relative
 * timing fixed when the run was cut.
 */
public class Run {

    private final int index;
    private final String runId;
    private final List<Trial> trials;
    private final List<TrialTiming> timings;

    public Run(int index, String runId, List<Trial> trials, List<TrialTiming> timings) {
        if (trials.size() != timings.size()) {
            throw new IllegalArgumentException("Run " + runId + " has " + trials.size() + " trials but "
                    + timings.size() + " timings");
        }
        this.index = index;
        this.runId = runId;
        this.trials = Collections.unmodifiableList(new ArrayList<>(trials));
        this.timings = Collections.unmodifiableList(new ArrayList<>(timings));
    }

    /** 0-based position of this run within the subject's session. */
    public int getIndex() {
        return index;
    }

    /** Externally assigned acquisition identifier, used only for file naming. */
    public String getRunId() {
        return runId;
    }

    public List<Trial> getTrials() {
        return trials;
    }

    public int size() {
        return trials.size();
    }

    public Trial trial(int localIndex) {
        return trials.get(localIndex);
    }

    public TrialTiming timing(int localIndex) {
        return timings.get(localIndex);
    }
}
