package com.wmevs.pipeline.service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

public class SubjectReport {
    private final String subjectId;
    private final int trialCount;
    private final int runCount;
    private final List<Path> files;

    public SubjectReport(String subjectId, int trialCount, int runCount, List<Path> files) {
        this.subjectId = subjectId;
        this.trialCount = trialCount;
        this.runCount = runCount;
        this.files = Collections.unmodifiableList(files);
    }

    public String getSubjectId() {
        return subjectId;
    }

    public int getTrialCount() {
        return trialCount;
    }

    public int getRunCount() {
        return runCount;
    }

    /** Written regressor files, in emission order. */
    public List<Path> getFiles() {
        return files;
    }
}
