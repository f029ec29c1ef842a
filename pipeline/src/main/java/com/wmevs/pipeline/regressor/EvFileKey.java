package com.wmevs.pipeline.regressor;

import java.util.Objects;

/**
 * Identity of one regressor file. Unique within a subject's output tree.
 */
public final class EvFileKey {

    private final String subject;
    private final String design;
    private final String runId;
    private final String condition;

    public EvFileKey(String subject, String design, String runId, String condition) {
        this.subject = Objects.requireNonNull(subject, "subject");
        this.design = Objects.requireNonNull(design, "design");
        this.runId = Objects.requireNonNull(runId, "runId");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public String getSubject() {
        return subject;
    }

    public String getDesign() {
        return design;
    }

    public String getRunId() {
        return runId;
    }

    public String getCondition() {
        return condition;
    }

    /** e.g. {@code GLM2_run12_missing37_onlypost.txt} */
    public String fileName() {
        return design + "_run" + runId + "_" + condition + ".txt";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvFileKey))
            return false;
        EvFileKey other = (EvFileKey) o;
        return subject.equals(other.subject) && design.equals(other.design) && runId.equals(other.runId)
                && condition.equals(other.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, design, runId, condition);
    }

    @Override
    public String toString() {
        return subject + "/" + design + "/run" + runId + "/" + condition;
    }
}
