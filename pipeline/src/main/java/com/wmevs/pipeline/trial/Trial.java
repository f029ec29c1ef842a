package com.wmevs.pipeline.trial;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One row of behavioural data: the raw fields read from the trial table and,
 * once classified, the derived {@link TrialLabels}. Instances are immutable;
 * classification returns a copy carrying the labels.
 *
 * Nullable wrapper fields mean "not recorded for this trial".
 */
public class Trial {

    private final int ordinal;
    private final List<Integer> memoryImages;
    private final CueType cueType;
    private final Integer cueLocation;
    private final Boolean change;
    private final String responseKey;
    private final Double responseTime;
    private final Double memoryOnset;
    private final Double testOnset;
    private final TrialLabels labels;

    public Trial(int ordinal, List<Integer> memoryImages, CueType cueType, Integer cueLocation, Boolean change,
            String responseKey, Double responseTime, Double memoryOnset, Double testOnset) {
        this(ordinal, memoryImages, cueType, cueLocation, change, responseKey, responseTime, memoryOnset, testOnset,
                null);
    }

    private Trial(int ordinal, List<Integer> memoryImages, CueType cueType, Integer cueLocation, Boolean change,
            String responseKey, Double responseTime, Double memoryOnset, Double testOnset, TrialLabels labels) {
        this.ordinal = ordinal;
        this.memoryImages = memoryImages == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(memoryImages));
        this.cueType = cueType;
        this.cueLocation = cueLocation;
        this.change = change;
        this.responseKey = responseKey;
        this.responseTime = responseTime;
        this.memoryOnset = memoryOnset;
        this.testOnset = testOnset;
        this.labels = labels;
    }

    public Trial withLabels(TrialLabels labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels must not be null");
        }
        return new Trial(ordinal, memoryImages, cueType, cueLocation, change, responseKey, responseTime,
                memoryOnset, testOnset, labels);
    }

    /** 0-based position in the subject's full trial sequence. */
    public int getOrdinal() {
        return ordinal;
    }

    /** Images shown in the memory array, in display order; empty for catch trials. */
    public List<Integer> getMemoryImages() {
        return memoryImages;
    }

    public boolean hasMemoryArray() {
        return !memoryImages.isEmpty();
    }

    public CueType getCueType() {
        return cueType;
    }

    public Integer getCueLocation() {
        return cueLocation;
    }

    /** true = change trial, false = no-change trial. */
    public Boolean getChange() {
        return change;
    }

    public String getResponseKey() {
        return responseKey;
    }

    public Double getResponseTime() {
        return responseTime;
    }

    public Double getMemoryOnset() {
        return memoryOnset;
    }

    public Double getTestOnset() {
        return testOnset;
    }

    public boolean isClassified() {
        return labels != null;
    }

    public TrialLabels getLabels() {
        if (labels == null) {
            throw new IllegalStateException("Trial " + ordinal + " has not been classified");
        }
        return labels;
    }

    @Override
    public String toString() {
        return "Trial{ordinal=" + ordinal + ", images=" + memoryImages + ", cue=" + cueType + "@" + cueLocation
                + ", change=" + change + ", key=" + responseKey + ", rt=" + responseTime + "}";
    }
}
