package com.wmevs.pipeline.trial;

/**
 * Per-trial labels derived once per subject by {@link TrialClassifier}.
 */
public class TrialLabels {

    public final Accuracy accuracy;
    public final boolean responsePresent;
    // null when the trial had no cue
    public final Integer cuedImage;
    // null for trials without a memory array
    public final ImagePair missingPair;

    public TrialLabels(Accuracy accuracy, boolean responsePresent, Integer cuedImage, ImagePair missingPair) {
        if (accuracy == null) {
            throw new IllegalArgumentException("accuracy must not be null, use UNDEFINED");
        }
        if (responsePresent == (accuracy == Accuracy.UNDEFINED)) {
            throw new IllegalArgumentException("accuracy must be UNDEFINED exactly when no response is present");
        }
        this.accuracy = accuracy;
        this.responsePresent = responsePresent;
        this.cuedImage = cuedImage;
        this.missingPair = missingPair;
    }

    @Override
    public String toString() {
        return "TrialLabels{accuracy=" + accuracy + ", responsePresent=" + responsePresent
                + ", cuedImage=" + cuedImage + ", missingPair=" + missingPair + "}";
    }
}
