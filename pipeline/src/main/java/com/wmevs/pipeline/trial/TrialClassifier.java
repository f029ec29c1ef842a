package com.wmevs.pipeline.trial;

import com.wmevs.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives accuracy, response presence, cued image and missing-image pair for
 * every trial of a subject. Runs once over the full sequence, before the
 * sequence is cut into runs.
 */
public class TrialClassifier {

    private static final Logger logger = LoggerFactory.getLogger(TrialClassifier.class);

    private final String sameKey;
    private final String differentKey;
    private final String noResponseKey;
    private final int universeSize;
    private final ImagePairCatalog catalog;

    public TrialClassifier(String sameKey, String differentKey, String noResponseKey, int universeSize,
            ImagePairCatalog catalog) {
        this.sameKey = sameKey;
        this.differentKey = differentKey;
        this.noResponseKey = noResponseKey;
        this.universeSize = universeSize;
        this.catalog = catalog;
    }

    public static TrialClassifier fromConfig(PipelineConfig config) {
        return new TrialClassifier(config.sameKey, config.differentKey, config.noResponseKey,
                config.imageUniverseSize, config.buildPairCatalog());
    }

    public List<Trial> classifyAll(List<Trial> trials) {
        List<Trial> classified = new ArrayList<>(trials.size());
        int noResponse = 0;
        int correct = 0;
        for (Trial trial : trials) {
            TrialLabels labels = classify(trial);
            if (!labels.responsePresent) {
                noResponse++;
            } else if (labels.accuracy == Accuracy.CORRECT) {
                correct++;
            }
            classified.add(trial.withLabels(labels));
        }
        logger.info("Classified {} trials: {} correct, {} incorrect, {} without response", trials.size(), correct,
                trials.size() - correct - noResponse, noResponse);
        return classified;
    }

    public TrialLabels classify(Trial trial) {
        boolean responsePresent = isResponsePresent(trial);
        Accuracy accuracy = accuracyOf(trial, responsePresent);
        Integer cuedImage = cuedImageOf(trial);
        ImagePair missingPair = missingPairOf(trial);
        return new TrialLabels(accuracy, responsePresent, cuedImage, missingPair);
    }

    private boolean isResponsePresent(Trial trial) {
        String key = trial.getResponseKey();
        if (noResponseKey.equals(key)) {
            return false;
        }
        if (sameKey.equals(key) || differentKey.equals(key)) {
            return true;
        }
        throw new InvalidTrialException(trial.getOrdinal(), "unrecognized response key '" + key + "' (expected '"
                + sameKey + "', '" + differentKey + "' or '" + noResponseKey + "')");
    }

    private Accuracy accuracyOf(Trial trial, boolean responsePresent) {
        if (!responsePresent) {
            return Accuracy.UNDEFINED;
        }
        Boolean change = trial.getChange();
        if (change == null) {
            throw new InvalidTrialException(trial.getOrdinal(), "response given but change/no-change flag missing");
        }
        String expected = change ? differentKey : sameKey;
        return expected.equals(trial.getResponseKey()) ? Accuracy.CORRECT : Accuracy.INCORRECT;
    }

    private Integer cuedImageOf(Trial trial) {
        Integer location = trial.getCueLocation();
        if (location == null) {
            return null;
        }
        List<Integer> images = trial.getMemoryImages();
        if (location < 0 || location >= images.size()) {
            throw new InvalidTrialException(trial.getOrdinal(), "cue location " + location
                    + " outside memory array of " + images.size() + " images");
        }
        Integer cued = images.get(location);
        if (cued == null) {
            throw new InvalidTrialException(trial.getOrdinal(), "cue location " + location + " points at an empty image slot");
        }
        return cued;
    }

    private ImagePair missingPairOf(Trial trial) {
        if (!trial.hasMemoryArray()) {
            return null;
        }
        Set<Integer> present = new HashSet<>();
        for (Integer image : trial.getMemoryImages()) {
            if (image == null || image < 0 || image >= universeSize) {
                throw new InvalidTrialException(trial.getOrdinal(), "memory image " + image
                        + " outside universe 0.." + (universeSize - 1));
            }
            if (!present.add(image)) {
                throw new InvalidTrialException(trial.getOrdinal(), "memory image " + image + " shown twice");
            }
        }
        List<Integer> absent = new ArrayList<>(2);
        for (int image = 0; image < universeSize; image++) {
            if (!present.contains(image)) {
                absent.add(image);
            }
        }
        if (absent.size() != 2) {
            throw new InvalidTrialException(trial.getOrdinal(), "expected exactly 2 images missing from the memory array, found "
                    + absent.size() + " " + absent);
        }
        ImagePair pair = ImagePair.of(absent.get(0), absent.get(1));
        if (!catalog.contains(pair)) {
            throw new InvalidTrialException(trial.getOrdinal(), "missing pair " + pair + " is not in the pair catalog");
        }
        return pair;
    }
}
