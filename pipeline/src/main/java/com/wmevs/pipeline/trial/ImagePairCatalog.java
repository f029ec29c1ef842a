package com.wmevs.pipeline.trial;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed, ordered list of missing-image pairs that missing-pair conditions are
 * enumerated over.
 */
public class ImagePairCatalog {

    public enum Mode {
        /** Every unordered pair of the image universe. */
        ALL_PAIRS,
        /** One low-partition image crossed with one high-partition image. */
        LOW_HIGH
    }

    private final List<ImagePair> pairs;
    private final Set<ImagePair> lookup;

    private ImagePairCatalog(List<ImagePair> pairs) {
        this.pairs = Collections.unmodifiableList(pairs);
        this.lookup = new LinkedHashSet<>(pairs);
    }

    public static ImagePairCatalog allPairs(int universeSize) {
        if (universeSize < 2) {
            throw new IllegalArgumentException("Image universe must hold at least two images");
        }
        List<ImagePair> pairs = new ArrayList<>();
        for (int i = 0; i < universeSize; i++) {
            for (int j = i + 1; j < universeSize; j++) {
                pairs.add(ImagePair.of(i, j));
            }
        }
        return new ImagePairCatalog(pairs);
    }

    /**
     * Low-major cross product; pairs are normalized, so a "high" id below a "low"
     * id still produces a valid pair.
     */
    public static ImagePairCatalog lowHigh(List<Integer> lowImages, List<Integer> highImages) {
        List<ImagePair> pairs = new ArrayList<>();
        for (int low : lowImages) {
            for (int high : highImages) {
                pairs.add(ImagePair.of(low, high));
            }
        }
        return new ImagePairCatalog(pairs);
    }

    public static ImagePairCatalog create(Mode mode, int universeSize, List<Integer> lowImages,
            List<Integer> highImages) {
        switch (mode) {
            case ALL_PAIRS:
                return allPairs(universeSize);
            case LOW_HIGH:
                return lowHigh(lowImages, highImages);
            default:
                throw new IllegalArgumentException("Unsupported catalog mode " + mode);
        }
    }

    public List<ImagePair> getPairs() {
        return pairs;
    }

    public boolean contains(ImagePair pair) {
        return lookup.contains(pair);
    }

    public int size() {
        return pairs.size();
    }
}
