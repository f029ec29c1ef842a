package com.wmevs.pipeline.trial;

import java.util.Objects;

/**
 * Unordered pair of image identifiers, stored smaller first.
 */
public final class ImagePair {

    private final int first;
    private final int second;

    private ImagePair(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public static ImagePair of(int a, int b) {
        if (a == b) {
            throw new IllegalArgumentException("Image pair needs two distinct images, got " + a + " twice");
        }
        return a < b ? new ImagePair(a, b) : new ImagePair(b, a);
    }

    public int getFirst() {
        return first;
    }

    public int getSecond() {
        return second;
    }

    public boolean contains(int image) {
        return first == image || second == image;
    }

    /** Name fragment used in condition names, e.g. "37". */
    public String label() {
        return Integer.toString(first) + second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ImagePair))
            return false;
        ImagePair other = (ImagePair) o;
        return first == other.first && second == other.second;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
