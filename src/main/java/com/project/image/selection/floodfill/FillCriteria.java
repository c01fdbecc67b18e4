package com.project.image.selection.floodfill;

/**
 * Inclusion test and graded selection value for one fill.
 * <p>
 * A pixel is included when {@code |value - seedValue| < threshold}; its mask value is
 * {@code 255 - difference * 255 / threshold}, which is always in (0, 255] for included pixels.
 * With threshold 0 nothing is included, not even the seed.
 */
public record FillCriteria(int seedValue, int threshold) {

    public FillCriteria {
        if (seedValue < 0 || seedValue > 255) {
            throw new IllegalArgumentException("Seed value out of range [0,255]: " + seedValue);
        }
        checkThreshold(threshold);
    }

    public static void checkThreshold(int threshold) {
        if (threshold < 0 || threshold > 255) {
            throw new IllegalArgumentException("Threshold out of range [0,255]: " + threshold);
        }
    }

    public int difference(int value) {
        return Math.abs(value - seedValue);
    }

    public boolean includes(int value) {
        return difference(value) < threshold;
    }

    /** Only meaningful for values that {@link #includes(int)} accepts. */
    public int selectionValue(int value) {
        return 255 - (difference(value) * 255 / threshold);
    }
}
