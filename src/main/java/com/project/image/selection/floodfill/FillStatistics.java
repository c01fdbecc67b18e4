package com.project.image.selection.floodfill;

/**
 * Timing and work counters of one fill. Serial fills report zero rounds and tasks.
 *
 * @param processingNanos time spent waiting for tile tasks, summed over rounds
 * @param mergeNanos      time spent merging propagation requests between rounds
 */
public record FillStatistics(long elapsedNanos, int rounds, int tileTasks, long processingNanos, long mergeNanos) {

    public static FillStatistics serial(long elapsedNanos) {
        return new FillStatistics(elapsedNanos, 0, 0, 0, 0);
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
