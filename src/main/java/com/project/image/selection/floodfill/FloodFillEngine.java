package com.project.image.selection.floodfill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Point;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * The four selection strategies behind one facade. All of them return the same mask for the same
 * input; they differ in traversal and parallelism only.
 */
public class FloodFillEngine {
    private static final Logger log = LoggerFactory.getLogger(FloodFillEngine.class);

    public static final int DEFAULT_TILE_SIZE = 64;

    private final Map<FillAlgorithm, FloodFill> algorithms = new EnumMap<>(FillAlgorithm.class);

    public FloodFillEngine(ExecutorService executor) {
        this(DEFAULT_TILE_SIZE, DEFAULT_TILE_SIZE, executor);
    }

    public FloodFillEngine(int tileWidth, int tileHeight, ExecutorService executor) {
        algorithms.put(FillAlgorithm.NAIVE, new SerialFloodFill());
        algorithms.put(FillAlgorithm.SCANLINE, new ScanlineFloodFill());
        algorithms.put(FillAlgorithm.NAIVE_PARALLEL,
                new TileOrchestrator<>(new PointTileWorker(), tileWidth, tileHeight, executor));
        algorithms.put(FillAlgorithm.SCANLINE_PARALLEL,
                new TileOrchestrator<>(new ScanlineTileWorker(), tileWidth, tileHeight, executor));
    }

    public PixelBuffer fill(PixelBuffer image, Point seed, int threshold) {
        return select(FillAlgorithm.NAIVE, image, seed, threshold).mask();
    }

    public PixelBuffer fillScanline(PixelBuffer image, Point seed, int threshold) {
        return select(FillAlgorithm.SCANLINE, image, seed, threshold).mask();
    }

    public PixelBuffer fillParallel(PixelBuffer image, Point seed, int threshold) {
        return select(FillAlgorithm.NAIVE_PARALLEL, image, seed, threshold).mask();
    }

    public PixelBuffer fillScanlineParallel(PixelBuffer image, Point seed, int threshold) {
        return select(FillAlgorithm.SCANLINE_PARALLEL, image, seed, threshold).mask();
    }

    public FillResult select(FillAlgorithm algorithm, PixelBuffer image, Point seed, int threshold) {
        Objects.requireNonNull(algorithm, "algorithm");
        FillResult result = algorithms.get(algorithm).fill(image, seed, threshold);
        FillStatistics stats = result.statistics();
        if (stats.rounds() > 0) {
            log.debug("{} took {} ms ({} rounds, {} tile tasks, processing {} ms, merging {} ms)",
                    algorithm, stats.elapsedMillis(), stats.rounds(), stats.tileTasks(),
                    stats.processingNanos() / 1_000_000.0, stats.mergeNanos() / 1_000_000.0);
        } else {
            log.debug("{} took {} ms", algorithm, stats.elapsedMillis());
        }
        return result;
    }
}
