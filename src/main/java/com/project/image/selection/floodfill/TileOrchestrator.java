package com.project.image.selection.floodfill;

import com.project.image.selection.exceptions.FloodFillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Point;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Tile-parallel fill driven in synchronous rounds.
 * <p>
 * Each round runs one {@link TileWorker} task per tile that has pending seeds. Tasks of a round
 * get views of pairwise different tiles, so they write disjoint parts of the mask without locking.
 * When every task has finished, their propagation requests are merged into the queue for the next
 * round. The fill ends when a round produces no requests.
 *
 * @param <S> seed type of the worker
 */
public final class TileOrchestrator<S> implements FloodFill {
    private static final Logger log = LoggerFactory.getLogger(TileOrchestrator.class);

    private final TileWorker<S> worker;
    private final int tileWidth;
    private final int tileHeight;
    private final ExecutorService executor;

    public TileOrchestrator(TileWorker<S> worker, int tileWidth, int tileHeight, ExecutorService executor) {
        if (tileWidth <= 0 || tileHeight <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileWidth + "x" + tileHeight);
        }
        this.worker = Objects.requireNonNull(worker, "worker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
    }

    @Override
    public FillResult fill(PixelBuffer reference, Point seed, int threshold) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(seed, "seed");
        FillCriteria.checkThreshold(threshold);
        long start = System.nanoTime();

        PixelBuffer mask = new PixelBuffer(reference.width(), reference.height());
        if (!reference.contains(seed.x, seed.y)) {
            return new FillResult(mask, FillStatistics.serial(System.nanoTime() - start));
        }

        FillCriteria criteria = new FillCriteria(reference.get(seed.x, seed.y), threshold);
        Region globalRect = reference.bounds();
        TileGrid grid = TileGrid.covering(globalRect, tileWidth, tileHeight);

        Map<TileId, List<S>> currentRound = new LinkedHashMap<>();
        currentRound.put(grid.tileOf(seed.x, seed.y), List.of(worker.initialSeed(seed)));

        int rounds = 0;
        int tasks = 0;
        long processingNanos = 0;
        long mergeNanos = 0;

        while (!currentRound.isEmpty()) {
            long roundStart = System.nanoTime();
            List<Future<TilePropagation<S>>> futures = new ArrayList<>(currentRound.size());
            for (Map.Entry<TileId, List<S>> entry : currentRound.entrySet()) {
                TileId tileId = entry.getKey();
                List<S> seeds = entry.getValue();
                TileView view = grid.view(mask, tileId);
                futures.add(executor.submit(
                        () -> worker.processTile(reference, view, seeds, criteria, tileId, globalRect)));
            }
            List<TilePropagation<S>> outputs = awaitRound(futures);
            rounds++;
            tasks += futures.size();

            long mergeStart = System.nanoTime();
            processingNanos += mergeStart - roundStart;
            currentRound = merge(outputs, grid);
            mergeNanos += System.nanoTime() - mergeStart;
        }

        FillStatistics statistics = new FillStatistics(System.nanoTime() - start, rounds, tasks,
                processingNanos, mergeNanos);
        log.trace("Tile fill settled after {} rounds, {} tile tasks on a {}x{} grid",
                rounds, tasks, grid.columns(), grid.rows());
        return new FillResult(mask, statistics);
    }

    private List<TilePropagation<S>> awaitRound(List<Future<TilePropagation<S>>> futures) {
        List<TilePropagation<S>> outputs = new ArrayList<>(futures.size());
        try {
            for (Future<TilePropagation<S>> future : futures) {
                outputs.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new FloodFillException("Interrupted while waiting for tile tasks", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new FloodFillException("Tile task failed: " + e.getCause().getMessage(), e.getCause());
        }
        return outputs;
    }

    private Map<TileId, List<S>> merge(List<TilePropagation<S>> outputs, TileGrid grid) {
        Map<TileId, List<S>> nextRound = new LinkedHashMap<>();
        for (TilePropagation<S> output : outputs) {
            for (Map.Entry<TileId, List<S>> target : output.targets().entrySet()) {
                TileId destination = target.getKey();
                if (!grid.contains(destination) || target.getValue().isEmpty()) {
                    continue;
                }
                nextRound.computeIfAbsent(destination, k -> new ArrayList<>()).addAll(target.getValue());
            }
        }
        return nextRound;
    }
}
