package com.project.image.selection.floodfill;

import java.awt.Point;
import java.util.List;

/**
 * Runs a fill restricted to one tile. Growth that reaches the tile's edge is not written but
 * returned as propagation requests for the neighbouring tile; growth that reaches the image's
 * edge stops.
 *
 * @param <S> seed type exchanged between tiles
 */
public abstract class TileWorker<S> {

    /** Seed that starts a fill at {@code seed} in its home tile. */
    public abstract S initialSeed(Point seed);

    /**
     * Fills inside {@code mask.region()} from {@code seeds} and writes the result back through the
     * view. Safe to run concurrently with workers holding views of other tiles.
     */
    public TilePropagation<S> processTile(PixelBuffer reference, TileView mask, List<S> seeds,
                                          FillCriteria criteria, TileId tileId, Region globalRect) {
        TileBuffer tile = TileBuffer.load(reference, mask);
        TilePropagation<S> propagation = new TilePropagation<>();
        fill(tile, seeds, criteria, tileId, globalRect, propagation);
        tile.store(mask);
        return propagation;
    }

    abstract void fill(TileBuffer tile, List<S> seeds, FillCriteria criteria, TileId tileId,
                       Region globalRect, TilePropagation<S> propagation);
}
