package com.project.image.selection.floodfill;

import java.awt.Point;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Span-based tile fill; the tile-bounded version of {@link ScanlineFloodFill}.
 * <p>
 * A run that reaches the tile's left or right edge hands the next pixel over as a one-pixel span.
 * Child spans on a row above or below the tile go to that tile unchanged, since a run never leaves
 * its tile's columns.
 */
public final class ScanlineTileWorker extends TileWorker<Span> {

    @Override
    public Span initialSeed(Point seed) {
        return Span.seed(seed.x, seed.y);
    }

    @Override
    void fill(TileBuffer tile, List<Span> seeds, FillCriteria criteria, TileId tileId,
              Region globalRect, TilePropagation<Span> propagation) {
        Region tileRect = tile.region();
        Deque<Span> spans = new ArrayDeque<>(seeds);

        while (!spans.isEmpty()) {
            Span span = spans.pop();
            int y = span.y();
            if (y < tileRect.top() || y > tileRect.bottom()
                    || span.x1() < tileRect.left() || span.x2() > tileRect.right()) {
                throw new IllegalStateException("Span " + span + " routed to tile " + tileId + " " + tileRect);
            }

            int x = span.x1();
            int runStart = x;
            if (tile.isFillable(x, y, criteria)) {
                while (true) {
                    int left = runStart - 1;
                    if (left < globalRect.left()) {
                        break;
                    }
                    if (left < tileRect.left()) {
                        propagation.add(tileId.left(), new Span(left, left, y, span.dy()));
                        break;
                    }
                    if (!tile.fill(left, y, criteria)) {
                        break;
                    }
                    runStart = left;
                }
            }

            while (x <= span.x2()) {
                while (x <= tileRect.right() && tile.fill(x, y, criteria)) {
                    x++;
                }
                // ran off the tile with the edge pixel filled
                if (x > tileRect.right() && x <= globalRect.right()) {
                    propagation.add(tileId.right(), new Span(x, x, y, span.dy()));
                }
                if (x > runStart) {
                    pushChild(spans, propagation, new Span(runStart, x - 1, y - span.dy(), -span.dy()),
                            tileRect, globalRect, tileId);
                    pushChild(spans, propagation, new Span(runStart, x - 1, y + span.dy(), span.dy()),
                            tileRect, globalRect, tileId);
                }
                x++;
                while (x <= span.x2() && !tile.isFillable(x, y, criteria)) {
                    x++;
                }
                runStart = x;
            }
        }
    }

    private static void pushChild(Deque<Span> spans, TilePropagation<Span> propagation, Span child,
                                  Region tileRect, Region globalRect, TileId tileId) {
        int y = child.y();
        if (y < globalRect.top() || y > globalRect.bottom()) {
            return;
        }
        if (y < tileRect.top()) {
            propagation.add(tileId.up(), child);
        } else if (y > tileRect.bottom()) {
            propagation.add(tileId.down(), child);
        } else {
            spans.push(child);
        }
    }
}
