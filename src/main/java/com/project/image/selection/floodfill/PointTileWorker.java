package com.project.image.selection.floodfill;

import java.awt.Point;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Per-pixel tile fill; the tile-bounded version of {@link SerialFloodFill}. */
public final class PointTileWorker extends TileWorker<Point> {

    @Override
    public Point initialSeed(Point seed) {
        return new Point(seed);
    }

    @Override
    void fill(TileBuffer tile, List<Point> seeds, FillCriteria criteria, TileId tileId,
              Region globalRect, TilePropagation<Point> propagation) {
        Region tileRect = tile.region();
        Deque<Point> nodes = new ArrayDeque<>(seeds);

        while (!nodes.isEmpty()) {
            Point p = nodes.pop();
            if (!tile.fill(p.x, p.y, criteria)) {
                continue;
            }

            if (p.y > globalRect.top()) {
                if (p.y > tileRect.top()) {
                    nodes.push(new Point(p.x, p.y - 1));
                } else {
                    propagation.add(tileId.up(), new Point(p.x, p.y - 1));
                }
            }
            if (p.y < globalRect.bottom()) {
                if (p.y < tileRect.bottom()) {
                    nodes.push(new Point(p.x, p.y + 1));
                } else {
                    propagation.add(tileId.down(), new Point(p.x, p.y + 1));
                }
            }
            if (p.x > globalRect.left()) {
                if (p.x > tileRect.left()) {
                    nodes.push(new Point(p.x - 1, p.y));
                } else {
                    propagation.add(tileId.left(), new Point(p.x - 1, p.y));
                }
            }
            if (p.x < globalRect.right()) {
                if (p.x < tileRect.right()) {
                    nodes.push(new Point(p.x + 1, p.y));
                } else {
                    propagation.add(tileId.right(), new Point(p.x + 1, p.y));
                }
            }
        }
    }
}
