package com.project.image.selection.floodfill;

import java.awt.Point;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Per-pixel fill with an explicit stack. Slow, but the simplest statement of the selection
 * semantics; the other fills must produce exactly the same mask.
 */
public final class SerialFloodFill implements FloodFill {

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
        int w = reference.width(), h = reference.height();
        Deque<Point> nodes = new ArrayDeque<>();
        nodes.push(new Point(seed));

        while (!nodes.isEmpty()) {
            Point p = nodes.pop();
            if (mask.get(p.x, p.y) > 0) {
                continue;
            }
            int value = reference.get(p.x, p.y);
            if (!criteria.includes(value)) {
                continue;
            }
            mask.set(p.x, p.y, criteria.selectionValue(value));

            if (p.x > 0) nodes.push(new Point(p.x - 1, p.y));
            if (p.x < w - 1) nodes.push(new Point(p.x + 1, p.y));
            if (p.y > 0) nodes.push(new Point(p.x, p.y - 1));
            if (p.y < h - 1) nodes.push(new Point(p.x, p.y + 1));
        }

        return new FillResult(mask, FillStatistics.serial(System.nanoTime() - start));
    }
}
