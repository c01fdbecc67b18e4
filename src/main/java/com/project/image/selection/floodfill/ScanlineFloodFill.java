package com.project.image.selection.floodfill;

import java.awt.Point;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Span-based fill: each popped {@link Span} is scanned as whole horizontal runs, and every run
 * found schedules the rows directly above and below it.
 */
public final class ScanlineFloodFill implements FloodFill {

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
        int width = reference.width(), height = reference.height();
        Deque<Span> spans = new ArrayDeque<>();
        spans.push(Span.seed(seed.x, seed.y));

        while (!spans.isEmpty()) {
            Span span = spans.pop();
            int y = span.y();
            if (y < 0 || y >= height) {
                continue;
            }

            int x = span.x1();
            int runStart = x;
            if (isFillable(reference, mask, x, y, criteria)) {
                while (runStart > 0 && fillPixel(reference, mask, runStart - 1, y, criteria)) {
                    runStart--;
                }
            }

            while (x <= span.x2()) {
                while (x < width && fillPixel(reference, mask, x, y, criteria)) {
                    x++;
                }
                if (x > runStart) {
                    spans.push(new Span(runStart, x - 1, y - span.dy(), -span.dy()));
                    spans.push(new Span(runStart, x - 1, y + span.dy(), span.dy()));
                }
                x++;
                while (x <= span.x2() && !isFillable(reference, mask, x, y, criteria)) {
                    x++;
                }
                runStart = x;
            }
        }

        return new FillResult(mask, FillStatistics.serial(System.nanoTime() - start));
    }

    private static boolean isFillable(PixelBuffer reference, PixelBuffer mask, int x, int y, FillCriteria criteria) {
        return mask.get(x, y) == 0 && criteria.includes(reference.get(x, y));
    }

    private static boolean fillPixel(PixelBuffer reference, PixelBuffer mask, int x, int y, FillCriteria criteria) {
        if (mask.get(x, y) != 0) {
            return false;
        }
        int value = reference.get(x, y);
        if (!criteria.includes(value)) {
            return false;
        }
        mask.set(x, y, criteria.selectionValue(value));
        return true;
    }
}
