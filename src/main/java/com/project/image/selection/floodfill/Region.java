package com.project.image.selection.floodfill;

/**
 * Axis-aligned rectangle in pixel coordinates. {@link #right()} and {@link #bottom()} are inclusive.
 */
public record Region(int x, int y, int width, int height) {

    public Region {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative region size: " + width + "x" + height);
        }
    }

    public int left() { return x; }
    public int top() { return y; }
    public int right() { return x + width - 1; }
    public int bottom() { return y + height - 1; }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public int area() {
        return width * height;
    }

    public boolean contains(int px, int py) {
        return px >= x && px <= right() && py >= y && py <= bottom();
    }

    public boolean contains(Region other) {
        return !other.isEmpty()
                && other.x >= x && other.right() <= right()
                && other.y >= y && other.bottom() <= bottom();
    }

    public Region intersect(Region other) {
        int l = Math.max(x, other.x);
        int t = Math.max(y, other.y);
        int r = Math.min(right(), other.right());
        int b = Math.min(bottom(), other.bottom());
        if (r < l || b < t) {
            return new Region(l, t, 0, 0);
        }
        return new Region(l, t, r - l + 1, b - t + 1);
    }
}
