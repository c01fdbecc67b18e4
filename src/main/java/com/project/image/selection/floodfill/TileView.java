package com.project.image.selection.floodfill;

/**
 * Window onto a {@link PixelBuffer} that can only address one rectangle. Coordinates are global
 * image coordinates; anything outside {@link #region()} is rejected, so a worker holding a view
 * cannot write into a neighbouring tile.
 */
public final class TileView {
    private final PixelBuffer image;
    private final Region region;

    TileView(PixelBuffer image, Region region) {
        this.image = image;
        this.region = region;
    }

    public Region region() {
        return region;
    }

    public int get(int x, int y) {
        check(x, y);
        return image.get(x, y);
    }

    public void set(int x, int y, int value) {
        check(x, y);
        image.set(x, y, value);
    }

    /** Copies the whole rectangle into {@code target}, row-major with stride {@code region().width()}. */
    public void readInto(byte[] target) {
        image.read(region, target);
    }

    /** Overwrites the whole rectangle from {@code source}, row-major with stride {@code region().width()}. */
    public void writeFrom(byte[] source) {
        if (source.length < region.area()) {
            throw new IllegalArgumentException("Need " + region.area() + " samples, got " + source.length);
        }
        image.write(region, source);
    }

    private void check(int x, int y) {
        if (!region.contains(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside tile " + region);
        }
    }
}
