package com.project.image.selection.floodfill;

import java.util.Arrays;

/**
 * Single-channel 8-bit raster, stored row-major. Samples are exposed as unsigned ints in [0, 255].
 * <p>
 * Used both for the reference image (read-only during a fill) and for the selection mask
 * produced by a fill.
 */
public final class PixelBuffer {
    private final int width;
    private final int height;
    private final byte[] pixels;

    /** Zero-filled buffer. */
    public PixelBuffer(int width, int height) {
        this(width, height, new byte[checkedArea(width, height)]);
    }

    /**
     * Wraps {@code pixels} without copying; the caller hands over ownership of the array.
     */
    public PixelBuffer(int width, int height, byte[] pixels) {
        if (pixels.length != checkedArea(width, height)) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples for "
                    + width + "x" + height + ", got " + pixels.length);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /** Builds a buffer from row-major sample values, each clamped to a byte. Handy for small fixtures. */
    public static PixelBuffer of(int width, int height, int... values) {
        byte[] data = new byte[checkedArea(width, height)];
        if (values.length != data.length) {
            throw new IllegalArgumentException("Expected " + data.length + " values, got " + values.length);
        }
        for (int i = 0; i < values.length; i++) {
            data[i] = (byte) values[i];
        }
        return new PixelBuffer(width, height, data);
    }

    public static PixelBuffer filled(int width, int height, int value) {
        byte[] data = new byte[checkedArea(width, height)];
        Arrays.fill(data, (byte) value);
        return new PixelBuffer(width, height, data);
    }

    private static int checkedArea(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must not be empty: " + width + "x" + height);
        }
        return Math.multiplyExact(width, height);
    }

    public int width() { return width; }
    public int height() { return height; }

    public Region bounds() {
        return new Region(0, 0, width, height);
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int get(int x, int y) {
        return pixels[index(x, y)] & 0xFF;
    }

    public void set(int x, int y, int value) {
        pixels[index(x, y)] = (byte) value;
    }

    private int index(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
        }
        return y * width + x;
    }

    /**
     * Returns a handle that can read and write only inside {@code region}.
     *
     * @throws IllegalArgumentException if the region is empty or not fully inside this buffer
     */
    public TileView view(Region region) {
        if (!bounds().contains(region)) {
            throw new IllegalArgumentException("Region " + region + " outside image " + width + "x" + height);
        }
        return new TileView(this, region);
    }

    /** Copies the samples of {@code region} row by row into {@code target}, starting at index 0. */
    public void read(Region region, byte[] target) {
        if (!bounds().contains(region)) {
            throw new IllegalArgumentException("Region " + region + " outside image " + width + "x" + height);
        }
        for (int row = 0; row < region.height(); row++) {
            System.arraycopy(pixels, (region.y() + row) * width + region.x(),
                    target, row * region.width(), region.width());
        }
    }

    // only reachable through TileView, which has already validated the region
    void write(Region region, byte[] source) {
        for (int row = 0; row < region.height(); row++) {
            System.arraycopy(source, row * region.width(),
                    pixels, (region.y() + row) * width + region.x(), region.width());
        }
    }

    /** Number of non-zero samples. */
    public int countNonZero() {
        int count = 0;
        for (byte p : pixels) {
            if (p != 0) count++;
        }
        return count;
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, pixels.clone());
    }

    /** Row-major copy of the samples. */
    public byte[] toByteArray() {
        return pixels.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer other)) return false;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
