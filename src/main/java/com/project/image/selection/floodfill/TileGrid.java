package com.project.image.selection.floodfill;

/**
 * Fixed grid of tiles covering an image. Tiles do not overlap; the last column and row are clipped
 * to the image bounds.
 */
public final class TileGrid {
    private final Region bounds;
    private final int tileWidth;
    private final int tileHeight;
    private final int columns;
    private final int rows;

    private TileGrid(Region bounds, int tileWidth, int tileHeight) {
        this.bounds = bounds;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.columns = (bounds.width() + tileWidth - 1) / tileWidth;
        this.rows = (bounds.height() + tileHeight - 1) / tileHeight;
    }

    public static TileGrid covering(Region bounds, int tileWidth, int tileHeight) {
        if (tileWidth <= 0 || tileHeight <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileWidth + "x" + tileHeight);
        }
        if (bounds.isEmpty() || bounds.x() != 0 || bounds.y() != 0) {
            throw new IllegalArgumentException("Grid bounds must be a non-empty image rectangle: " + bounds);
        }
        return new TileGrid(bounds, tileWidth, tileHeight);
    }

    public Region bounds() { return bounds; }
    public int columns() { return columns; }
    public int rows() { return rows; }

    public boolean contains(TileId id) {
        return id.tx() >= 0 && id.tx() < columns && id.ty() >= 0 && id.ty() < rows;
    }

    /** Tile owning pixel {@code (x, y)}. */
    public TileId tileOf(int x, int y) {
        if (!bounds.contains(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + bounds);
        }
        return new TileId(x / tileWidth, y / tileHeight);
    }

    /**
     * Pixel rectangle of a tile, clipped to the image.
     *
     * @throws IllegalArgumentException for ids outside the grid
     */
    public Region regionOf(TileId id) {
        if (!contains(id)) {
            throw new IllegalArgumentException("Tile " + id + " outside " + columns + "x" + rows + " grid");
        }
        return new Region(id.tx() * tileWidth, id.ty() * tileHeight, tileWidth, tileHeight).intersect(bounds);
    }

    /** Write handle on {@code mask} limited to the tile's rectangle. */
    public TileView view(PixelBuffer mask, TileId id) {
        return mask.view(regionOf(id));
    }
}
