package com.project.image.selection.floodfill;

/**
 * Grid coordinates of a tile. Neighbours may fall outside the grid (negative or past the last
 * column/row); {@link TileGrid#contains(TileId)} decides whether such an id is usable.
 */
public record TileId(int tx, int ty) {

    public TileId left() { return new TileId(tx - 1, ty); }
    public TileId right() { return new TileId(tx + 1, ty); }
    public TileId up() { return new TileId(tx, ty - 1); }
    public TileId down() { return new TileId(tx, ty + 1); }
}
