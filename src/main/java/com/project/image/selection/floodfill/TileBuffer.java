package com.project.image.selection.floodfill;

/**
 * Local copy of one tile's reference and mask samples. Addressed with global coordinates; the
 * offset to the tile origin is applied here so the fill loops don't have to.
 */
final class TileBuffer {
    private final Region region;
    private final byte[] reference;
    private final byte[] mask;

    private TileBuffer(Region region) {
        this.region = region;
        this.reference = new byte[region.area()];
        this.mask = new byte[region.area()];
    }

    static TileBuffer load(PixelBuffer referenceImage, TileView maskView) {
        TileBuffer tile = new TileBuffer(maskView.region());
        referenceImage.read(tile.region, tile.reference);
        maskView.readInto(tile.mask);
        return tile;
    }

    void store(TileView maskView) {
        maskView.writeFrom(mask);
    }

    Region region() {
        return region;
    }

    boolean isFillable(int x, int y, FillCriteria criteria) {
        int i = index(x, y);
        return mask[i] == 0 && criteria.includes(reference[i] & 0xFF);
    }

    /** Marks the pixel if it is unmarked and included; returns whether it did. */
    boolean fill(int x, int y, FillCriteria criteria) {
        int i = index(x, y);
        if (mask[i] != 0) {
            return false;
        }
        int value = reference[i] & 0xFF;
        if (!criteria.includes(value)) {
            return false;
        }
        mask[i] = (byte) criteria.selectionValue(value);
        return true;
    }

    private int index(int x, int y) {
        if (!region.contains(x, y)) {
            throw new IllegalStateException("(" + x + "," + y + ") is not owned by tile " + region);
        }
        return (y - region.y()) * region.width() + (x - region.x());
    }
}
