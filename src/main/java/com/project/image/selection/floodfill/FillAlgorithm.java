package com.project.image.selection.floodfill;

public enum FillAlgorithm {
    NAIVE("Naive"),
    SCANLINE("Scanline"),
    NAIVE_PARALLEL("Naive, tile-parallel"),
    SCANLINE_PARALLEL("Scanline, tile-parallel");

    private final String label;

    FillAlgorithm(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
