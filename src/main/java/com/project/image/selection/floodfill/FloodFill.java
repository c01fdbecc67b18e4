package com.project.image.selection.floodfill;

import java.awt.Point;

/**
 * Magic-wand selection: grows a graded mask from {@code seed} over pixels whose intensity is within
 * {@code threshold} of the seed's.
 */
public interface FloodFill {

    /**
     * @param reference single-channel image, not modified
     * @param seed      start pixel; a seed outside the image yields an all-zero mask
     * @param threshold in [0, 255]
     * @return a newly allocated mask of the reference's size, plus diagnostics
     */
    FillResult fill(PixelBuffer reference, Point seed, int threshold);
}
