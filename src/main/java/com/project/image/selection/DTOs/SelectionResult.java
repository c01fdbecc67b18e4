package com.project.image.selection.DTOs;

import com.project.image.selection.floodfill.FillAlgorithm;

public record SelectionResult(
        int width,
        int height,
        int seedX,
        int seedY,
        int seedValue,          // -1 when the seed is outside the image
        int threshold,
        FillAlgorithm algorithm,
        int selectedPixels,     // mask > 0
        int fullySelectedPixels, // mask == 255
        double areaPercent,
        int rounds,
        int tileTasks,
        double elapsedMillis,
        byte[] maskPng,         // the graded mask itself, grayscale
        byte[] overlayPng       // mask used as alpha of the tint over the reference
) {}
