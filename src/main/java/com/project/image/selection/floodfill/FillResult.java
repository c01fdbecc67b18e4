package com.project.image.selection.floodfill;

public record FillResult(PixelBuffer mask, FillStatistics statistics) {}
