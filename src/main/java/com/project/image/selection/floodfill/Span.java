package com.project.image.selection.floodfill;

/**
 * Horizontal run {@code [x1, x2]} on row {@code y}. {@code dy} is +1 or -1, the direction the fill
 * was moving when the span was created.
 */
public record Span(int x1, int x2, int y, int dy) {

    public static Span seed(int x, int y) {
        return new Span(x, x, y, 1);
    }
}
