package com.project.image.selection.exceptions;

/**
 * A tile task of a parallel fill failed or was interrupted. The whole fill is aborted; there is no
 * partial mask.
 */
public class FloodFillException extends RuntimeException {
    public FloodFillException(String message, Throwable cause) { super(message, cause); }
}
