package com.project.image.selection.exceptions;

/** Domain-specific exception for selection requests that cannot be served. */
public class SelectionException extends RuntimeException {
    public SelectionException(String message) { super(message); }
    public SelectionException(String message, Throwable cause) { super(message, cause); }
}
