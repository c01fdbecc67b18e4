package com.project.image.selection.exceptions;

/** Failures storing or loading uploaded and rendered images. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
