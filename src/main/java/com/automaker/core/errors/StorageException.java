package com.automaker.core.errors;

/**
 * Wraps I/O failures from the project's {@code .automaker} store.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
