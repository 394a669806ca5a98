package com.libragraph.contentstore.core.storage;

import java.util.OptionalInt;

/**
 * Wraps checked I/O and client exceptions from blob store operations.
 *
 * <p>Carries the HTTP status code the backend answered with, when there was one.
 */
public class StorageException extends RuntimeException {

    private final int statusCode;

    public StorageException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public StorageException(String message, Throwable cause, int statusCode) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public StorageException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public OptionalInt statusCode() {
        return statusCode > 0 ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }
}
