package com.libragraph.contentstore.core.backend;

import com.libragraph.contentstore.core.storage.StorageException;

/**
 * A backend call failed (network, auth, quota, timeout).
 *
 * <p>Names the backend and the operation that failed. {@link #statusCode()}
 * is the HTTP status the backend supplied, or 500.
 */
public class BackendFailureException extends RuntimeException {

    private final Backend backend;
    private final String operation;
    private final String subject;

    public BackendFailureException(Backend backend, String operation, String subject, Throwable cause) {
        super(operation + " of [" + subject + "] failed at " + backend.label() + ": "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.backend = backend;
        this.operation = operation;
        this.subject = subject;
    }

    public Backend backend() {
        return backend;
    }

    public String operation() {
        return operation;
    }

    /** Content ID or asset name the operation was acting on. */
    public String subject() {
        return subject;
    }

    public int statusCode() {
        if (getCause() instanceof StorageException storage) {
            return storage.statusCode().orElse(500);
        }
        return 500;
    }
}
