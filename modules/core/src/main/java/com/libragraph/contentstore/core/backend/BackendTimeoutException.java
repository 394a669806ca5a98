package com.libragraph.contentstore.core.backend;

import java.time.Duration;

/**
 * A backend call did not complete before its deadline.
 */
public class BackendTimeoutException extends RuntimeException {

    private final Duration deadline;

    public BackendTimeoutException(Duration deadline) {
        super("No response within " + deadline);
        this.deadline = deadline;
    }

    public Duration deadline() {
        return deadline;
    }
}
