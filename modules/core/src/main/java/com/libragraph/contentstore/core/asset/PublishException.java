package com.libragraph.contentstore.core.asset;

/**
 * A fingerprinted asset could not be uploaded or registered.
 */
public class PublishException extends RuntimeException {

    private final String fingerprintedName;

    public PublishException(String fingerprintedName, Throwable cause) {
        super("Unable to publish [" + fingerprintedName + "]: "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.fingerprintedName = fingerprintedName;
    }

    public String fingerprintedName() {
        return fingerprintedName;
    }
}
