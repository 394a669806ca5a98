package com.libragraph.contentstore.core.asset;

/**
 * The asset's byte stream could not be read completely while hashing.
 */
public class FingerprintException extends RuntimeException {

    private final String originalName;

    public FingerprintException(String originalName, String message, Throwable cause) {
        super("Unable to fingerprint [" + originalName + "]: " + message, cause);
        this.originalName = originalName;
    }

    public String originalName() {
        return originalName;
    }
}
