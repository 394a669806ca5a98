package com.libragraph.contentstore.core.storage;

/**
 * Thrown when a read or delete targets an object that does not exist.
 */
public class BlobNotFoundException extends RuntimeException {

    private final String container;
    private final String key;

    public BlobNotFoundException(String container, String key) {
        super("Blob not found: container=" + container + " key=" + key);
        this.container = container;
        this.key = key;
    }

    public String container() {
        return container;
    }

    public String key() {
        return key;
    }
}
