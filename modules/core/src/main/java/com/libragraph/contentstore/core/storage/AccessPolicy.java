package com.libragraph.contentstore.core.storage;

public enum AccessPolicy {
    /** Readable only with store credentials. */
    PRIVATE,
    /** Anonymously readable, e.g. from a CDN or browser. */
    PUBLIC_READ
}
