package com.libragraph.contentstore.core.index;

/**
 * Wraps driver exceptions from the search index and asset directory tables.
 */
public class IndexException extends RuntimeException {

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
