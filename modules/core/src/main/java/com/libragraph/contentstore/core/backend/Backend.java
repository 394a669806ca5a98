package com.libragraph.contentstore.core.backend;

/**
 * External services the coordinators write to.
 */
public enum Backend {
    BLOB_STORE("blob store"),
    SEARCH_INDEX("search index"),
    ASSET_DIRECTORY("asset directory");

    private final String label;

    Backend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
