package com.libragraph.contentstore.util;

import java.util.Objects;

/**
 * Caller-supplied identifier of one metadata envelope.
 *
 * <p>The raw value is opaque. {@link #storageKey()} escapes it as a URI
 * component so the key is safe to use as a blob name.
 */
public record ContentId(String value) {

    public ContentId {
        Objects.requireNonNull(value, "content ID cannot be null");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("content ID cannot be empty");
        }
    }

    public static ContentId of(String value) {
        return new ContentId(value);
    }

    /**
     * Returns the URL-escaped form used as the blob store key.
     */
    public String storageKey() {
        return UriComponents.escape(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
