package com.libragraph.contentstore.core.asset;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * One uploaded binary awaiting fingerprinting.
 *
 * @param fieldName    form field the asset was uploaded under; the directory name for named assets
 * @param originalName client-side file name
 * @param contentType  declared MIME type (may be null)
 * @param size         declared size in bytes, or -1 if unknown
 * @param source       opens the asset's bytes; opened exactly once
 */
public record Asset(String fieldName, String originalName, String contentType, long size, Source source) {

    /** Opens the byte stream of an upload. */
    @FunctionalInterface
    public interface Source {
        InputStream open() throws IOException;
    }

    public Asset {
        Objects.requireNonNull(originalName, "originalName cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
        if (fieldName == null) {
            fieldName = originalName;
        }
    }
}
