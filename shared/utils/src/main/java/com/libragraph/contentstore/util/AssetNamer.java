package com.libragraph.contentstore.util;

import java.util.Objects;

/**
 * Derives content-addressed storage names for uploaded assets.
 *
 * <p>Format: {@code {basename}-{sha256hex}{ext}}, e.g.
 * {@code logo.png} with digest {@code ab12...} becomes {@code logo-ab12....png}.
 * Any directory portion of the original name is dropped.
 */
public final class AssetNamer {

    private AssetNamer() {
    }

    /**
     * Returns the fingerprinted name for an asset.
     *
     * @param originalName the name the asset was uploaded under
     * @param digest       hash of the asset's bytes
     */
    public static String fingerprintedName(String originalName, ContentHash digest) {
        Objects.requireNonNull(originalName, "originalName cannot be null");
        Objects.requireNonNull(digest, "digest cannot be null");

        String fileName = stripDirectories(originalName);
        String ext = extension(fileName);
        String base = fileName.substring(0, fileName.length() - ext.length());
        return base + "-" + digest.toHex() + ext;
    }

    /**
     * Returns the extension of a file name including the leading dot, or an
     * empty string. A leading dot (as in {@code .profile}) does not start an
     * extension.
     */
    public static String extension(String fileName) {
        String name = stripDirectories(fileName);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot);
    }

    private static String stripDirectories(String name) {
        String trimmed = name;
        while (trimmed.endsWith("/") || trimmed.endsWith("\\")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }
}
