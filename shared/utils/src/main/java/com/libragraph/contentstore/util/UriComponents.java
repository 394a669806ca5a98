package com.libragraph.contentstore.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding for a single URI component (path segment or key).
 *
 * <p>Unreserved characters ({@code A-Z a-z 0-9 - _ . ! ~ * ' ( )}) pass
 * through; everything else is encoded as UTF-8. A component made only of
 * dots is encoded in full, since "." and ".." are path navigation rather
 * than names.
 */
public final class UriComponents {

    private UriComponents() {
    }

    public static String escape(String component) {
        if (!component.isEmpty() && component.chars().allMatch(c -> c == '.')) {
            return component.replace(".", "%2E");
        }
        // URLEncoder does form encoding; undo the spots where it differs
        return URLEncoder.encode(component, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }
}
