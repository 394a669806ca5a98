package com.libragraph.contentstore.core.envelope;

import com.libragraph.contentstore.util.ContentId;

/**
 * Stored bytes for a content ID are not a JSON object.
 */
public class EnvelopeCorruptException extends RuntimeException {

    private final ContentId contentId;

    public EnvelopeCorruptException(ContentId contentId, Throwable cause) {
        super("Stored envelope for [" + contentId + "] is not valid JSON: " + cause.getMessage(), cause);
        this.contentId = contentId;
    }

    public ContentId contentId() {
        return contentId;
    }
}
