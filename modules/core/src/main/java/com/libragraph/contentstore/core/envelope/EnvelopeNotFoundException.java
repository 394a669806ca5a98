package com.libragraph.contentstore.core.envelope;

import com.libragraph.contentstore.util.ContentId;

/**
 * No envelope is stored under the requested content ID.
 */
public class EnvelopeNotFoundException extends RuntimeException {

    private final ContentId contentId;

    public EnvelopeNotFoundException(ContentId contentId, Throwable cause) {
        super("No content for ID [" + contentId + "]", cause);
        this.contentId = contentId;
    }

    public ContentId contentId() {
        return contentId;
    }
}
