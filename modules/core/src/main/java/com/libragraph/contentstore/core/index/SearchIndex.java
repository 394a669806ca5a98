package com.libragraph.contentstore.core.index;

import com.libragraph.contentstore.util.ContentId;
import io.smallrye.mutiny.Uni;

/**
 * Secondary, queryable store of envelope projections keyed by content ID.
 */
public interface SearchIndex {

    /**
     * Inserts the document, replacing any existing document for the same content ID.
     *
     * @throws IndexException on backend errors
     */
    Uni<Void> upsert(IndexDocument document);

    /**
     * Removes the document for a content ID.
     *
     * @return true if a document was removed, false if none existed
     * @throws IndexException on backend errors
     */
    Uni<Boolean> remove(ContentId contentId);
}
