package com.libragraph.contentstore.core.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Searchable projection of an envelope: its content ID plus whichever
 * projected fields the envelope carried. Absent fields stay absent.
 */
public record IndexDocument(String contentId, Map<String, JsonNode> fields) {

    public static final String CONTENT_ID_FIELD = "content_id";

    public IndexDocument {
        Objects.requireNonNull(contentId, "contentId cannot be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Renders the document as stored in the index:
     * {@code {content_id, ...fields}}.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(CONTENT_ID_FIELD, contentId);
        fields.forEach((name, value) -> node.set(name, value.deepCopy()));
        return node;
    }
}
