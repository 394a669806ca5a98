package com.libragraph.contentstore.core.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.contentstore.core.index.IndexDocument;
import com.libragraph.contentstore.util.ContentId;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A caller-supplied metadata document. Opaque except for the fields copied
 * into the search index.
 */
public final class Envelope {

    /** Fields copied into the {@link IndexDocument}, when present. */
    public static final List<String> PROJECTED_FIELDS = List.of("title", "publish_date", "tags", "categories");

    /** Field that retrieval fills from the asset directory. */
    public static final String ASSETS_FIELD = "assets";

    private final ObjectNode document;

    public Envelope(ObjectNode document) {
        Objects.requireNonNull(document, "document cannot be null");
        this.document = document.deepCopy();
    }

    /**
     * Parses an envelope from JSON.
     *
     * @throws IOException              if the input is not well-formed JSON
     * @throws IllegalArgumentException if the JSON is not an object
     */
    public static Envelope parse(ObjectMapper mapper, InputStream json) throws IOException {
        JsonNode node = mapper.readTree(json);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Envelope must be a JSON object, got: "
                    + (node == null ? "empty input" : node.getNodeType()));
        }
        return new Envelope((ObjectNode) node);
    }

    public ObjectNode document() {
        return document.deepCopy();
    }

    /** UTF-8 JSON as stored in the blob store. */
    public byte[] toJson(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize envelope", e);
        }
    }

    public IndexDocument project(ContentId contentId) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        for (String field : PROJECTED_FIELDS) {
            JsonNode value = document.get(field);
            if (value != null) {
                fields.put(field, value);
            }
        }
        return new IndexDocument(contentId.value(), fields);
    }

    /**
     * Returns a copy with {@code assets} set to the given name-to-URL mapping.
     */
    public Envelope withAssets(Map<String, String> assets) {
        ObjectNode copy = document.deepCopy();
        ObjectNode assetsNode = copy.putObject(ASSETS_FIELD);
        assets.forEach(assetsNode::put);
        return new Envelope(copy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Envelope other)) return false;
        return document.equals(other.document);
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return document.toString();
    }
}
