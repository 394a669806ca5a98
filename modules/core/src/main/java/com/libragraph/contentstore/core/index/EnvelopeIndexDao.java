package com.libragraph.contentstore.core.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jdbi.v3.json.Json;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public interface EnvelopeIndexDao {

    @SqlUpdate("CREATE TABLE IF NOT EXISTS envelope_index (" +
            "content_id TEXT PRIMARY KEY, " +
            "document JSONB NOT NULL, " +
            "indexed_at TIMESTAMPTZ NOT NULL DEFAULT now())")
    void createTable();

    @SqlUpdate("CREATE INDEX IF NOT EXISTS envelope_index_document_idx " +
            "ON envelope_index USING GIN (document jsonb_path_ops)")
    void createDocumentIndex();

    @SqlUpdate("INSERT INTO envelope_index (content_id, document) VALUES (:contentId, :document) " +
            "ON CONFLICT (content_id) DO UPDATE SET document = EXCLUDED.document, indexed_at = now()")
    void upsert(@Bind("contentId") String contentId, @Bind("document") @Json ObjectNode document);

    @SqlUpdate("DELETE FROM envelope_index WHERE content_id = :contentId")
    int delete(@Bind("contentId") String contentId);
}
