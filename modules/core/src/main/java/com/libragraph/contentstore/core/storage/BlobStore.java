package com.libragraph.contentstore.core.storage;

import com.libragraph.contentstore.util.buffer.BinaryData;
import io.smallrye.mutiny.Uni;

/**
 * Primary durable store for envelopes and published assets.
 *
 * <p>Objects are grouped in named containers (buckets) and addressed by a
 * string key. Keys are expected to be storage-safe already: envelope keys are
 * URL-escaped content IDs, asset keys are fingerprinted names.
 *
 * <p>All operations are lazy; nothing happens until the returned {@link Uni}
 * is subscribed.
 */
public interface BlobStore {

    /**
     * Reads an object.
     *
     * @throws BlobNotFoundException if the object does not exist
     * @throws StorageException on backend errors
     */
    Uni<BinaryData> read(String container, String key);

    /**
     * Writes an object, replacing any existing object under the same key.
     *
     * @param mimeType content type recorded with the object (may be null)
     * @param access   who may read the object directly from the store
     * @throws StorageException on backend errors
     */
    Uni<Void> write(String container, String key, BinaryData data, String mimeType, AccessPolicy access);

    /**
     * Deletes an object.
     *
     * @throws BlobNotFoundException if the object does not exist
     * @throws StorageException on backend errors
     */
    Uni<Void> delete(String container, String key);
}
