package com.libragraph.contentstore.core.storage;

import com.libragraph.contentstore.util.buffer.BinaryData;
import com.libragraph.contentstore.util.buffer.RamBuffer;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed BlobStore. Contents are lost on restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "content.blob-store.type", stringValue = "memory")
public class InMemoryBlobStore implements BlobStore {

    public record StoredObject(byte[] bytes, String mimeType, AccessPolicy access) {}

    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();

    private static String path(String container, String key) {
        return container + "/" + key;
    }

    @Override
    public Uni<BinaryData> read(String container, String key) {
        return Uni.createFrom().item(() -> {
            StoredObject stored = objects.get(path(container, key));
            if (stored == null) {
                throw new BlobNotFoundException(container, key);
            }
            return (BinaryData) new RamBuffer(stored.bytes().clone());
        });
    }

    @Override
    public Uni<Void> write(String container, String key, BinaryData data, String mimeType, AccessPolicy access) {
        return Uni.createFrom().voidItem().invoke(() -> {
            try {
                // the stream shares the caller's channel; closing it would close their buffer
                InputStream in = data.inputStream(0);
                objects.put(path(container, key), new StoredObject(in.readAllBytes(), mimeType, access));
            } catch (IOException e) {
                throw new StorageException("Failed to write blob: " + path(container, key), e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String container, String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (objects.remove(path(container, key)) == null) {
                throw new BlobNotFoundException(container, key);
            }
        });
    }

    /** Returns the stored object, or null. */
    public StoredObject get(String container, String key) {
        return objects.get(path(container, key));
    }
}
