package com.libragraph.contentstore.core.storage;

import com.libragraph.contentstore.util.buffer.BinaryData;
import com.libragraph.contentstore.util.buffer.RamBuffer;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class InMemoryBlobStoreTest {

    private final InMemoryBlobStore store = new InMemoryBlobStore();

    @Test
    void recordsContentTypeAndAccess() {
        store.write("assets", "logo-1.png", new RamBuffer("png".getBytes()), "image/png", AccessPolicy.PUBLIC_READ)
                .await().indefinitely();

        InMemoryBlobStore.StoredObject stored = store.get("assets", "logo-1.png");
        assertThat(stored.mimeType()).isEqualTo("image/png");
        assertThat(stored.access()).isEqualTo(AccessPolicy.PUBLIC_READ);
    }

    @Test
    void writeLeavesCallerBufferOpen() throws IOException {
        RamBuffer buffer = new RamBuffer("payload".getBytes());

        store.write("c", "k", buffer, null, AccessPolicy.PRIVATE).await().indefinitely();

        assertThat(buffer.isOpen()).isTrue();
        assertThat(buffer.inputStream(0).readAllBytes()).isEqualTo("payload".getBytes());
    }

    @Test
    void readReturnsIndependentCopy() throws IOException {
        store.write("c", "k", new RamBuffer("abc".getBytes()), null, AccessPolicy.PRIVATE).await().indefinitely();

        try (BinaryData read = store.read("c", "k").await().indefinitely()) {
            assertThat(read.inputStream(0).readAllBytes()).isEqualTo("abc".getBytes());
        }
        assertThat(store.get("c", "k")).isNotNull();
    }

    @Test
    void missingObjectsAreNotFound() {
        assertThatThrownBy(() -> store.read("c", "missing").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
        assertThatThrownBy(() -> store.delete("c", "missing").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }
}
