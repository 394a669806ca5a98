package com.libragraph.contentstore.core.asset;

import com.libragraph.contentstore.util.ContentHash;
import com.libragraph.contentstore.util.buffer.Buffer;

import java.io.IOException;

/**
 * Digest of an asset together with the retained bytes that produced it.
 * Closing releases the buffer (and its temp file, if any).
 */
public record Fingerprint(ContentHash digest, Buffer bytes) implements AutoCloseable {

    public long size() {
        return bytes.size();
    }

    @Override
    public void close() throws IOException {
        bytes.close();
    }
}
