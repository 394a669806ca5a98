package com.libragraph.contentstore.util.buffer;

import com.libragraph.contentstore.util.ContentHash;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.security.MessageDigest;

/**
 * Append-only buffer that extends BinaryData with write capabilities.
 *
 * Every write must land at the current end of the buffer, so the SHA-256
 * digest is updated incrementally as bytes arrive and {@link #hash()}
 * never rereads the contents. Reads may seek freely.
 *
 * Factory method allocates appropriate backend (RAM or file)
 * based on size thresholds.
 */
public abstract class Buffer extends BinaryData {

    /** Size at and above which allocate() uses a temp file instead of RAM. */
    public static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    private final MessageDigest incrementalHash = DigestUtils.getSha256Digest();
    private ContentHash cachedHash = null;

    /**
     * Allocates a buffer for the given expected size.
     * Chooses backend automatically based on size:
     * <ul>
     *   <li>&lt; 4 MB: {@link RamBuffer} (heap byte array)</li>
     *   <li>&gt;= 4 MB: {@link FileBuffer} (temp-file backed {@link java.nio.channels.FileChannel})</li>
     * </ul>
     * A RAM buffer grows past its initial capacity if more is written.
     */
    public static Buffer allocate(long size) {
        if (size < FILE_THRESHOLD) {
            return new RamBuffer((int) Math.max(size, 0));
        }
        try {
            return new FileBuffer();
        } catch (IOException e) {
            throw new RuntimeException("Failed to allocate file-backed buffer", e);
        }
    }

    /**
     * Appends {@code src} at the end of the buffer.
     *
     * @throws IllegalStateException if the position is not at the end
     */
    @Override
    public int write(ByteBuffer src) throws IOException {
        long writePos = position();
        long size = size();
        if (writePos != size) {
            throw new IllegalStateException("Buffer is append-only: write at " + writePos + ", size " + size);
        }

        cachedHash = null;
        incrementalHash.update(src.duplicate());
        return doWrite(src);
    }

    /**
     * Not supported: a buffer only grows.
     */
    @Override
    public SeekableByteChannel truncate(long newSize) {
        throw new UnsupportedOperationException("Buffer is append-only");
    }

    @Override
    public ContentHash hash() {
        if (cachedHash == null) {
            cachedHash = new ContentHash(snapshot().digest());
        }
        return cachedHash;
    }

    /**
     * Feeds bytes that are already part of the buffer into the digest.
     * Used by subclasses that start out with existing contents.
     */
    protected void hashExisting(byte[] data, int length) {
        incrementalHash.update(data, 0, length);
    }

    /**
     * Subclasses implement actual write operation.
     */
    protected abstract int doWrite(ByteBuffer src) throws IOException;

    // digest() resets its receiver, so finalize a copy and keep appending to the original
    private MessageDigest snapshot() {
        try {
            return (MessageDigest) incrementalHash.clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("SHA-256 digest cannot be cloned", e);
        }
    }
}
