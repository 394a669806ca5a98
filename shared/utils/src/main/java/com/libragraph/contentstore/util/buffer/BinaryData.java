package com.libragraph.contentstore.util.buffer;

import com.libragraph.contentstore.util.ContentHash;

import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only binary data backed by RAM or a disk file.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * Provides convenience methods for stream-based access.
 *
 * Design principles:
 * - Hash and size are always available
 * - Stream access uses standard JDK wrappers (Channels.newInputStream)
 * - No unsafe operations (no readAllBytes)
 */
public abstract class BinaryData implements SeekableByteChannel {

    /**
     * Content hash (SHA-256) of this binary data.
     * May be computed lazily on first call.
     */
    public abstract ContentHash hash();

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * Uses standard JDK Channels.newInputStream() wrapper. The stream shares
     * this channel's position, so only one stream should be consumed at a time.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return Channels.newInputStream(this);
        } catch (Exception e) {
            throw new RuntimeException("Failed to create input stream at position " + pos, e);
        }
    }
}
