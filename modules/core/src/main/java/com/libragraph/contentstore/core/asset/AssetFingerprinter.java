package com.libragraph.contentstore.core.asset;

import com.libragraph.contentstore.util.buffer.Buffer;
import com.libragraph.contentstore.util.buffer.FileBuffer;
import com.libragraph.contentstore.util.buffer.RamBuffer;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Streams an asset once, hashing each chunk as it arrives and retaining the
 * bytes for the upload that follows.
 *
 * <p>The retained copy lives in a {@link Buffer}: heap for small assets, a temp
 * file from 4 MB up. The backend is chosen from the declared size, and a heap
 * buffer that reaches the threshold anyway (unknown or understated size) is
 * moved to a temp file before it grows further. The digest is the buffer's
 * incremental SHA-256, so it does not depend on how the source chunks its
 * reads.
 */
@ApplicationScoped
public class AssetFingerprinter {

    private static final Logger log = Logger.getLogger(AssetFingerprinter.class);

    static final int CHUNK_SIZE = 64 * 1024;

    /**
     * Opens the asset's source and fingerprints it.
     *
     * @throws FingerprintException if the source cannot be opened or read, or
     *                              yields a different byte count than declared
     */
    public Fingerprint fingerprint(Asset asset) {
        try (InputStream in = asset.source().open()) {
            return fingerprint(asset.originalName(), in, asset.size());
        } catch (IOException e) {
            throw new FingerprintException(asset.originalName(), "read failed", e);
        }
    }

    /**
     * Fingerprints an already-open stream. The stream is consumed but not closed.
     *
     * @param expectedSize declared size in bytes, or -1 to accept any length
     */
    public Fingerprint fingerprint(String originalName, InputStream in, long expectedSize) {
        Buffer buffer = Buffer.allocate(Math.max(expectedSize, 0));
        try {
            byte[] chunk = new byte[CHUNK_SIZE];
            int n;
            while ((n = in.read(chunk)) != -1) {
                if (buffer instanceof RamBuffer && buffer.size() + n >= Buffer.FILE_THRESHOLD) {
                    buffer = spill(originalName, buffer);
                }
                buffer.write(ByteBuffer.wrap(chunk, 0, n));
            }
            if (expectedSize >= 0 && buffer.size() != expectedSize) {
                throw new FingerprintException(originalName,
                        "expected " + expectedSize + " bytes, read " + buffer.size(), null);
            }
            Fingerprint fingerprint = new Fingerprint(buffer.hash(), buffer);
            log.debugf("Fingerprinted [%s]: %d bytes, sha256=%s",
                    originalName, fingerprint.size(), fingerprint.digest());
            return fingerprint;
        } catch (IOException e) {
            release(buffer, e);
            throw new FingerprintException(originalName, "read failed", e);
        } catch (RuntimeException e) {
            release(buffer, e);
            throw e;
        }
    }

    // Copies a heap buffer into a new temp-file buffer and frees the heap copy
    private static Buffer spill(String originalName, Buffer ram) throws IOException {
        Buffer file = new FileBuffer();
        try {
            ram.position(0);
            ByteBuffer chunk = ByteBuffer.allocate(CHUNK_SIZE);
            while (ram.read(chunk) != -1) {
                chunk.flip();
                file.write(chunk);
                chunk.clear();
            }
        } catch (IOException | RuntimeException e) {
            release(file, e);
            throw e;
        }
        ram.close();
        log.debugf("Moved [%s] to a temp file after %d bytes", originalName, file.size());
        return file;
    }

    private static void release(Buffer buffer, Exception primary) {
        try {
            buffer.close();
        } catch (IOException closeFailure) {
            primary.addSuppressed(closeFailure);
        }
    }
}
