package com.libragraph.contentstore.core.storage;

import com.libragraph.contentstore.util.buffer.BinaryData;
import com.libragraph.contentstore.util.buffer.RamBuffer;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Filesystem-backed BlobStore for development and testing.
 *
 * <p>Layout: {@code {root}/{container}/{key}}. Writes go to a temp file in the
 * container directory and are moved into place, so readers never observe a
 * half-written object.
 *
 * <p>Content type and access policy are not recorded.
 */
@ApplicationScoped
@IfBuildProperty(name = "content.blob-store.type", stringValue = "filesystem")
public class FilesystemBlobStore implements BlobStore {

    private static final Logger log = Logger.getLogger(FilesystemBlobStore.class);

    @ConfigProperty(name = "content.blob-store.filesystem.root")
    String root;

    public FilesystemBlobStore() {
    }

    public FilesystemBlobStore(Path root) {
        this.root = root.toString();
    }

    private Path resolvePath(String container, String key) {
        checkSegment("container", container);
        checkSegment("key", key);
        return Path.of(root, container, key);
    }

    private static void checkSegment(String what, String value) {
        if (value == null || value.isEmpty() || value.equals(".") || value.equals("..")
                || value.indexOf('/') >= 0 || value.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Invalid " + what + " for filesystem storage: " + value);
        }
    }

    @Override
    public Uni<BinaryData> read(String container, String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(container, key);
            try {
                return (BinaryData) new RamBuffer(Files.readAllBytes(path));
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(container, key);
            } catch (IOException e) {
                throw new StorageException("Failed to read blob: " + container + "/" + key, e);
            }
        });
    }

    @Override
    public Uni<Void> write(String container, String key, BinaryData data, String mimeType, AccessPolicy access) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(container, key);
            Path tmp = null;
            try {
                Files.createDirectories(path.getParent());
                tmp = Files.createTempFile(path.getParent(), ".upload-", ".tmp");
                try (FileChannel out = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                    data.position(0);
                    ByteBuffer buf = ByteBuffer.allocate(8192);
                    while (data.read(buf) != -1) {
                        buf.flip();
                        while (buf.hasRemaining()) {
                            out.write(buf);
                        }
                        buf.clear();
                    }
                }
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.debugf("Wrote %d bytes to %s/%s", data.size(), container, key);
            } catch (IOException e) {
                deleteQuietly(tmp);
                throw new StorageException("Failed to write blob: " + container + "/" + key, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String container, String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(container, key);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new BlobNotFoundException(container, key);
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete blob: " + container + "/" + key, e);
            }
        });
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warnf(e, "Failed to remove temp file %s", tmp);
        }
    }
}
