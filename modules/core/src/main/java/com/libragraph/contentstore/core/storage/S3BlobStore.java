package com.libragraph.contentstore.core.storage;

import com.libragraph.contentstore.util.buffer.BinaryData;
import com.libragraph.contentstore.util.buffer.RamBuffer;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.InputStream;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * S3/MinIO-backed BlobStore for production use.
 *
 * <p>Each container is a bucket of the same name, created on first write.
 * {@link AccessPolicy#PUBLIC_READ} objects are written with a
 * {@code public-read} canned ACL.
 */
@ApplicationScoped
@IfBuildProperty(name = "content.blob-store.type", stringValue = "s3")
public class S3BlobStore implements BlobStore {

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    @Inject
    MinioClient minioClient;

    private final Set<String> knownBuckets = ConcurrentHashMap.newKeySet();

    private void ensureBucket(String bucket) {
        if (knownBuckets.contains(bucket)) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
            knownBuckets.add(bucket);
        } catch (ErrorResponseException e) {
            // lost a creation race to another writer
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                knownBuckets.add(bucket);
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e, statusOf(e));
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    private static int statusOf(ErrorResponseException e) {
        return e.response() != null ? e.response().code() : 0;
    }

    @Override
    public Uni<BinaryData> read(String container, String key) {
        return Uni.createFrom().item(() -> {
            try (InputStream is = minioClient.getObject(
                    GetObjectArgs.builder().bucket(container).object(key).build())) {
                return (BinaryData) new RamBuffer(is.readAllBytes());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(container, key);
                }
                throw new StorageException("Failed to read blob: " + container + "/" + key, e, statusOf(e));
            } catch (Exception e) {
                throw new StorageException("Failed to read blob: " + container + "/" + key, e);
            }
        });
    }

    @Override
    public Uni<Void> write(String container, String key, BinaryData data, String mimeType, AccessPolicy access) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ensureBucket(container);
            PutObjectArgs.Builder args = PutObjectArgs.builder()
                    .bucket(container)
                    .object(key)
                    .stream(data.inputStream(0), data.size(), -1)
                    .contentType(mimeType != null && !mimeType.isBlank() ? mimeType : DEFAULT_MIME_TYPE);
            if (access == AccessPolicy.PUBLIC_READ) {
                args.headers(Map.of("x-amz-acl", "public-read"));
            }
            try {
                minioClient.putObject(args.build());
            } catch (ErrorResponseException e) {
                throw new StorageException("Failed to write blob: " + container + "/" + key, e, statusOf(e));
            } catch (Exception e) {
                throw new StorageException("Failed to write blob: " + container + "/" + key, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String container, String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            // removeObject is silent on missing keys, so stat first to report absence
            try {
                minioClient.statObject(StatObjectArgs.builder()
                        .bucket(container).object(key).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(container, key);
                }
                throw new StorageException("Failed to delete blob: " + container + "/" + key, e, statusOf(e));
            } catch (Exception e) {
                throw new StorageException("Failed to delete blob: " + container + "/" + key, e);
            }
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(container).object(key).build());
            } catch (ErrorResponseException e) {
                throw new StorageException("Failed to delete blob: " + container + "/" + key, e, statusOf(e));
            } catch (Exception e) {
                throw new StorageException("Failed to delete blob: " + container + "/" + key, e);
            }
        });
    }
}
