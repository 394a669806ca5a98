package com.libragraph.contentstore.core.health;

import io.minio.BucketExistsArgs;
import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready when MinIO answers; reports whether each container bucket exists yet.
 */
@Readiness
@ApplicationScoped
@IfBuildProperty(name = "content.blob-store.type", stringValue = "s3")
public class MinioHealthCheck implements HealthCheck {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "content.blob-store.content-container", defaultValue = "content")
    String contentContainer;

    @ConfigProperty(name = "content.blob-store.asset-container", defaultValue = "assets")
    String assetContainer;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named("minio");
        try {
            for (String bucket : new String[]{contentContainer, assetContainer}) {
                boolean exists = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
                response.withData(bucket, exists ? "present" : "not created yet");
            }
            return response.up().build();
        } catch (Exception e) {
            return response.down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
