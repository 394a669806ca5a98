package com.libragraph.contentstore.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
@IfBuildProperty(name = "content.blob-store.type", stringValue = "s3")
public class MinioClientProducer {

    @ConfigProperty(name = "content.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "content.minio.access-key")
    String accessKey;

    @ConfigProperty(name = "content.minio.secret-key")
    String secretKey;

    @ConfigProperty(name = "content.minio.region")
    Optional<String> region;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey);
        region.filter(r -> !r.isBlank()).ifPresent(builder::region);
        return builder.build();
    }
}
