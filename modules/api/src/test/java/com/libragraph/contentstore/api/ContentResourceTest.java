package com.libragraph.contentstore.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.contentstore.core.envelope.EnvelopeCoordinator;
import com.libragraph.contentstore.core.envelope.EnvelopeNotFoundException;
import com.libragraph.contentstore.core.storage.InMemoryBlobStore;
import com.libragraph.contentstore.core.testing.FakeAssetDirectory;
import com.libragraph.contentstore.core.testing.FakeSearchIndex;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class ContentResourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ExecutorService executor;
    private FakeSearchIndex searchIndex;
    private ContentResource resource;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        searchIndex = new FakeSearchIndex();

        resource = new ContentResource();
        resource.coordinator = new EnvelopeCoordinator(new InMemoryBlobStore(), searchIndex,
                new FakeAssetDirectory().put("logo", "https://cdn/logo-1.png"), mapper, executor,
                "content", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void putThenGetReturnsEnvelopeWithAssets() throws Exception {
        JsonNode body = mapper.readTree("{\"title\":\"Hi\",\"tags\":[\"a\",\"b\"],\"body\":\"...\"}");

        Response put = resource.store("post-42", body).await().indefinitely();
        ObjectNode got = resource.retrieve("post-42").await().indefinitely();

        assertThat(put.getStatus()).isEqualTo(204);
        assertThat(got.get("body").asText()).isEqualTo("...");
        assertThat(got.get("assets").get("logo").asText()).isEqualTo("https://cdn/logo-1.png");
        assertThat(searchIndex.get("post-42").fields()).containsOnlyKeys("title", "tags");
    }

    @Test
    void deleteThenGetIsNotFound() throws Exception {
        resource.store("post-42", mapper.readTree("{\"title\":\"Hi\"}")).await().indefinitely();

        Response deleted = resource.delete("post-42").await().indefinitely();

        assertThat(deleted.getStatus()).isEqualTo(204);
        assertThatThrownBy(() -> resource.retrieve("post-42").await().indefinitely())
                .isInstanceOf(EnvelopeNotFoundException.class);
    }

    @Test
    void putRejectsNonObjectBodies() throws Exception {
        JsonNode array = mapper.readTree("[1,2]");

        assertThatThrownBy(() -> resource.store("post-42", array))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> resource.store("post-42", null))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void emptyIdIsRejected() {
        assertThatThrownBy(() -> resource.retrieve(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
