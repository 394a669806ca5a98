package com.libragraph.contentstore.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.contentstore.core.asset.AssetDirectory;
import com.libragraph.contentstore.core.backend.Backend;
import com.libragraph.contentstore.core.backend.BackendFailureException;
import com.libragraph.contentstore.core.backend.ForkJoin;
import com.libragraph.contentstore.core.backend.Settled;
import com.libragraph.contentstore.core.index.SearchIndex;
import com.libragraph.contentstore.core.storage.AccessPolicy;
import com.libragraph.contentstore.core.storage.BlobNotFoundException;
import com.libragraph.contentstore.core.storage.BlobStore;
import com.libragraph.contentstore.util.ContentId;
import com.libragraph.contentstore.util.buffer.BinaryData;
import com.libragraph.contentstore.util.buffer.RamBuffer;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Stores, retrieves and deletes envelopes across the blob store (full
 * document) and the search index (projection).
 *
 * <p>Writes and deletes fork one branch per backend and wait for both to
 * settle. The call fails if either branch failed, reporting the branch that
 * failed first. Nothing is rolled back: after a partial failure one backend
 * may hold the envelope while the other does not, and the failure is logged
 * with the backend that diverged so it can be repaired by re-storing or
 * re-deleting the same content ID.
 */
@ApplicationScoped
public class EnvelopeCoordinator {

    private static final Logger log = Logger.getLogger(EnvelopeCoordinator.class);

    private static final String ENVELOPE_MIME_TYPE = "application/json";

    private static final Backend[] BRANCH_BACKENDS = {Backend.BLOB_STORE, Backend.SEARCH_INDEX};

    private final BlobStore blobStore;
    private final SearchIndex searchIndex;
    private final AssetDirectory assetDirectory;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final String contentContainer;
    private final Duration timeout;

    @Inject
    public EnvelopeCoordinator(BlobStore blobStore,
                               SearchIndex searchIndex,
                               AssetDirectory assetDirectory,
                               ObjectMapper objectMapper,
                               @Named("backendExecutor") ExecutorService executor,
                               @ConfigProperty(name = "content.blob-store.content-container", defaultValue = "content")
                               String contentContainer,
                               @ConfigProperty(name = "content.backend.timeout", defaultValue = "30s")
                               Duration timeout) {
        this.blobStore = blobStore;
        this.searchIndex = searchIndex;
        this.assetDirectory = assetDirectory;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.contentContainer = contentContainer;
        this.timeout = timeout;
    }

    public Uni<Void> store(ContentId contentId, Envelope envelope) {
        return store(contentId, envelope, timeout);
    }

    /**
     * Writes the envelope to the blob store and its projection to the search
     * index concurrently. Re-storing a content ID overwrites both.
     */
    public Uni<Void> store(ContentId contentId, Envelope envelope, Duration deadline) {
        log.debugf("Storing envelope [%s]", contentId);
        byte[] json = envelope.toJson(objectMapper);

        Uni<Void> blobWrite = Uni.createFrom().deferred(() -> blobStore.write(contentContainer,
                contentId.storageKey(), new RamBuffer(json), ENVELOPE_MIME_TYPE, AccessPolicy.PRIVATE));
        Uni<Void> indexWrite = Uni.createFrom().deferred(() -> searchIndex.upsert(envelope.project(contentId)));

        return forkJoin("store", contentId, blobWrite, indexWrite, deadline);
    }

    public Uni<Envelope> retrieve(ContentId contentId) {
        return retrieve(contentId, timeout);
    }

    /**
     * Reads the envelope and injects the current named assets as its
     * {@code assets} field.
     *
     * @throws EnvelopeNotFoundException if nothing is stored under the ID
     * @throws EnvelopeCorruptException  if the stored bytes are not a JSON object
     * @throws BackendFailureException   on any backend failure
     */
    public Uni<Envelope> retrieve(ContentId contentId, Duration deadline) {
        log.debugf("Retrieving envelope [%s]", contentId);
        long start = System.nanoTime();

        Uni<BinaryData> read = Uni.createFrom().deferred(() ->
                blobStore.read(contentContainer, contentId.storageKey()));

        return ForkJoin.guard(read, executor, deadline)
                .onFailure(BlobNotFoundException.class)
                .transform(e -> new EnvelopeNotFoundException(contentId, e))
                .onFailure(e -> !(e instanceof EnvelopeNotFoundException))
                .transform(e -> new BackendFailureException(Backend.BLOB_STORE, "retrieve", contentId.value(), e))
                .onItem().transform(data -> parse(contentId, data))
                .onItem().transformToUni(envelope -> ForkJoin.guard(assetDirectory.enumerateNamed(), executor, deadline)
                        .onFailure().transform(e ->
                                new BackendFailureException(Backend.ASSET_DIRECTORY, "retrieve", contentId.value(), e))
                        .onItem().transform(envelope::withAssets))
                .onItem().invoke(() -> log.debugf("Retrieved envelope [%s] in %d ms",
                        contentId, elapsedMs(start)))
                .onFailure().invoke(e -> {
                    if (e instanceof EnvelopeNotFoundException) {
                        log.debugf("No content for ID [%s]", contentId);
                    } else {
                        log.errorf(e, "Unable to retrieve envelope [%s] after %d ms", contentId, elapsedMs(start));
                    }
                });
    }

    public Uni<Void> delete(ContentId contentId) {
        return delete(contentId, timeout);
    }

    /**
     * Deletes the envelope from the blob store and the search index
     * concurrently. Deleting an ID that either backend no longer holds is not
     * an error, so repeated deletes succeed.
     */
    public Uni<Void> delete(ContentId contentId, Duration deadline) {
        log.debugf("Deleting envelope [%s]", contentId);

        Uni<Void> blobDelete = Uni.createFrom().deferred(() ->
                        blobStore.delete(contentContainer, contentId.storageKey()))
                .onFailure(BlobNotFoundException.class).recoverWithUni(e -> {
                    log.debugf("Envelope [%s] already absent from blob store", contentId);
                    return Uni.createFrom().voidItem();
                });
        Uni<Void> indexDelete = Uni.createFrom().deferred(() -> searchIndex.remove(contentId))
                .invoke(removed -> {
                    if (!removed) {
                        log.debugf("Envelope [%s] already absent from search index", contentId);
                    }
                })
                .replaceWithVoid();

        return forkJoin("delete", contentId, blobDelete, indexDelete, deadline);
    }

    // Branch 0 is the blob store, branch 1 the search index
    private Uni<Void> forkJoin(String operation, ContentId contentId,
                               Uni<Void> blobBranch, Uni<Void> indexBranch, Duration deadline) {
        long start = System.nanoTime();
        return ForkJoin.settleAll(List.of(blobBranch, indexBranch), executor, deadline)
                .onItem().transformToUni(settled -> {
                    List<Settled<Void>> failed = ForkJoin.failures(settled);
                    if (failed.isEmpty()) {
                        log.infof("%s of [%s] succeeded in %d ms", operation, contentId, elapsedMs(start));
                        return Uni.createFrom().voidItem();
                    }

                    List<BackendFailureException> failures = new ArrayList<>(failed.size());
                    for (Settled<Void> s : failed) {
                        failures.add(new BackendFailureException(BRANCH_BACKENDS[s.branch()], operation,
                                contentId.value(), s.failure()));
                    }
                    BackendFailureException first = failures.get(0);

                    if (failures.size() == BRANCH_BACKENDS.length) {
                        for (BackendFailureException failure : failures) {
                            log.errorf(failure.getCause(), "%s of [%s] failed at %s",
                                    operation, contentId, failure.backend().label());
                        }
                        for (BackendFailureException later : failures.subList(1, failures.size())) {
                            first.addSuppressed(later);
                        }
                        return Uni.createFrom().<Void>failure(first);
                    }

                    Backend succeeded = first.backend() == Backend.BLOB_STORE ? Backend.SEARCH_INDEX : Backend.BLOB_STORE;
                    log.errorf(first.getCause(),
                            "%s of [%s] failed at %s after %d ms; %s completed, backends are now inconsistent",
                            operation, contentId, first.backend().label(), elapsedMs(start), succeeded.label());
                    return Uni.createFrom().<Void>failure(first);
                });
    }

    private Envelope parse(ContentId contentId, BinaryData data) {
        try (data) {
            return Envelope.parse(objectMapper, data.inputStream(0));
        } catch (IOException | IllegalArgumentException e) {
            throw new EnvelopeCorruptException(contentId, e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
