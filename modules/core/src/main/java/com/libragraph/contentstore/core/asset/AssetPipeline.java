package com.libragraph.contentstore.core.asset;

import com.libragraph.contentstore.core.backend.ForkJoin;
import com.libragraph.contentstore.core.backend.Settled;
import com.libragraph.contentstore.core.storage.AccessPolicy;
import com.libragraph.contentstore.core.storage.BlobStore;
import com.libragraph.contentstore.util.AssetNamer;
import com.libragraph.contentstore.util.UriComponents;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fingerprints uploaded assets and publishes them under content-derived names.
 *
 * <p>Every asset in a batch runs as its own fork-join branch:
 * fingerprint, then upload to the asset container with public-read access,
 * then (for named batches) register in the {@link AssetDirectory}. The batch
 * succeeds only if every branch does. Otherwise it fails with an
 * {@link AssetBatchException} listing each failed asset, and assets that did
 * publish stay published.
 */
@ApplicationScoped
public class AssetPipeline {

    private static final Logger log = Logger.getLogger(AssetPipeline.class);

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final BlobStore blobStore;
    private final AssetDirectory assetDirectory;
    private final AssetFingerprinter fingerprinter;
    private final ExecutorService executor;
    private final String assetContainer;
    private final String publicBaseUrl;
    private final Duration timeout;

    @Inject
    public AssetPipeline(BlobStore blobStore,
                         AssetDirectory assetDirectory,
                         AssetFingerprinter fingerprinter,
                         @Named("backendExecutor") ExecutorService executor,
                         @ConfigProperty(name = "content.blob-store.asset-container", defaultValue = "assets")
                         String assetContainer,
                         @ConfigProperty(name = "content.assets.public-base-url")
                         String publicBaseUrl,
                         @ConfigProperty(name = "content.backend.timeout", defaultValue = "30s")
                         Duration timeout) {
        this.blobStore = blobStore;
        this.assetDirectory = assetDirectory;
        this.fingerprinter = fingerprinter;
        this.executor = executor;
        this.assetContainer = assetContainer;
        this.publicBaseUrl = publicBaseUrl;
        this.timeout = timeout;
    }

    public Uni<AssetSummary> accept(List<Asset> assets, boolean named) {
        return accept(assets, named, timeout);
    }

    /**
     * Publishes a batch of assets.
     *
     * @param named    also register each asset in the directory under its field name
     * @param deadline per-asset deadline covering fingerprint, upload and registration
     */
    public Uni<AssetSummary> accept(List<Asset> assets, boolean named, Duration deadline) {
        long start = System.nanoTime();
        log.debugf("Accepting %d asset(s) (named=%s)", (Object) assets.size(), named);

        List<Uni<AssetRecord>> branches = new ArrayList<>(assets.size());
        for (Asset asset : assets) {
            branches.add(handleAsset(asset, named));
        }

        return ForkJoin.settleAll(branches, executor, deadline)
                .onItem().transform(settled -> {
                    long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
                    if (settled.stream().anyMatch(Settled::failed)) {
                        throw batchFailure(settled, assets, elapsedMs);
                    }
                    List<AssetRecord> records = new ArrayList<>(settled.size());
                    for (Settled<AssetRecord> s : settled) {
                        records.add(s.item());
                    }
                    log.infof("Published %d asset(s) in %d ms", records.size(), elapsedMs);
                    return new AssetSummary(records);
                });
    }

    private static AssetBatchException batchFailure(List<Settled<AssetRecord>> settled, List<Asset> assets,
                                                    long elapsedMs) {
        List<Map.Entry<String, Throwable>> failures = new ArrayList<>();
        for (Settled<AssetRecord> s : ForkJoin.failures(settled)) {
            String name = assets.get(s.branch()).originalName();
            log.errorf(s.failure(), "Unable to process asset [%s]", name);
            failures.add(new AbstractMap.SimpleImmutableEntry<>(name, s.failure()));
        }
        log.errorf("%d of %d asset(s) failed after %d ms", failures.size(), assets.size(), elapsedMs);
        return new AssetBatchException(failures);
    }

    /**
     * One branch of the batch. The fingerprint's buffer is released exactly
     * once: after the upload settles, or on cancellation (deadline hit). A
     * fingerprint that finishes after cancellation has no downstream and is
     * released on the fingerprinting thread.
     */
    private Uni<AssetRecord> handleAsset(Asset asset, boolean named) {
        AtomicReference<Fingerprint> held = new AtomicReference<>();
        return Uni.createFrom().<Fingerprint>emitter(emitter -> {
                    Fingerprint fingerprint;
                    try {
                        fingerprint = fingerprinter.fingerprint(asset);
                    } catch (RuntimeException e) {
                        emitter.fail(e);
                        return;
                    }
                    held.set(fingerprint);
                    if (emitter.isCancelled()) {
                        log.debugf("Fingerprint of [%s] finished after cancellation", asset.originalName());
                        release(asset, held);
                    } else {
                        emitter.complete(fingerprint);
                    }
                })
                .onItem().transformToUni(fingerprint -> publish(asset, fingerprint)
                        .eventually(() -> release(asset, held)))
                .onItem().transformToUni(record -> named
                        ? assetDirectory.register(asset.fieldName(), record.publicUrl())
                                .onFailure().transform(e -> new PublishException(record.fingerprintedName(), e))
                                .replaceWith(record)
                        : Uni.createFrom().item(record))
                .onCancellation().invoke(() -> release(asset, held));
    }

    private Uni<AssetRecord> publish(Asset asset, Fingerprint fingerprint) {
        String fingerprintedName = AssetNamer.fingerprintedName(asset.originalName(), fingerprint.digest());
        String contentType = asset.contentType() == null || asset.contentType().isBlank()
                ? DEFAULT_CONTENT_TYPE : asset.contentType();
        AssetRecord record = new AssetRecord(asset.originalName(), fingerprintedName, contentType,
                fingerprint.digest(), publicUrl(fingerprintedName));

        return blobStore.write(assetContainer, fingerprintedName, fingerprint.bytes(), contentType,
                        AccessPolicy.PUBLIC_READ)
                .onFailure().transform(e -> new PublishException(fingerprintedName, e))
                .invoke(() -> log.debugf("Uploaded asset [%s] as [%s]", asset.originalName(), fingerprintedName))
                .replaceWith(record);
    }

    String publicUrl(String fingerprintedName) {
        String base = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        return base + "/" + UriComponents.escape(fingerprintedName);
    }

    private static void release(Asset asset, AtomicReference<Fingerprint> held) {
        Fingerprint fingerprint = held.getAndSet(null);
        if (fingerprint == null) {
            return;
        }
        try {
            fingerprint.close();
        } catch (IOException e) {
            log.warnf(e, "Failed to release buffer for asset [%s]", asset.originalName());
        }
    }
}
