package com.libragraph.contentstore.core.testing;

import com.libragraph.contentstore.core.index.IndexDocument;
import com.libragraph.contentstore.core.index.IndexException;
import com.libragraph.contentstore.core.index.SearchIndex;
import com.libragraph.contentstore.util.ContentId;
import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed SearchIndex with injectable failures and latency.
 */
public class FakeSearchIndex implements SearchIndex {

    private final Map<String, IndexDocument> documents = new ConcurrentHashMap<>();

    private volatile RuntimeException failure;
    private volatile Duration delay = Duration.ZERO;

    /** Every later call fails with {@code failure}; null restores normal behaviour. */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    /** Every later call settles only after {@code delay}. */
    public void delayBy(Duration delay) {
        this.delay = delay;
    }

    public IndexDocument get(String contentId) {
        return documents.get(contentId);
    }

    public int size() {
        return documents.size();
    }

    @Override
    public Uni<Void> upsert(IndexDocument document) {
        return settle(Uni.createFrom().voidItem().invoke(() -> documents.put(document.contentId(), document)));
    }

    @Override
    public Uni<Boolean> remove(ContentId contentId) {
        return settle(Uni.createFrom().item(() -> documents.remove(contentId.value()) != null));
    }

    private <T> Uni<T> settle(Uni<T> work) {
        RuntimeException injected = failure;
        Duration latency = delay;
        Uni<T> outcome = injected != null
                ? Uni.createFrom().failure(new IndexException("injected", injected))
                : work;
        if (latency.isZero()) {
            return outcome;
        }
        return Uni.createFrom().voidItem()
                .onItem().delayIt().by(latency)
                .onItem().transformToUni(ignored -> outcome);
    }
}
