package com.libragraph.contentstore.core.backend;

import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent backend calls concurrently and waits for every one of them
 * to settle.
 *
 * <p>A failing branch never cancels its siblings: the joined {@link Uni} only
 * emits once each branch has either produced an item, failed, or hit its
 * deadline. Callers inspect the {@link Settled} outcomes to decide overall
 * success.
 */
public final class ForkJoin {

    private ForkJoin() {
    }

    /**
     * Subscribes {@code work} on {@code executor} and fails it with
     * {@link BackendTimeoutException} if no item arrives within {@code deadline}.
     */
    public static <T> Uni<T> guard(Uni<T> work, Executor executor, Duration deadline) {
        return work
                .runSubscriptionOn(executor)
                .ifNoItem().after(deadline).failWith(() -> new BackendTimeoutException(deadline));
    }

    /**
     * Forks all branches and joins on their outcomes, in branch order.
     */
    @SuppressWarnings("unchecked")
    public static <T> Uni<List<Settled<T>>> settleAll(List<Uni<T>> branches, Executor executor, Duration deadline) {
        if (branches.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        AtomicInteger sequence = new AtomicInteger();
        List<Uni<Settled<T>>> guarded = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            int branch = i;
            guarded.add(guard(branches.get(i), executor, deadline)
                    .onItemOrFailure().transform((item, failure) ->
                            new Settled<>(item, failure, branch, sequence.getAndIncrement())));
        }
        return Uni.combine().all().unis(guarded).with(outcomes -> {
            List<Settled<T>> settled = new ArrayList<>(outcomes.size());
            for (Object outcome : outcomes) {
                settled.add((Settled<T>) outcome);
            }
            return settled;
        });
    }

    /**
     * Returns the failed outcomes in the order they settled.
     */
    public static <T> List<Settled<T>> failures(List<Settled<T>> settled) {
        List<Settled<T>> failed = new ArrayList<>();
        for (Settled<T> s : settled) {
            if (s.failed()) {
                failed.add(s);
            }
        }
        failed.sort(Comparator.comparingInt(Settled::order));
        return failed;
    }
}
