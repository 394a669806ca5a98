package com.libragraph.contentstore.core.backend;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class ForkJoinTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // delayIt() rejects a zero delay, so "after 0 ms" is an immediate item
    private static Uni<String> after(long millis, String item) {
        Uni<String> uni = Uni.createFrom().item(item);
        return millis == 0 ? uni : uni.onItem().delayIt().by(Duration.ofMillis(millis));
    }

    private static Uni<String> failAfter(long millis, String message) {
        Uni<String> failure = Uni.createFrom().failure(new IllegalStateException(message));
        return millis == 0 ? failure : after(millis, "").onItem().transformToUni(ignored -> failure);
    }

    @Test
    void zeroDelayHelpersSettleImmediately() {
        assertThat(after(0, "now").await().atMost(Duration.ofSeconds(1))).isEqualTo("now");
        assertThatThrownBy(() -> failAfter(0, "boom").await().atMost(Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void resultsAreInBranchOrder() {
        List<Settled<String>> settled = ForkJoin.settleAll(
                        List.of(after(150, "slow"), after(0, "fast")), executor, Duration.ofSeconds(5))
                .await().indefinitely();

        assertThat(settled).extracting(Settled::item).containsExactly("slow", "fast");
        assertThat(settled).extracting(Settled::branch).containsExactly(0, 1);
        assertThat(settled.get(0).order()).isEqualTo(1);
        assertThat(settled.get(1).order()).isEqualTo(0);
    }

    @Test
    void failureDoesNotCancelSiblings() {
        AtomicBoolean siblingRan = new AtomicBoolean();
        Uni<String> sibling = after(200, "done").invoke(() -> siblingRan.set(true));

        List<Settled<String>> settled = ForkJoin.settleAll(
                        List.of(failAfter(0, "boom"), sibling), executor, Duration.ofSeconds(5))
                .await().indefinitely();

        assertThat(siblingRan).isTrue();
        assertThat(settled.get(0).failed()).isTrue();
        assertThat(settled.get(1).item()).isEqualTo("done");
    }

    @Test
    void failuresAreChronological() {
        List<Settled<String>> settled = ForkJoin.settleAll(
                        List.of(failAfter(250, "late"), failAfter(0, "early"), after(0, "ok")),
                        executor, Duration.ofSeconds(5))
                .await().indefinitely();

        assertThat(ForkJoin.failures(settled)).extracting(s -> s.failure().getMessage())
                .containsExactly("early", "late");
        assertThat(ForkJoin.failures(settled)).extracting(Settled::branch).containsExactly(1, 0);
    }

    @Test
    void noFailureWhenAllSucceed() {
        List<Settled<String>> settled = ForkJoin.settleAll(
                        List.of(after(0, "a"), after(10, "b")), executor, Duration.ofSeconds(5))
                .await().indefinitely();

        assertThat(ForkJoin.failures(settled)).isEmpty();
    }

    @Test
    void branchPastDeadlineSettlesAsTimeout() {
        List<Settled<String>> settled = ForkJoin.settleAll(
                        List.of(after(5_000, "too late"), after(0, "ok")), executor, Duration.ofMillis(100))
                .await().atMost(Duration.ofSeconds(3));

        assertThat(settled.get(0).failure()).isInstanceOf(BackendTimeoutException.class);
        assertThat(settled.get(1).item()).isEqualTo("ok");
    }

    @Test
    void emptyBranchListSettlesImmediately() {
        assertThat(ForkJoin.<String>settleAll(List.of(), executor, Duration.ofSeconds(1)).await().indefinitely())
                .isEmpty();
    }
}
