package com.fundermatch.grants.http;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {
    private static final Duration INTERVAL = Duration.ofMillis(60);

    private RateLimiter limiter;
    private ExecutorService callers;

    @AfterEach
    void tearDown() {
        if (limiter != null) {
            limiter.shutdown();
        }
        if (callers != null) {
            callers.shutdownNow();
        }
    }

    @Test
    void concurrentSubmissionsStartAtLeastOneIntervalApart() throws Exception {
        limiter = new RateLimiter("test", INTERVAL);
        callers = Executors.newFixedThreadPool(4);
        List<Long> starts = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch ready = new CountDownLatch(1);

        List<CompletableFuture<Void>> submitted = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            submitted.add(CompletableFuture.runAsync(() -> {
                try {
                    ready.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                limiter.execute(() -> starts.add(System.nanoTime()));
            }, callers));
        }
        ready.countDown();
        CompletableFuture.allOf(submitted.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertThat(starts).hasSize(4);
        for (int i = 1; i < starts.size(); i++) {
            assertThat(starts.get(i) - starts.get(i - 1)).isGreaterThanOrEqualTo(INTERVAL.toNanos());
        }
    }

    @Test
    void runsTasksInSubmissionOrder() throws Exception {
        limiter = new RateLimiter("fifo", Duration.ofMillis(1));
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            int index = i;
            futures.add(limiter.submit(() -> order.add(index)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertThat(order).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
    }

    @Test
    void failureOnlyAffectsItsOwnSubmitter() throws Exception {
        limiter = new RateLimiter("isolation", Duration.ofMillis(1));
        CompletableFuture<String> failing = limiter.submit(() -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> following = limiter.submit(() -> "ok");

        assertThat(following.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThatThrownBy(() -> failing.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void executeRethrowsRuntimeFailureUnchanged() {
        limiter = new RateLimiter("rethrow", Duration.ZERO);
        assertThatThrownBy(() -> limiter.execute(() -> {
            throw new RemoteApiException(503, "unavailable");
        }))
            .isInstanceOf(RemoteApiException.class)
            .hasMessage("unavailable");
        assertThat(limiter.minInterval()).isEqualTo(Duration.ZERO);
    }
}
