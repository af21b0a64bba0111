package com.fundermatch.grants.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serialises units of work onto one worker thread. After a unit finishes the worker holds the
 * slot for {@code minInterval} before the next unit starts, so starts are never closer than that.
 * Units run in submission order; a failing unit only fails its own future.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final long minIntervalNanos;
    private final ExecutorService worker;
    private final AtomicInteger pending = new AtomicInteger();
    private long lastFinishNanos;
    private boolean started;

    public RateLimiter(String name, Duration minInterval) {
        this.name = name;
        this.minIntervalNanos = Math.max(0L, minInterval == null ? 0L : minInterval.toNanos());
        this.worker = new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            runnable -> {
                Thread thread = new Thread(runnable, "rate-limiter-" + name);
                thread.setDaemon(true);
                return thread;
            }
        );
    }

    public <T> CompletableFuture<T> submit(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task is required");
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        pending.incrementAndGet();
        worker.execute(() -> {
            try {
                awaitSlot();
                future.complete(task.call());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.completeExceptionally(e);
            } catch (Throwable e) {
                future.completeExceptionally(e);
            } finally {
                lastFinishNanos = System.nanoTime();
                pending.decrementAndGet();
            }
        });
        return future;
    }

    /**
     * Blocks until the task has run, rethrowing its runtime failure unchanged.
     */
    public <T> T execute(Callable<T> task) {
        CompletableFuture<T> future = submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted waiting for " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    public int pendingCount() {
        return pending.get();
    }

    public Duration minInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }

    public void shutdown() {
        worker.shutdownNow();
        log.debug("Rate limiter {} shut down with {} pending task(s)", name, pending.get());
    }

    // Worker thread only.
    private void awaitSlot() throws InterruptedException {
        if (started && minIntervalNanos > 0) {
            long waitNanos = lastFinishNanos + minIntervalNanos - System.nanoTime();
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        }
        started = true;
    }
}
