package com.aigateway.fallback.execution;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking delay used between fallback attempts.
 */
@FunctionalInterface
public interface Sleeper {
    
    /**
     * Completes after the given delay.
     */
    CompletableFuture<Void> sleep(Duration delay);
    
    /**
     * Sleeper that completes immediately.
     */
    static Sleeper noDelay() {
        return delay -> CompletableFuture.completedFuture(null);
    }
    
    /**
     * Sleeper backed by a scheduler; no thread is held while waiting.
     */
    static Sleeper scheduled(ScheduledExecutorService scheduler) {
        return delay -> {
            CompletableFuture<Void> future = new CompletableFuture<>();
            scheduler.schedule(() -> future.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
            return future;
        };
    }
}
