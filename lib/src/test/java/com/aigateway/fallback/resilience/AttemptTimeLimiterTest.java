package com.aigateway.fallback.resilience;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

class AttemptTimeLimiterTest {

    private ScheduledExecutorService scheduler;
    private AttemptTimeLimiter timeLimiter;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        timeLimiter = new AttemptTimeLimiter(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testZeroDeadlineCallsThrough() {
        CompletableFuture<String> attempt = new CompletableFuture<>();

        assertSame(attempt, timeLimiter.execute("claude", Duration.ZERO, () -> attempt));
        assertSame(attempt, timeLimiter.execute("claude", null, () -> attempt));
    }

    @Test
    void testFastAttemptCompletes() throws Exception {
        CompletableFuture<String> result = timeLimiter.execute("claude", Duration.ofSeconds(5),
            () -> CompletableFuture.completedFuture("ok"));

        assertEquals("ok", result.get(1, TimeUnit.SECONDS));
    }

    @Test
    void testSlowAttemptTimesOut() {
        CompletableFuture<String> result = timeLimiter.execute("claude", Duration.ofMillis(50), CompletableFuture::new);

        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, error.getCause());
    }

    @Test
    void testRegisteredLimiterReusedForSameDeadline() {
        assertSame(timeLimiter.getTimeLimiter("claude", Duration.ofMillis(100)),
            timeLimiter.getTimeLimiter("claude", Duration.ofMillis(100)));
        assertNotSame(timeLimiter.getTimeLimiter("claude", Duration.ofMillis(100)),
            timeLimiter.getTimeLimiter("claude", Duration.ofMillis(200)));
        assertEquals(Duration.ofMillis(200),
            timeLimiter.getTimeLimiter("claude", Duration.ofMillis(200)).getTimeLimiterConfig().getTimeoutDuration());
        assertEquals(Duration.ofMillis(100),
            timeLimiter.getTimeLimiter("gemini", Duration.ofMillis(100)).getTimeLimiterConfig().getTimeoutDuration());
    }

    @Test
    void testRegistryBoundedByTargetsAcrossDistinctDeadlines() throws Exception {
        for (int i = 0; i < 500; i++) {
            CompletableFuture<String> result = timeLimiter.execute("claude", Duration.ofMillis(1000 + i),
                () -> CompletableFuture.completedFuture("ok"));
            assertEquals("ok", result.get(1, TimeUnit.SECONDS));
        }
        timeLimiter.execute("gemini", Duration.ofMillis(750), () -> CompletableFuture.completedFuture("ok"))
            .get(1, TimeUnit.SECONDS);

        assertEquals(2, timeLimiter.getRegisteredLimiterCount());
    }

    @Test
    void testUnregisteredDeadlineStillTimesOut() {
        timeLimiter.getTimeLimiter("claude", Duration.ofSeconds(30));

        CompletableFuture<String> result = timeLimiter.execute("claude", Duration.ofMillis(50), CompletableFuture::new);

        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, error.getCause());
    }
}
