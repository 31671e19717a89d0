package com.aigateway.fallback.resilience;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Enforces a deadline on single route attempts using Resilience4j time limiters.
 * 
 * <p>Attempts that overrun complete exceptionally with a
 * {@link java.util.concurrent.TimeoutException} and the executor's future is cancelled.
 * A zero or negative deadline leaves the attempt unbounded.
 */
public class AttemptTimeLimiter {
    
    private static final Logger logger = LoggerFactory.getLogger(AttemptTimeLimiter.class);
    
    private final TimeLimiterRegistry registry;
    private final ScheduledExecutorService scheduler;
    
    public AttemptTimeLimiter(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        this.registry = TimeLimiterRegistry.ofDefaults();
        
        registry.getEventPublisher().onEntryAdded(event -> attachEventLogging(event.getAddedEntry()));
    }
    
    /**
     * Runs the attempt for the target under the given deadline.
     * 
     * @param target route target, used to name the limiter
     * @param deadline per-attempt deadline; zero or negative disables it
     * @param attempt supplier starting the attempt
     */
    public <T> CompletableFuture<T> execute(String target, Duration deadline,
                                            Supplier<CompletableFuture<T>> attempt) {
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            return attempt.get();
        }
        
        TimeLimiter timeLimiter = getTimeLimiter(target, deadline);
        return timeLimiter.executeCompletionStage(scheduler, attempt).toCompletableFuture();
    }
    
    /**
     * Get the time limiter for a target and deadline.
     * 
     * <p>The registry holds one limiter per target, configured with the first deadline
     * seen for it. Calls with any other deadline get an unregistered limiter of the same
     * name, so the registry stays bounded by the number of targets.
     */
    public TimeLimiter getTimeLimiter(String target, Duration deadline) {
        TimeLimiterConfig config = configFor(deadline);
        TimeLimiter registered = registry.timeLimiter(target, config);
        if (registered.getTimeLimiterConfig().getTimeoutDuration().equals(deadline)) {
            return registered;
        }
        
        TimeLimiter timeLimiter = TimeLimiter.of(target, config);
        attachEventLogging(timeLimiter);
        return timeLimiter;
    }
    
    /**
     * Number of limiters held by the registry.
     */
    public int getRegisteredLimiterCount() {
        return registry.getAllTimeLimiters().size();
    }
    
    private static TimeLimiterConfig configFor(Duration deadline) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(deadline)
                .cancelRunningFuture(true)
                .build();
    }
    
    private static void attachEventLogging(TimeLimiter timeLimiter) {
        String name = timeLimiter.getName();
        
        timeLimiter.getEventPublisher()
                .onTimeout(e -> logger.warn("Attempt on target {} timed out after {}",
                        name, timeLimiter.getTimeLimiterConfig().getTimeoutDuration()))
                .onError(e -> logger.debug("Attempt on target {} failed: {}",
                        name, e.getThrowable().getMessage()));
    }
}
