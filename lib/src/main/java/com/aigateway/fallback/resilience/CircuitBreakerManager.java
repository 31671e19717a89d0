package com.aigateway.fallback.resilience;

import com.aigateway.fallback.config.FallbackConfiguration;
import com.aigateway.fallback.model.CircuitBreakerState;
import com.aigateway.fallback.model.CircuitBreakerStatus;
import com.aigateway.fallback.model.RouteType;
import com.aigateway.fallback.observability.FallbackEvent;
import com.aigateway.fallback.observability.FallbackEventPublisher;
import com.aigateway.fallback.observability.MetricsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-target circuit breakers for fallback routes.
 * 
 * <p>A target without an entry is closed with zero failures. Entries are created on the
 * first recorded failure. Once failures reach the threshold the breaker opens; after the
 * cooldown has elapsed since the last failure, {@link #isOpen(String)} moves it to
 * half-open and lets trial attempts through. A success closes it and clears the count;
 * any failure while half-open re-opens it at once, whatever the route type's threshold.
 * 
 * <p>Each entry is an immutable {@link CircuitBreakerStatus} replaced atomically per target.
 */
public class CircuitBreakerManager {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerManager.class);
    
    private final int providerFailureThreshold;
    private final int agentFailureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final FallbackEventPublisher eventPublisher;
    private final MetricsAggregator metrics;
    private final Map<String, CircuitBreakerStatus> breakers;
    
    public CircuitBreakerManager(FallbackConfiguration configuration,
                                 FallbackEventPublisher eventPublisher,
                                 MetricsAggregator metrics,
                                 Clock clock) {
        this.providerFailureThreshold = configuration.getProviderFailureThreshold();
        this.agentFailureThreshold = configuration.getAgentFailureThreshold();
        this.cooldown = configuration.getCircuitBreakerCooldown();
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.breakers = new ConcurrentHashMap<>();
    }
    
    /**
     * Checks whether the target must be skipped. An open breaker whose cooldown has
     * elapsed moves to half-open and the target is reported as eligible.
     */
    public boolean isOpen(String target) {
        Instant now = clock.instant();
        AtomicBoolean movedToHalfOpen = new AtomicBoolean(false);
        
        CircuitBreakerStatus status = breakers.computeIfPresent(target, (key, current) -> {
            if (current.getState() == CircuitBreakerState.OPEN
                && Duration.between(current.getLastFailureTime(), now).compareTo(cooldown) > 0) {
                movedToHalfOpen.set(true);
                return new CircuitBreakerStatus(CircuitBreakerState.HALF_OPEN, current.getFailures(),
                                              current.getLastFailureTime(), now);
            }
            return current;
        });
        
        if (movedToHalfOpen.get()) {
            logger.info("Circuit breaker for target {} moved to HALF_OPEN after {} cooldown", target, cooldown);
            metrics.recordCircuitBreakerEvent(target, "half_open");
        }
        
        return status != null && status.getState() == CircuitBreakerState.OPEN;
    }
    
    /**
     * Records a failure against the target using the provider threshold.
     */
    public void recordFailure(String target) {
        recordFailure(target, providerFailureThreshold);
    }
    
    /**
     * Records a failure of a route of the given type against its target.
     */
    public void recordFailure(String target, RouteType routeType) {
        recordFailure(target, thresholdFor(routeType));
    }
    
    private void recordFailure(String target, int threshold) {
        Instant now = clock.instant();
        AtomicBoolean opened = new AtomicBoolean(false);
        
        CircuitBreakerStatus updated = breakers.compute(target, (key, current) -> {
            CircuitBreakerStatus previous = current == null ? CircuitBreakerStatus.closed() : current;
            int failures = previous.getFailures() + 1;
            
            if (failures >= threshold || previous.getState() == CircuitBreakerState.HALF_OPEN) {
                opened.set(previous.getState() != CircuitBreakerState.OPEN);
                return new CircuitBreakerStatus(CircuitBreakerState.OPEN, failures, now, now.plus(cooldown));
            }
            return new CircuitBreakerStatus(previous.getState(), failures, now,
                                          previous.getNextAttemptTime().orElse(null));
        });
        
        if (opened.get()) {
            logger.warn("Circuit breaker opened for target {} after {} failures", target, updated.getFailures());
            metrics.recordCircuitBreakerEvent(target, "opened");
            eventPublisher.publish(new FallbackEvent.CircuitBreakerOpened(target, updated.getFailures(), now));
        } else {
            logger.debug("Recorded failure {} for target {}", updated.getFailures(), target);
        }
    }
    
    /**
     * Records a success against the target, closing its breaker if one exists.
     */
    public void recordSuccess(String target) {
        CircuitBreakerStatus reset = breakers.computeIfPresent(target, (key, current) ->
            new CircuitBreakerStatus(CircuitBreakerState.CLOSED, 0, current.getLastFailureTime(), null));
        
        if (reset != null) {
            logger.debug("Circuit breaker reset for target {}", target);
            metrics.recordCircuitBreakerEvent(target, "reset");
            eventPublisher.publish(new FallbackEvent.CircuitBreakerReset(target, clock.instant()));
        }
    }
    
    public int thresholdFor(RouteType routeType) {
        return routeType == RouteType.AGENT ? agentFailureThreshold : providerFailureThreshold;
    }
    
    public CircuitBreakerStatus getStatus(String target) {
        return breakers.getOrDefault(target, CircuitBreakerStatus.closed());
    }
    
    /**
     * Snapshot of every target that has recorded at least one failure.
     */
    public Map<String, CircuitBreakerStatus> getStatus() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(breakers));
    }
    
    /**
     * Forgets the target's breaker; it behaves as closed afterwards.
     */
    public void reset(String target) {
        if (breakers.remove(target) != null) {
            logger.info("Circuit breaker for target {} has been reset", target);
        }
    }
    
    public void resetAll() {
        breakers.clear();
        logger.info("All circuit breakers have been reset");
    }
}
