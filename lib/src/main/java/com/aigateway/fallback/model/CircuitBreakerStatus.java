package com.aigateway.fallback.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a target's circuit breaker.
 */
public class CircuitBreakerStatus {
    
    private static final CircuitBreakerStatus CLOSED = new CircuitBreakerStatus(
        CircuitBreakerState.CLOSED, 0, null, null);
    
    private final CircuitBreakerState state;
    private final int failures;
    private final Instant lastFailureTime;
    private final Instant nextAttemptTime;
    
    public CircuitBreakerStatus(CircuitBreakerState state, int failures,
                                Instant lastFailureTime, Instant nextAttemptTime) {
        this.state = state;
        this.failures = failures;
        this.lastFailureTime = lastFailureTime;
        this.nextAttemptTime = nextAttemptTime;
    }
    
    /**
     * Status reported for a target that has never failed.
     */
    public static CircuitBreakerStatus closed() {
        return CLOSED;
    }
    
    public CircuitBreakerState getState() {
        return state;
    }
    
    public int getFailures() {
        return failures;
    }
    
    public Instant getLastFailureTime() {
        return lastFailureTime;
    }
    
    public Optional<Instant> getNextAttemptTime() {
        return Optional.ofNullable(nextAttemptTime);
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreakerStatus{state=%s, failures=%d, lastFailure=%s, nextAttempt=%s}",
            state, failures, lastFailureTime, nextAttemptTime);
    }
}
