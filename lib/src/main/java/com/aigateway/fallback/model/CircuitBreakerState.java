package com.aigateway.fallback.model;

/**
 * Circuit breaker state for a fallback target.
 */
public enum CircuitBreakerState {
    
    /**
     * Circuit breaker is closed - the target may be attempted.
     */
    CLOSED,
    
    /**
     * Circuit breaker is open - the target is skipped until the cooldown elapses.
     */
    OPEN,
    
    /**
     * Circuit breaker is half-open - trial attempts are allowed to test recovery.
     */
    HALF_OPEN
}
