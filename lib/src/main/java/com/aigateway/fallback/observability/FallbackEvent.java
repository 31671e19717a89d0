package com.aigateway.fallback.observability;

import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackResult;
import com.aigateway.fallback.model.FallbackRoute;

import java.time.Instant;
import java.util.List;

/**
 * Event published by the fallback router. Delivery is fire-and-forget.
 */
public interface FallbackEvent {
    
    FallbackEventType type();
    
    Instant timestamp();
    
    record FallbackSuccess(FallbackContext context, FallbackResult result, FallbackRoute route,
                           Instant timestamp) implements FallbackEvent {
        @Override
        public FallbackEventType type() {
            return FallbackEventType.FALLBACK_SUCCESS;
        }
    }
    
    record FallbackFailed(FallbackContext context, FallbackResult result, List<String> routesAttempted,
                          Instant timestamp) implements FallbackEvent {
        public FallbackFailed {
            routesAttempted = List.copyOf(routesAttempted);
        }
        
        @Override
        public FallbackEventType type() {
            return FallbackEventType.FALLBACK_FAILED;
        }
    }
    
    record CircuitBreakerOpened(String target, int failures, Instant timestamp) implements FallbackEvent {
        @Override
        public FallbackEventType type() {
            return FallbackEventType.CIRCUIT_BREAKER_OPENED;
        }
    }
    
    record CircuitBreakerReset(String target, Instant timestamp) implements FallbackEvent {
        @Override
        public FallbackEventType type() {
            return FallbackEventType.CIRCUIT_BREAKER_RESET;
        }
    }
    
    record HealthStatusChanged(String providerId, boolean healthy, int consecutiveFailures,
                               Instant timestamp) implements FallbackEvent {
        @Override
        public FallbackEventType type() {
            return FallbackEventType.HEALTH_STATUS_CHANGED;
        }
    }
    
    record EmergencyModeActivated(Instant timestamp) implements FallbackEvent {
        @Override
        public FallbackEventType type() {
            return FallbackEventType.EMERGENCY_MODE_ACTIVATED;
        }
    }
    
    record EmergencyModeDeactivated(Instant timestamp) implements FallbackEvent {
        @Override
        public FallbackEventType type() {
            return FallbackEventType.EMERGENCY_MODE_DEACTIVATED;
        }
    }
}
