package com.aigateway.fallback.observability;

/**
 * Names of the events published by the fallback router.
 */
public enum FallbackEventType {
    FALLBACK_SUCCESS("fallbackSuccess"),
    FALLBACK_FAILED("fallbackFailed"),
    CIRCUIT_BREAKER_OPENED("circuitBreakerOpened"),
    CIRCUIT_BREAKER_RESET("circuitBreakerReset"),
    HEALTH_STATUS_CHANGED("healthStatusChanged"),
    EMERGENCY_MODE_ACTIVATED("emergencyModeActivated"),
    EMERGENCY_MODE_DEACTIVATED("emergencyModeDeactivated");
    
    private final String eventName;
    
    FallbackEventType(String eventName) {
        this.eventName = eventName;
    }
    
    public String getEventName() {
        return eventName;
    }
}
