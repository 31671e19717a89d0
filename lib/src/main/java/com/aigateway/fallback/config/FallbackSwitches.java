package com.aigateway.fallback.config;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime toggles that operators flip while the router is serving traffic.
 */
public class FallbackSwitches {
    
    private final AtomicBoolean fallbacksEnabled;
    private final AtomicBoolean emergencyMode;
    
    public FallbackSwitches(FallbackConfiguration configuration) {
        this.fallbacksEnabled = new AtomicBoolean(configuration.isEnableFallbacks());
        this.emergencyMode = new AtomicBoolean(configuration.isEmergencyMode());
    }
    
    public boolean isFallbacksEnabled() {
        return fallbacksEnabled.get();
    }
    
    /**
     * @return the previous value
     */
    public boolean setFallbacksEnabled(boolean enabled) {
        return fallbacksEnabled.getAndSet(enabled);
    }
    
    public boolean isEmergencyMode() {
        return emergencyMode.get();
    }
    
    /**
     * @return the previous value
     */
    public boolean setEmergencyMode(boolean enabled) {
        return emergencyMode.getAndSet(enabled);
    }
}
