package com.aigateway.fallback.model;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable snapshot of fallback counters.
 */
public class FallbackMetrics {
    
    private final long totalFallbacks;
    private final long successfulFallbacks;
    private final long failedFallbacks;
    private final long providerSwitches;
    private final long agentSwitches;
    private final long emergencyActivations;
    private final Map<String, Long> routesUsed;
    private final Duration averageFallbackTime;
    
    public FallbackMetrics(long totalFallbacks, long successfulFallbacks, long failedFallbacks,
                           long providerSwitches, long agentSwitches, long emergencyActivations,
                           Map<String, Long> routesUsed, Duration averageFallbackTime) {
        this.totalFallbacks = totalFallbacks;
        this.successfulFallbacks = successfulFallbacks;
        this.failedFallbacks = failedFallbacks;
        this.providerSwitches = providerSwitches;
        this.agentSwitches = agentSwitches;
        this.emergencyActivations = emergencyActivations;
        this.routesUsed = Map.copyOf(routesUsed);
        this.averageFallbackTime = averageFallbackTime;
    }
    
    public long getTotalFallbacks() {
        return totalFallbacks;
    }
    
    public long getSuccessfulFallbacks() {
        return successfulFallbacks;
    }
    
    public long getFailedFallbacks() {
        return failedFallbacks;
    }
    
    public long getProviderSwitches() {
        return providerSwitches;
    }
    
    public long getAgentSwitches() {
        return agentSwitches;
    }
    
    public long getEmergencyActivations() {
        return emergencyActivations;
    }
    
    /**
     * Attempt count per route id, successful and failed attempts alike.
     */
    public Map<String, Long> getRoutesUsed() {
        return routesUsed;
    }
    
    /**
     * Mean total duration of successful fallback executions.
     */
    public Duration getAverageFallbackTime() {
        return averageFallbackTime;
    }
    
    public double getSuccessRate() {
        long finished = successfulFallbacks + failedFallbacks;
        if (finished == 0) {
            return 0.0;
        }
        return (double) successfulFallbacks / finished;
    }
    
    @Override
    public String toString() {
        return String.format("FallbackMetrics{total=%d, successful=%d, failed=%d, providerSwitches=%d, " +
                           "agentSwitches=%d, emergencyActivations=%d, averageFallbackTime=%dms}",
            totalFallbacks, successfulFallbacks, failedFallbacks, providerSwitches,
            agentSwitches, emergencyActivations, averageFallbackTime.toMillis());
    }
}
