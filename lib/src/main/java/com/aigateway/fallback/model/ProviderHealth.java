package com.aigateway.fallback.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Health of an upstream provider as observed by the background monitor.
 */
public class ProviderHealth {
    
    private final String providerId;
    private final boolean healthy;
    private final double successRate;
    private final double averageResponseTime;
    private final double errorRate;
    private final Instant lastHealthCheck;
    private final int consecutiveFailures;
    private final String lastError;
    private final Map<String, Object> metadata;
    
    public ProviderHealth(String providerId, boolean healthy, double successRate,
                          double averageResponseTime, double errorRate, Instant lastHealthCheck,
                          int consecutiveFailures, String lastError, Map<String, Object> metadata) {
        this.providerId = providerId;
        this.healthy = healthy;
        this.successRate = successRate;
        this.averageResponseTime = averageResponseTime;
        this.errorRate = errorRate;
        this.lastHealthCheck = lastHealthCheck;
        this.consecutiveFailures = consecutiveFailures;
        this.lastError = lastError;
        this.metadata = Map.copyOf(metadata);
    }
    
    public String getProviderId() {
        return providerId;
    }
    
    public boolean isHealthy() {
        return healthy;
    }
    
    public double getSuccessRate() {
        return successRate;
    }
    
    /**
     * Smoothed probe latency in milliseconds.
     */
    public double getAverageResponseTime() {
        return averageResponseTime;
    }
    
    public double getErrorRate() {
        return errorRate;
    }
    
    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }
    
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
    
    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }
    
    public Map<String, Object> getMetadata() {
        return metadata;
    }
    
    @Override
    public String toString() {
        return String.format("ProviderHealth{provider='%s', healthy=%s, successRate=%.2f, avgResponse=%.1fms, " +
                           "consecutiveFailures=%d, lastError=%s}",
            providerId, healthy, successRate, averageResponseTime, consecutiveFailures, lastError);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String providerId;
        private boolean healthy = true;
        private double successRate = 1.0;
        private double averageResponseTime = 0.0;
        private double errorRate = 0.0;
        private Instant lastHealthCheck = Instant.EPOCH;
        private int consecutiveFailures = 0;
        private String lastError;
        private Map<String, Object> metadata = Map.of();
        
        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }
        
        public Builder healthy(boolean healthy) {
            this.healthy = healthy;
            return this;
        }
        
        public Builder successRate(double successRate) {
            this.successRate = successRate;
            return this;
        }
        
        public Builder averageResponseTime(double averageResponseTime) {
            this.averageResponseTime = averageResponseTime;
            return this;
        }
        
        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }
        
        public Builder lastHealthCheck(Instant lastHealthCheck) {
            this.lastHealthCheck = lastHealthCheck;
            return this;
        }
        
        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }
        
        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }
        
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }
        
        public ProviderHealth build() {
            return new ProviderHealth(providerId, healthy, successRate, averageResponseTime,
                                    errorRate, lastHealthCheck, consecutiveFailures, lastError,
                                    metadata == null ? Map.of() : metadata);
        }
    }
}
