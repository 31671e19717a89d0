package com.aigateway.fallback.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured outcome of a fallback execution.
 * 
 * <p>Failures are reported here rather than thrown: {@link #getError()} holds the most
 * recent underlying error and {@link #getFallbacksAttempted()} the ids of every route
 * that was actually tried, in order.
 */
public class FallbackResult {
    
    private final boolean success;
    private final Map<String, Object> data;
    private final Throwable error;
    private final FallbackRoute routeUsed;
    private final List<String> fallbacksAttempted;
    private final Duration totalDuration;
    private final Double qualityScore;
    private final Map<String, Object> metadata;
    
    private FallbackResult(Builder builder) {
        this.success = builder.success;
        this.data = builder.data == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.error = builder.error;
        this.routeUsed = builder.routeUsed;
        this.fallbacksAttempted = List.copyOf(builder.fallbacksAttempted);
        this.totalDuration = builder.totalDuration;
        this.qualityScore = builder.qualityScore;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }
    
    public boolean isSuccess() {
        return success;
    }
    
    public Map<String, Object> getData() {
        return data;
    }
    
    public Throwable getError() {
        return error;
    }
    
    public Optional<FallbackRoute> getRouteUsed() {
        return Optional.ofNullable(routeUsed);
    }
    
    public List<String> getFallbacksAttempted() {
        return fallbacksAttempted;
    }
    
    public Duration getTotalDuration() {
        return totalDuration;
    }
    
    public Optional<Double> getQualityScore() {
        return Optional.ofNullable(qualityScore);
    }
    
    public Map<String, Object> getMetadata() {
        return metadata;
    }
    
    @Override
    public String toString() {
        return String.format("FallbackResult{success=%s, route=%s, attempted=%s, duration=%dms, error=%s}",
            success, routeUsed == null ? null : routeUsed.getId(), fallbacksAttempted,
            totalDuration.toMillis(), error == null ? null : error.getMessage());
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private boolean success;
        private Map<String, Object> data;
        private Throwable error;
        private FallbackRoute routeUsed;
        private List<String> fallbacksAttempted = List.of();
        private Duration totalDuration = Duration.ZERO;
        private Double qualityScore;
        private Map<String, Object> metadata = Map.of();
        
        public Builder success(boolean success) {
            this.success = success;
            return this;
        }
        
        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }
        
        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }
        
        public Builder routeUsed(FallbackRoute routeUsed) {
            this.routeUsed = routeUsed;
            return this;
        }
        
        public Builder fallbacksAttempted(List<String> fallbacksAttempted) {
            this.fallbacksAttempted = fallbacksAttempted;
            return this;
        }
        
        public Builder totalDuration(Duration totalDuration) {
            this.totalDuration = totalDuration;
            return this;
        }
        
        public Builder qualityScore(Double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }
        
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }
        
        public FallbackResult build() {
            return new FallbackResult(this);
        }
    }
}
