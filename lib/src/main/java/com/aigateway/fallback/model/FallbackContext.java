package com.aigateway.fallback.model;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Describes why a primary call failed and how far fallback routing has progressed.
 * 
 * <p>The context is mutated in place by the orchestrator: {@link #getAttempt()} grows
 * by one per route actually tried. A context belongs to a single fallback execution.
 */
public class FallbackContext {
    
    private final String requestId;
    private final String originalProvider;
    private final String originalAgent;
    private final String originalEndpoint;
    private final Throwable error;
    private final AtomicInteger attempt;
    private final int maxAttempts;
    private final Double quality;
    private final Duration timeout;
    private final String userId;
    private final Map<String, Object> metadata;
    
    private FallbackContext(Builder builder) {
        this.requestId = builder.requestId;
        this.originalProvider = builder.originalProvider;
        this.originalAgent = builder.originalAgent;
        this.originalEndpoint = builder.originalEndpoint;
        this.error = builder.error;
        this.attempt = new AtomicInteger(builder.attempt);
        this.maxAttempts = builder.maxAttempts;
        this.quality = builder.quality;
        this.timeout = builder.timeout;
        this.userId = builder.userId;
        this.metadata = new ConcurrentHashMap<>(builder.metadata);
    }
    
    public String getRequestId() {
        return requestId;
    }
    
    public Optional<String> getOriginalProvider() {
        return Optional.ofNullable(originalProvider);
    }
    
    public Optional<String> getOriginalAgent() {
        return Optional.ofNullable(originalAgent);
    }
    
    public Optional<String> getOriginalEndpoint() {
        return Optional.ofNullable(originalEndpoint);
    }
    
    public Throwable getError() {
        return error;
    }
    
    public int getAttempt() {
        return attempt.get();
    }
    
    public int incrementAttempt() {
        return attempt.incrementAndGet();
    }
    
    public int getMaxAttempts() {
        return maxAttempts;
    }
    
    public Optional<Double> getQuality() {
        return Optional.ofNullable(quality);
    }
    
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }
    
    public Optional<String> getUserId() {
        return Optional.ofNullable(userId);
    }
    
    /**
     * Mutable, thread-safe metadata bag. Null keys and values are not supported.
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }
    
    @Override
    public String toString() {
        return String.format("FallbackContext{requestId='%s', provider=%s, agent=%s, endpoint=%s, attempt=%d/%d}",
            requestId, originalProvider, originalAgent, originalEndpoint, attempt.get(), maxAttempts);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String requestId;
        private String originalProvider;
        private String originalAgent;
        private String originalEndpoint;
        private Throwable error;
        private int attempt = 0;
        private int maxAttempts = 0;
        private Double quality;
        private Duration timeout;
        private String userId;
        private Map<String, Object> metadata = Map.of();
        
        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }
        
        public Builder originalProvider(String originalProvider) {
            this.originalProvider = originalProvider;
            return this;
        }
        
        public Builder originalAgent(String originalAgent) {
            this.originalAgent = originalAgent;
            return this;
        }
        
        public Builder originalEndpoint(String originalEndpoint) {
            this.originalEndpoint = originalEndpoint;
            return this;
        }
        
        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }
        
        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }
        
        /**
         * Per-request attempt bound. Zero or less defers to the configured bound.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }
        
        public Builder quality(Double quality) {
            this.quality = quality;
            return this;
        }
        
        /**
         * Deadline applied to each route attempt of this request.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }
        
        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }
        
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }
        
        public FallbackContext build() {
            if (requestId == null || requestId.isBlank()) {
                throw new IllegalArgumentException("Request id must not be blank");
            }
            if (attempt < 0) {
                throw new IllegalArgumentException("Attempt must not be negative");
            }
            if (metadata == null) {
                metadata = Map.of();
            }
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new IllegalArgumentException("Context metadata does not support null keys or values (key '"
                        + entry.getKey() + "')");
                }
            }
            return new FallbackContext(this);
        }
    }
}
