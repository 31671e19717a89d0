package com.aigateway.fallback.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A rule mapping a failing source to an alternative target.
 * 
 * <p>Routes are ordered by {@link #getPriority()} (smaller first). The {@link #getSource()}
 * is either an exact provider, agent or endpoint name or {@link #WILDCARD_SOURCE}.
 * The condition must be a side-effect free predicate over the failure context.
 * 
 * <p>{@code successRate} and {@code lastUsed} are the only mutable fields. They are
 * updated by the orchestrator while requests are in flight.
 */
public class FallbackRoute {
    
    public static final String WILDCARD_SOURCE = "*";
    
    /**
     * Smoothing factor of the success rate moving average.
     */
    public static final double SUCCESS_RATE_ALPHA = 0.1;
    
    private final String id;
    private final RouteType type;
    private final int priority;
    private final String source;
    private final String target;
    private final Predicate<FallbackContext> condition;
    private final boolean enabled;
    private final Map<String, Object> metadata;
    private double successRate;
    private Instant lastUsed;
    
    private FallbackRoute(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.priority = builder.priority;
        this.source = builder.source;
        this.target = builder.target;
        this.condition = builder.condition;
        this.enabled = builder.enabled;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.successRate = builder.successRate;
        this.lastUsed = builder.lastUsed;
    }
    
    public String getId() {
        return id;
    }
    
    public RouteType getType() {
        return type;
    }
    
    public int getPriority() {
        return priority;
    }
    
    public String getSource() {
        return source;
    }
    
    public String getTarget() {
        return target;
    }
    
    public Predicate<FallbackContext> getCondition() {
        return condition;
    }
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public Map<String, Object> getMetadata() {
        return metadata;
    }
    
    public synchronized double getSuccessRate() {
        return successRate;
    }
    
    public synchronized Instant getLastUsed() {
        return lastUsed;
    }
    
    /**
     * True when the route's source is the wildcard or equals one of the context's
     * original provider, agent or endpoint.
     */
    public boolean matchesSource(FallbackContext context) {
        if (WILDCARD_SOURCE.equals(source)) {
            return true;
        }
        return source.equals(context.getOriginalProvider().orElse(null))
            || source.equals(context.getOriginalAgent().orElse(null))
            || source.equals(context.getOriginalEndpoint().orElse(null));
    }
    
    /**
     * Folds one attempt outcome into the success rate moving average.
     *
     * @return the updated success rate
     */
    public synchronized double recordOutcome(boolean success) {
        double sample = success ? 1.0 : 0.0;
        successRate = SUCCESS_RATE_ALPHA * sample + (1 - SUCCESS_RATE_ALPHA) * successRate;
        return successRate;
    }
    
    public synchronized void markUsed(Instant when) {
        this.lastUsed = when;
    }
    
    /**
     * Detached copy carrying the current success rate and last use.
     */
    public synchronized FallbackRoute snapshot() {
        return toBuilder().build();
    }
    
    public synchronized Builder toBuilder() {
        return builder()
            .id(id)
            .type(type)
            .priority(priority)
            .source(source)
            .target(target)
            .condition(condition)
            .enabled(enabled)
            .successRate(successRate)
            .lastUsed(lastUsed)
            .metadata(metadata);
    }
    
    @Override
    public String toString() {
        return String.format("FallbackRoute{id='%s', type=%s, priority=%d, source='%s', target='%s', " +
                           "enabled=%s, successRate=%.3f}",
            id, type, priority, source, target, enabled, getSuccessRate());
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String id;
        private RouteType type;
        private int priority = 1;
        private String source = WILDCARD_SOURCE;
        private String target;
        private Predicate<FallbackContext> condition = context -> true;
        private boolean enabled = true;
        private double successRate = 1.0;
        private Instant lastUsed = Instant.EPOCH;
        private Map<String, Object> metadata = Map.of();
        
        public Builder id(String id) {
            this.id = id;
            return this;
        }
        
        public Builder type(RouteType type) {
            this.type = type;
            return this;
        }
        
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }
        
        public Builder source(String source) {
            this.source = source;
            return this;
        }
        
        public Builder target(String target) {
            this.target = target;
            return this;
        }
        
        public Builder condition(Predicate<FallbackContext> condition) {
            this.condition = condition;
            return this;
        }
        
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }
        
        public Builder successRate(double successRate) {
            this.successRate = successRate;
            return this;
        }
        
        public Builder lastUsed(Instant lastUsed) {
            this.lastUsed = lastUsed;
            return this;
        }
        
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }
        
        public FallbackRoute build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Route id must not be blank");
            }
            Objects.requireNonNull(type, "Route type must be provided for route " + id);
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("Route target must not be blank for route " + id);
            }
            if (source == null || source.isBlank()) {
                throw new IllegalArgumentException("Route source must not be blank for route " + id);
            }
            Objects.requireNonNull(condition, "Route condition must be provided for route " + id);
            if (successRate < 0.0 || successRate > 1.0) {
                throw new IllegalArgumentException("Success rate must be within [0, 1] for route " + id);
            }
            if (metadata == null) {
                metadata = Map.of();
            }
            return new FallbackRoute(this);
        }
    }
}
