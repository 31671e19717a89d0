package com.aigateway.fallback.config;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for fallback routing, circuit breaking and provider health monitoring.
 * This class encapsulates all fallback-related settings. Values are fixed once built;
 * the two runtime toggles ({@code enableFallbacks}, {@code emergencyMode}) only seed
 * {@link FallbackSwitches}.
 */
public class FallbackConfiguration {
    
    private final boolean enableFallbacks;
    private final int maxFallbackAttempts;
    private final Duration fallbackDelay;
    private final int providerFailureThreshold;
    private final int agentFailureThreshold;
    private final Duration circuitBreakerCooldown;
    private final Duration healthCheckInterval;
    private final Duration healthCheckTimeout;
    private final boolean healthMonitoringEnabled;
    private final boolean healthEventsOnTransitionOnly;
    private final List<String> monitoredProviders;
    private final boolean emergencyMode;
    private final double qualityThreshold;
    private final boolean enforceQualityThreshold;
    private final Duration attemptTimeout;
    private final boolean installDefaultRoutes;
    
    private FallbackConfiguration(Builder builder) {
        this.enableFallbacks = builder.enableFallbacks;
        this.maxFallbackAttempts = builder.maxFallbackAttempts;
        this.fallbackDelay = builder.fallbackDelay;
        this.providerFailureThreshold = builder.providerFailureThreshold;
        this.agentFailureThreshold = builder.agentFailureThreshold;
        this.circuitBreakerCooldown = builder.circuitBreakerCooldown;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.healthCheckTimeout = builder.healthCheckTimeout;
        this.healthMonitoringEnabled = builder.healthMonitoringEnabled;
        this.healthEventsOnTransitionOnly = builder.healthEventsOnTransitionOnly;
        this.monitoredProviders = List.copyOf(builder.monitoredProviders);
        this.emergencyMode = builder.emergencyMode;
        this.qualityThreshold = builder.qualityThreshold;
        this.enforceQualityThreshold = builder.enforceQualityThreshold;
        this.attemptTimeout = builder.attemptTimeout;
        this.installDefaultRoutes = builder.installDefaultRoutes;
    }
    
    public boolean isEnableFallbacks() {
        return enableFallbacks;
    }
    
    public int getMaxFallbackAttempts() {
        return maxFallbackAttempts;
    }
    
    public Duration getFallbackDelay() {
        return fallbackDelay;
    }
    
    public int getProviderFailureThreshold() {
        return providerFailureThreshold;
    }
    
    public int getAgentFailureThreshold() {
        return agentFailureThreshold;
    }
    
    public Duration getCircuitBreakerCooldown() {
        return circuitBreakerCooldown;
    }
    
    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }
    
    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }
    
    public boolean isHealthMonitoringEnabled() {
        return healthMonitoringEnabled;
    }
    
    public boolean isHealthEventsOnTransitionOnly() {
        return healthEventsOnTransitionOnly;
    }
    
    public List<String> getMonitoredProviders() {
        return monitoredProviders;
    }
    
    public boolean isEmergencyMode() {
        return emergencyMode;
    }
    
    public double getQualityThreshold() {
        return qualityThreshold;
    }
    
    public boolean isEnforceQualityThreshold() {
        return enforceQualityThreshold;
    }
    
    /**
     * Default per-attempt deadline. {@link Duration#ZERO} disables it.
     */
    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }
    
    public boolean isInstallDefaultRoutes() {
        return installDefaultRoutes;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static FallbackConfiguration defaultConfig() {
        return builder().build();
    }
    
    public static class Builder {
        private boolean enableFallbacks = true;
        private int maxFallbackAttempts = 3;
        private Duration fallbackDelay = Duration.ofMillis(1000);
        private int providerFailureThreshold = 5;
        private int agentFailureThreshold = 3;
        private Duration circuitBreakerCooldown = Duration.ofSeconds(60);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private boolean healthMonitoringEnabled = true;
        private boolean healthEventsOnTransitionOnly = false;
        private List<String> monitoredProviders = List.of("openai", "claude", "gemini");
        private boolean emergencyMode = false;
        private double qualityThreshold = 0.7;
        private boolean enforceQualityThreshold = false;
        private Duration attemptTimeout = Duration.ZERO;
        private boolean installDefaultRoutes = true;
        
        public Builder enableFallbacks(boolean enable) {
            this.enableFallbacks = enable;
            return this;
        }
        
        public Builder maxFallbackAttempts(int attempts) {
            this.maxFallbackAttempts = attempts;
            return this;
        }
        
        public Builder fallbackDelay(Duration delay) {
            this.fallbackDelay = delay;
            return this;
        }
        
        public Builder providerFailureThreshold(int threshold) {
            this.providerFailureThreshold = threshold;
            return this;
        }
        
        public Builder agentFailureThreshold(int threshold) {
            this.agentFailureThreshold = threshold;
            return this;
        }
        
        public Builder circuitBreakerCooldown(Duration cooldown) {
            this.circuitBreakerCooldown = cooldown;
            return this;
        }
        
        public Builder healthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }
        
        public Builder healthCheckTimeout(Duration timeout) {
            this.healthCheckTimeout = timeout;
            return this;
        }
        
        public Builder healthMonitoringEnabled(boolean enabled) {
            this.healthMonitoringEnabled = enabled;
            return this;
        }
        
        public Builder healthEventsOnTransitionOnly(boolean transitionOnly) {
            this.healthEventsOnTransitionOnly = transitionOnly;
            return this;
        }
        
        public Builder monitoredProviders(List<String> providers) {
            this.monitoredProviders = providers;
            return this;
        }
        
        public Builder emergencyMode(boolean emergencyMode) {
            this.emergencyMode = emergencyMode;
            return this;
        }
        
        public Builder qualityThreshold(double threshold) {
            this.qualityThreshold = threshold;
            return this;
        }
        
        public Builder enforceQualityThreshold(boolean enforce) {
            this.enforceQualityThreshold = enforce;
            return this;
        }
        
        public Builder attemptTimeout(Duration timeout) {
            this.attemptTimeout = timeout;
            return this;
        }
        
        public Builder installDefaultRoutes(boolean install) {
            this.installDefaultRoutes = install;
            return this;
        }
        
        public FallbackConfiguration build() {
            if (maxFallbackAttempts < 1) {
                throw new IllegalArgumentException("maxFallbackAttempts must be at least 1");
            }
            if (providerFailureThreshold < 1 || agentFailureThreshold < 1) {
                throw new IllegalArgumentException("Failure thresholds must be at least 1");
            }
            if (fallbackDelay == null) {
                fallbackDelay = Duration.ZERO;
            }
            if (attemptTimeout == null || attemptTimeout.isNegative()) {
                throw new IllegalArgumentException("attemptTimeout must be zero or positive");
            }
            requirePositive(circuitBreakerCooldown, "circuitBreakerCooldown");
            requirePositive(healthCheckInterval, "healthCheckInterval");
            requirePositive(healthCheckTimeout, "healthCheckTimeout");
            if (qualityThreshold < 0.0 || qualityThreshold > 1.0) {
                throw new IllegalArgumentException("qualityThreshold must be within [0, 1]");
            }
            if (monitoredProviders == null) {
                monitoredProviders = List.of();
            }
            return new FallbackConfiguration(this);
        }
        
        private static void requirePositive(Duration duration, String name) {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
