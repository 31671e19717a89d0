package com.aigateway.fallback.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

class FallbackConfigurationTest {

    @Test
    void testDefaults() {
        FallbackConfiguration config = FallbackConfiguration.defaultConfig();

        assertTrue(config.isEnableFallbacks());
        assertEquals(3, config.getMaxFallbackAttempts());
        assertEquals(Duration.ofMillis(1000), config.getFallbackDelay());
        assertEquals(5, config.getProviderFailureThreshold());
        assertEquals(3, config.getAgentFailureThreshold());
        assertEquals(Duration.ofSeconds(60), config.getCircuitBreakerCooldown());
        assertEquals(Duration.ofSeconds(30), config.getHealthCheckInterval());
        assertEquals(Duration.ofSeconds(5), config.getHealthCheckTimeout());
        assertTrue(config.isHealthMonitoringEnabled());
        assertFalse(config.isHealthEventsOnTransitionOnly());
        assertEquals(List.of("openai", "claude", "gemini"), config.getMonitoredProviders());
        assertFalse(config.isEmergencyMode());
        assertEquals(0.7, config.getQualityThreshold());
        assertFalse(config.isEnforceQualityThreshold());
        assertEquals(Duration.ZERO, config.getAttemptTimeout());
        assertTrue(config.isInstallDefaultRoutes());
    }

    @Test
    void testCustomValues() {
        FallbackConfiguration config = FallbackConfiguration.builder()
            .enableFallbacks(false)
            .maxFallbackAttempts(5)
            .fallbackDelay(Duration.ofMillis(250))
            .providerFailureThreshold(2)
            .agentFailureThreshold(1)
            .circuitBreakerCooldown(Duration.ofSeconds(10))
            .monitoredProviders(List.of("openai"))
            .emergencyMode(true)
            .attemptTimeout(Duration.ofSeconds(2))
            .build();

        assertFalse(config.isEnableFallbacks());
        assertEquals(5, config.getMaxFallbackAttempts());
        assertEquals(Duration.ofMillis(250), config.getFallbackDelay());
        assertEquals(2, config.getProviderFailureThreshold());
        assertEquals(1, config.getAgentFailureThreshold());
        assertEquals(Duration.ofSeconds(10), config.getCircuitBreakerCooldown());
        assertEquals(List.of("openai"), config.getMonitoredProviders());
        assertTrue(config.isEmergencyMode());
        assertEquals(Duration.ofSeconds(2), config.getAttemptTimeout());
    }

    @Test
    void testNullDelayMeansNoDelay() {
        FallbackConfiguration config = FallbackConfiguration.builder().fallbackDelay(null).build();
        assertEquals(Duration.ZERO, config.getFallbackDelay());
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> FallbackConfiguration.builder().maxFallbackAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> FallbackConfiguration.builder().providerFailureThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> FallbackConfiguration.builder().agentFailureThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> FallbackConfiguration.builder().circuitBreakerCooldown(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> FallbackConfiguration.builder().healthCheckInterval(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> FallbackConfiguration.builder().qualityThreshold(1.5).build());
        assertThrows(IllegalArgumentException.class,
            () -> FallbackConfiguration.builder().attemptTimeout(Duration.ofMillis(-1)).build());
    }
}
