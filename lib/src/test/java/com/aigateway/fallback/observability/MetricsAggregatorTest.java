package com.aigateway.fallback.observability;

import static org.junit.jupiter.api.Assertions.*;

import com.aigateway.fallback.model.FallbackMetrics;
import com.aigateway.fallback.model.RouteType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

class MetricsAggregatorTest {

    private MeterRegistry meterRegistry;
    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new MetricsAggregator(meterRegistry);
    }

    @Test
    void testConstructorWithDefaultRegistry() {
        MetricsAggregator defaultAggregator = new MetricsAggregator();
        assertNotNull(defaultAggregator.getMeterRegistry());
        assertEquals(0, defaultAggregator.getMetrics().getTotalFallbacks());
    }

    @Test
    void testSuccessCountsSwitchesByRouteType() {
        aggregator.recordFallbackStarted();
        aggregator.recordFallbackSuccess(RouteType.PROVIDER, Duration.ofMillis(100));
        aggregator.recordFallbackStarted();
        aggregator.recordFallbackSuccess(RouteType.AGENT, Duration.ofMillis(300));
        aggregator.recordFallbackStarted();
        aggregator.recordFallbackSuccess(RouteType.ENDPOINT, Duration.ofMillis(200));

        FallbackMetrics metrics = aggregator.getMetrics();
        assertEquals(3, metrics.getTotalFallbacks());
        assertEquals(3, metrics.getSuccessfulFallbacks());
        assertEquals(1, metrics.getProviderSwitches());
        assertEquals(1, metrics.getAgentSwitches());
        assertEquals(Duration.ofMillis(200), metrics.getAverageFallbackTime());
        assertEquals(1.0, metrics.getSuccessRate(), 1e-9);

        assertEquals(3.0, meterRegistry.counter("fallback.executions.successful").count());
        assertEquals(1.0, meterRegistry.counter("fallback.switches", "type", "provider").count());
        assertEquals(1.0, meterRegistry.counter("fallback.switches", "type", "agent").count());
        assertEquals(3, meterRegistry.timer("fallback.duration").count());
    }

    @Test
    void testAverageIgnoresFailedExecutions() {
        aggregator.recordFallbackSuccess(RouteType.PROVIDER, Duration.ofMillis(100));
        aggregator.recordFallbackFailure(Duration.ofSeconds(10));

        FallbackMetrics metrics = aggregator.getMetrics();
        assertEquals(Duration.ofMillis(100), metrics.getAverageFallbackTime());
        assertEquals(1, metrics.getFailedFallbacks());
        assertEquals(1.0, meterRegistry.counter("fallback.executions.failed").count());
    }

    @Test
    void testRouteAttemptsCountSuccessAndFailure() {
        aggregator.recordRouteAttempt("openai-to-claude", false);
        aggregator.recordRouteAttempt("openai-to-claude", true);
        aggregator.recordRouteAttempt("claude-to-gemini", true);

        assertEquals(Map.of("openai-to-claude", 2L, "claude-to-gemini", 1L), aggregator.getMetrics().getRoutesUsed());
        assertEquals(1.0, meterRegistry.counter("fallback.route.attempts",
            "route", "openai-to-claude", "outcome", "failure").count());
        assertEquals(1.0, meterRegistry.counter("fallback.route.attempts",
            "route", "openai-to-claude", "outcome", "success").count());
    }

    @Test
    void testSnapshotIsIsolatedFromLaterUpdates() {
        aggregator.recordRouteAttempt("openai-to-claude", true);
        FallbackMetrics snapshot = aggregator.getMetrics();

        aggregator.recordRouteAttempt("openai-to-claude", true);
        aggregator.recordEmergencyActivation();

        assertEquals(1L, snapshot.getRoutesUsed().get("openai-to-claude"));
        assertEquals(0, snapshot.getEmergencyActivations());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.getRoutesUsed().put("x", 1L));
    }

    @Test
    void testResetZeroesCountersButKeepsMeters() {
        aggregator.recordFallbackStarted();
        aggregator.recordFallbackSuccess(RouteType.PROVIDER, Duration.ofMillis(100));
        aggregator.recordRouteAttempt("openai-to-claude", true);
        aggregator.recordEmergencyActivation();

        aggregator.resetMetrics();

        FallbackMetrics metrics = aggregator.getMetrics();
        assertEquals(0, metrics.getTotalFallbacks());
        assertEquals(0, metrics.getSuccessfulFallbacks());
        assertEquals(0, metrics.getProviderSwitches());
        assertEquals(0, metrics.getEmergencyActivations());
        assertTrue(metrics.getRoutesUsed().isEmpty());
        assertEquals(Duration.ZERO, metrics.getAverageFallbackTime());
        assertEquals(1.0, meterRegistry.counter("fallback.executions.total").count());
    }

    @Test
    void testCircuitBreakerEventsAreTagged() {
        aggregator.recordCircuitBreakerEvent("claude", "opened");
        aggregator.recordCircuitBreakerEvent("claude", "opened");

        assertEquals(2.0, meterRegistry.counter("fallback.circuit_breaker", "target", "claude", "event", "opened").count());
    }
}
