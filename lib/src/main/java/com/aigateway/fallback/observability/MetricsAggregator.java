package com.aigateway.fallback.observability;

import com.aigateway.fallback.model.FallbackMetrics;
import com.aigateway.fallback.model.RouteType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Collects fallback counters and per-route usage.
 * 
 * <p>The snapshot counters returned by {@link #getMetrics()} are guarded by this
 * instance's monitor and can be reset. Every update is mirrored into a Micrometer
 * registry, whose counters stay monotonic across resets.
 */
public class MetricsAggregator {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsAggregator.class);
    
    private final MeterRegistry meterRegistry;
    private final Counter totalCounter;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter providerSwitchCounter;
    private final Counter agentSwitchCounter;
    private final Counter emergencyCounter;
    private final Timer fallbackDuration;
    
    private long totalFallbacks;
    private long successfulFallbacks;
    private long failedFallbacks;
    private long providerSwitches;
    private long agentSwitches;
    private long emergencyActivations;
    private long successfulDurationMillis;
    private final Map<String, Long> routesUsed = new HashMap<>();
    
    public MetricsAggregator() {
        this(new SimpleMeterRegistry());
    }
    
    public MetricsAggregator(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.totalCounter = Counter.builder("fallback.executions.total")
            .description("Total number of fallback executions")
            .register(meterRegistry);
        
        this.successCounter = Counter.builder("fallback.executions.successful")
            .description("Fallback executions that found a working route")
            .register(meterRegistry);
        
        this.failureCounter = Counter.builder("fallback.executions.failed")
            .description("Fallback executions that exhausted their routes")
            .register(meterRegistry);
        
        this.providerSwitchCounter = Counter.builder("fallback.switches")
            .tag("type", RouteType.PROVIDER.getId())
            .description("Successful switches to another provider")
            .register(meterRegistry);
        
        this.agentSwitchCounter = Counter.builder("fallback.switches")
            .tag("type", RouteType.AGENT.getId())
            .description("Successful switches to another agent")
            .register(meterRegistry);
        
        this.emergencyCounter = Counter.builder("fallback.emergency.activations")
            .description("Emergency responses served")
            .register(meterRegistry);
        
        this.fallbackDuration = Timer.builder("fallback.duration")
            .description("Duration of fallback executions")
            .register(meterRegistry);
        
        logger.debug("Metrics aggregator initialized");
    }
    
    public void recordFallbackStarted() {
        synchronized (this) {
            totalFallbacks++;
        }
        totalCounter.increment();
    }
    
    /**
     * Records a fallback execution that ended on a working route.
     */
    public void recordFallbackSuccess(RouteType routeType, Duration duration) {
        synchronized (this) {
            successfulFallbacks++;
            successfulDurationMillis += duration.toMillis();
            if (routeType == RouteType.PROVIDER) {
                providerSwitches++;
            } else if (routeType == RouteType.AGENT) {
                agentSwitches++;
            }
        }
        successCounter.increment();
        if (routeType == RouteType.PROVIDER) {
            providerSwitchCounter.increment();
        } else if (routeType == RouteType.AGENT) {
            agentSwitchCounter.increment();
        }
        fallbackDuration.record(duration);
    }
    
    public void recordFallbackFailure(Duration duration) {
        synchronized (this) {
            failedFallbacks++;
        }
        failureCounter.increment();
        fallbackDuration.record(duration);
    }
    
    /**
     * Counts one attempt of a route, whatever its outcome.
     */
    public void recordRouteAttempt(String routeId, boolean success) {
        synchronized (this) {
            routesUsed.merge(routeId, 1L, Long::sum);
        }
        Counter.builder("fallback.route.attempts")
            .tag("route", routeId)
            .tag("outcome", success ? "success" : "failure")
            .description("Attempts per fallback route")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordEmergencyActivation() {
        synchronized (this) {
            emergencyActivations++;
        }
        emergencyCounter.increment();
    }
    
    public void recordCircuitBreakerEvent(String target, String event) {
        Counter.builder("fallback.circuit_breaker")
            .tag("target", target)
            .tag("event", event)
            .description("Circuit breaker events")
            .register(meterRegistry)
            .increment();
    }
    
    /**
     * Returns an immutable copy of the current counters.
     */
    public synchronized FallbackMetrics getMetrics() {
        Duration average = successfulFallbacks == 0
            ? Duration.ZERO
            : Duration.ofMillis(successfulDurationMillis / successfulFallbacks);
        return new FallbackMetrics(totalFallbacks, successfulFallbacks, failedFallbacks,
                                 providerSwitches, agentSwitches, emergencyActivations,
                                 routesUsed, average);
    }
    
    public synchronized void resetMetrics() {
        totalFallbacks = 0;
        successfulFallbacks = 0;
        failedFallbacks = 0;
        providerSwitches = 0;
        agentSwitches = 0;
        emergencyActivations = 0;
        successfulDurationMillis = 0;
        routesUsed.clear();
        
        logger.info("Fallback router metrics reset");
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
