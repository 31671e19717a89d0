package com.aigateway.fallback.health;

import com.aigateway.fallback.model.HealthProbeResult;

import java.util.concurrent.CompletionStage;

/**
 * Checks whether an upstream AI provider is reachable.
 * Implementations should be cheap; the monitor bounds each call by the configured health check timeout.
 */
@FunctionalInterface
public interface HealthProbe {
    
    CompletionStage<HealthProbeResult> probe(String providerId);
}
