package com.aigateway.fallback.model;

/**
 * Result of probing one upstream provider.
 *
 * @param healthy whether the provider answered as expected
 * @param responseTimeMs observed probe latency
 * @param message optional detail, typically the failure reason
 */
public record HealthProbeResult(boolean healthy, double responseTimeMs, String message) {
    
    public static HealthProbeResult healthy(double responseTimeMs) {
        return new HealthProbeResult(true, responseTimeMs, null);
    }
    
    public static HealthProbeResult unhealthy(double responseTimeMs, String message) {
        return new HealthProbeResult(false, responseTimeMs, message);
    }
}
