package com.aigateway.fallback.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single route executor call.
 */
public record RouteExecutionResult(
    boolean success,
    Map<String, Object> data,
    Double qualityScore,
    Throwable error
) {
    
    public RouteExecutionResult {
        // payloads may carry null values, so Map.copyOf is not an option
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
    
    public static RouteExecutionResult success(Map<String, Object> data, Double qualityScore) {
        return new RouteExecutionResult(true, data, qualityScore, null);
    }
    
    public static RouteExecutionResult failure(Throwable error) {
        return new RouteExecutionResult(false, Map.of(), null, error);
    }
}
