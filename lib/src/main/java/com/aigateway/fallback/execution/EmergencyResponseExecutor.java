package com.aigateway.fallback.execution;

import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Endpoint executor that answers the {@value #EMERGENCY_TARGET} target with a canned,
 * degraded payload and forwards every other endpoint route to a delegate.
 */
public class EmergencyResponseExecutor implements RouteExecutor {
    
    private static final Logger logger = LoggerFactory.getLogger(EmergencyResponseExecutor.class);
    
    public static final String EMERGENCY_TARGET = "emergency";
    public static final double EMERGENCY_QUALITY_SCORE = 0.3;
    
    private final RouteExecutor delegate;
    private final Clock clock;
    
    /**
     * @param delegate executor for non-emergency endpoint routes, may be null
     * @param clock clock stamping the emergency payload
     */
    public EmergencyResponseExecutor(RouteExecutor delegate, Clock clock) {
        this.delegate = delegate;
        this.clock = clock;
    }
    
    public static boolean isEmergencyTarget(FallbackRoute route) {
        return EMERGENCY_TARGET.equals(route.getTarget());
    }
    
    public boolean hasDelegate() {
        return delegate != null;
    }
    
    @Override
    public CompletableFuture<RouteExecutionResult> execute(FallbackRoute route, FallbackContext context) {
        if (isEmergencyTarget(route)) {
            logger.warn("Serving emergency response for request {}", context.getRequestId());
            return CompletableFuture.completedFuture(
                RouteExecutionResult.success(emergencyPayload(), EMERGENCY_QUALITY_SCORE));
        }
        if (delegate == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                "No endpoint executor registered for target " + route.getTarget()));
        }
        return delegate.execute(route, context);
    }
    
    private Map<String, Object> emergencyPayload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "emergency_mode");
        data.put("message", "Service is currently experiencing issues. Emergency fallback activated.");
        data.put("response", "I apologize, but I am currently experiencing technical difficulties. "
            + "Please try again later or contact support.");
        data.put("emergency", true);
        data.put("timestamp", clock.instant().toString());
        return data;
    }
}
