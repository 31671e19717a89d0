package com.aigateway.fallback.routing;

import com.aigateway.fallback.execution.EmergencyResponseExecutor;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteType;

import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Routes every router starts with.
 */
public final class DefaultRoutes {
    
    public static final String EMERGENCY_ROUTE_ID = "emergency-simple-response";
    public static final int EMERGENCY_PRIORITY = 10;
    
    private DefaultRoutes() {
    }
    
    /**
     * Provider rotation openai → claude → gemini → openai, and agent downgrades.
     */
    public static List<FallbackRoute> providerAndAgentRoutes() {
        return List.of(
            providerRoute("openai-to-claude", 1, "openai", "claude", 0.8),
            providerRoute("claude-to-gemini", 2, "claude", "gemini", 0.75),
            providerRoute("gemini-to-openai", 3, "gemini", "openai", 0.85),
            FallbackRoute.builder()
                .id("gpt4-to-gpt35")
                .type(RouteType.AGENT)
                .priority(1)
                .source("gpt-4")
                .target("gpt-3.5-turbo")
                .condition(context -> FallbackConditions.isModelError(context)
                    || FallbackConditions.isCostConstraint(context))
                .successRate(0.9)
                .metadata(Map.of("type", "agent_fallback", "reason", "cost_optimization"))
                .build(),
            FallbackRoute.builder()
                .id("claude3-to-claude2")
                .type(RouteType.AGENT)
                .priority(2)
                .source("claude-3-sonnet")
                .target("claude-instant")
                .condition(FallbackConditions::isModelError)
                .successRate(0.85)
                .metadata(Map.of("type", "agent_fallback", "reason", "model_failure"))
                .build()
        );
    }
    
    /**
     * Catch-all route to the canned emergency response, applicable only while
     * emergency mode is on.
     */
    public static FallbackRoute emergencyRoute(BooleanSupplier emergencyMode) {
        return FallbackRoute.builder()
            .id(EMERGENCY_ROUTE_ID)
            .type(RouteType.ENDPOINT)
            .priority(EMERGENCY_PRIORITY)
            .source(FallbackRoute.WILDCARD_SOURCE)
            .target(EmergencyResponseExecutor.EMERGENCY_TARGET)
            .condition(context -> emergencyMode.getAsBoolean())
            .successRate(1.0)
            .metadata(Map.of("type", "emergency", "reason", "system_emergency"))
            .build();
    }
    
    private static FallbackRoute providerRoute(String id, int priority, String source, String target,
                                               double successRate) {
        return FallbackRoute.builder()
            .id(id)
            .type(RouteType.PROVIDER)
            .priority(priority)
            .source(source)
            .target(target)
            .condition(FallbackConditions::isProviderError)
            .successRate(successRate)
            .metadata(Map.of("type", "provider_fallback", "reason", "provider_failure"))
            .build();
    }
}
