package com.aigateway.fallback.routing;

import static org.junit.jupiter.api.Assertions.*;

import com.aigateway.fallback.exception.ProviderCallException;
import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

class FallbackConditionsTest {

    private static FallbackContext failure(Throwable error) {
        return FallbackContext.builder().requestId("req-1").error(error).build();
    }

    @Test
    void testProviderErrors() {
        assertTrue(FallbackConditions.isProviderError(failure(
            ProviderCallException.withCode(ProviderCallException.PROVIDER_TIMEOUT))));
        assertTrue(FallbackConditions.isProviderError(failure(
            ProviderCallException.withCode(ProviderCallException.PROVIDER_UNAVAILABLE))));
        assertTrue(FallbackConditions.isProviderError(failure(
            ProviderCallException.withCode(ProviderCallException.API_LIMIT_EXCEEDED))));
        assertTrue(FallbackConditions.isProviderError(failure(ProviderCallException.withStatus(503))));

        assertFalse(FallbackConditions.isProviderError(failure(ProviderCallException.withStatus(400))));
        assertFalse(FallbackConditions.isProviderError(failure(
            ProviderCallException.withCode(ProviderCallException.MODEL_OVERLOADED))));
        assertFalse(FallbackConditions.isProviderError(failure(new IllegalStateException("other"))));
        assertFalse(FallbackConditions.isProviderError(failure(null)));
    }

    @Test
    void testModelErrors() {
        assertTrue(FallbackConditions.isModelError(failure(
            ProviderCallException.withCode(ProviderCallException.MODEL_UNAVAILABLE))));
        assertTrue(FallbackConditions.isModelError(failure(
            ProviderCallException.withCode(ProviderCallException.UNSUPPORTED_OPERATION))));
        assertTrue(FallbackConditions.isModelError(failure(
            new ProviderCallException("context length exceeded", null, 400, "gpt-4"))));

        assertFalse(FallbackConditions.isModelError(failure(
            ProviderCallException.withCode(ProviderCallException.PROVIDER_TIMEOUT))));
    }

    @Test
    void testCostConstraint() {
        assertTrue(FallbackConditions.isCostConstraint(failure(
            ProviderCallException.withCode(ProviderCallException.BUDGET_EXCEEDED))));
        assertTrue(FallbackConditions.isCostConstraint(FallbackContext.builder()
            .requestId("req-2")
            .metadata(Map.of(FallbackConditions.COST_OPTIMIZATION_KEY, true))
            .build()));

        assertFalse(FallbackConditions.isCostConstraint(FallbackContext.builder()
            .requestId("req-3")
            .metadata(Map.of(FallbackConditions.COST_OPTIMIZATION_KEY, false))
            .build()));
    }

    @Test
    void testDefaultProviderRotation() {
        RouteRegistry registry = new RouteRegistry();
        DefaultRoutes.providerAndAgentRoutes().forEach(registry::add);

        FallbackContext openaiTimeout = FallbackContext.builder()
            .requestId("req-4")
            .originalProvider("openai")
            .error(ProviderCallException.withCode(ProviderCallException.PROVIDER_TIMEOUT))
            .build();

        List<FallbackRoute> routes = registry.findApplicable(openaiTimeout);
        assertEquals(List.of("openai-to-claude"), routes.stream().map(FallbackRoute::getId).collect(Collectors.toList()));
        assertEquals("claude", routes.get(0).getTarget());
    }

    @Test
    void testDefaultAgentDowngradeOnCostConstraint() {
        RouteRegistry registry = new RouteRegistry();
        DefaultRoutes.providerAndAgentRoutes().forEach(registry::add);

        FallbackContext overBudget = FallbackContext.builder()
            .requestId("req-5")
            .originalAgent("gpt-4")
            .metadata(Map.of(FallbackConditions.COST_OPTIMIZATION_KEY, true))
            .build();

        List<FallbackRoute> routes = registry.findApplicable(overBudget);
        assertEquals(1, routes.size());
        assertEquals(RouteType.AGENT, routes.get(0).getType());
        assertEquals("gpt-3.5-turbo", routes.get(0).getTarget());
    }

    @Test
    void testEmergencyRouteFollowsSwitch() {
        AtomicBoolean emergency = new AtomicBoolean(false);
        FallbackRoute route = DefaultRoutes.emergencyRoute(emergency::get);
        FallbackContext context = FallbackContext.builder().requestId("req-6").originalProvider("any").build();

        assertEquals(DefaultRoutes.EMERGENCY_PRIORITY, route.getPriority());
        assertEquals(FallbackRoute.WILDCARD_SOURCE, route.getSource());
        assertFalse(route.getCondition().test(context));

        emergency.set(true);
        assertTrue(route.getCondition().test(context));
    }
}
