package com.aigateway.fallback.execution;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.aigateway.fallback.exception.FallbackException;
import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteExecutionResult;
import com.aigateway.fallback.model.RouteType;
import com.aigateway.fallback.routing.DefaultRoutes;
import com.aigateway.fallback.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

@ExtendWith(MockitoExtension.class)
class RouteExecutorRegistryTest {

    @Mock
    private RouteExecutor endpointExecutor;

    @Mock
    private RouteExecutor providerExecutor;

    private MutableClock clock;
    private RouteExecutorRegistry registry;
    private final FallbackContext context = FallbackContext.builder().requestId("req-7").build();

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochPlusOneDay();
        registry = new RouteExecutorRegistry(clock);
    }

    private static FallbackRoute route(RouteType type, String target) {
        return FallbackRoute.builder()
            .id(type.getId() + "-" + target)
            .type(type)
            .target(target)
            .build();
    }

    @Test
    void testEmergencyRouteIsAlwaysSupported() {
        FallbackRoute emergency = DefaultRoutes.emergencyRoute(() -> true);

        assertTrue(registry.supports(emergency));
        assertFalse(registry.hasExecutor(RouteType.ENDPOINT));
        assertFalse(registry.supports(route(RouteType.ENDPOINT, "/v2/chat")));
    }

    @Test
    void testUnregisteredTypeIsRejected() {
        FallbackRoute route = route(RouteType.MODEL, "llama-3");

        assertFalse(registry.supports(route));
        FallbackException.MissingExecutorException error =
            assertThrows(FallbackException.MissingExecutorException.class, () -> registry.executorFor(route));
        assertTrue(error.getMessage().contains("model-llama-3"));
    }

    @Test
    void testRegisteredExecutorIsReturned() {
        registry.register(RouteType.PROVIDER, providerExecutor);

        assertTrue(registry.hasExecutor(RouteType.PROVIDER));
        assertSame(providerExecutor, registry.executorFor(route(RouteType.PROVIDER, "claude")));
    }

    @Test
    void testEmergencyResponsePayload() throws Exception {
        RouteExecutor executor = registry.executorFor(DefaultRoutes.emergencyRoute(() -> true));

        RouteExecutionResult result = executor.execute(DefaultRoutes.emergencyRoute(() -> true), context).get();

        assertTrue(result.success());
        assertEquals(EmergencyResponseExecutor.EMERGENCY_QUALITY_SCORE, result.qualityScore());
        Map<String, Object> data = result.data();
        assertEquals("emergency_mode", data.get("status"));
        assertEquals(true, data.get("emergency"));
        assertEquals(clock.instant().toString(), data.get("timestamp"));
        assertNotNull(data.get("message"));
        assertNotNull(data.get("response"));
    }

    @Test
    void testEndpointExecutorIsDelegatedToForOtherTargets() throws Exception {
        FallbackRoute endpoint = route(RouteType.ENDPOINT, "/v2/chat");
        RouteExecutionResult delegated = RouteExecutionResult.success(Map.of("text", "ok"), 0.8);
        when(endpointExecutor.execute(endpoint, context)).thenReturn(CompletableFuture.completedFuture(delegated));

        registry.register(RouteType.ENDPOINT, endpointExecutor);

        assertTrue(registry.hasExecutor(RouteType.ENDPOINT));
        RouteExecutor executor = registry.executorFor(endpoint);
        assertSame(delegated, executor.execute(endpoint, context).get());

        RouteExecutionResult emergency = executor.execute(DefaultRoutes.emergencyRoute(() -> true), context).get();
        assertEquals(true, emergency.data().get("emergency"));
        verify(endpointExecutor, never()).execute(argThat(EmergencyResponseExecutor::isEmergencyTarget), any());
    }

    @Test
    void testEmergencyExecutorWithoutDelegateFailsOtherTargets() {
        EmergencyResponseExecutor executor = new EmergencyResponseExecutor(null, clock);

        CompletableFuture<RouteExecutionResult> future = executor.execute(route(RouteType.ENDPOINT, "/v2/chat"), context);

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }
}
