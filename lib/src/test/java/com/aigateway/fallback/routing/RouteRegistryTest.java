package com.aigateway.fallback.routing;

import static org.junit.jupiter.api.Assertions.*;

import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

class RouteRegistryTest {

    private RouteRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RouteRegistry();
    }

    private static FallbackRoute route(String id, int priority, String source) {
        return FallbackRoute.builder()
            .id(id)
            .type(RouteType.PROVIDER)
            .priority(priority)
            .source(source)
            .target(id + "-target")
            .build();
    }

    private static List<String> ids(List<FallbackRoute> routes) {
        return routes.stream().map(FallbackRoute::getId).collect(Collectors.toList());
    }

    private static FallbackContext fromProvider(String provider) {
        return FallbackContext.builder()
            .requestId("req-1")
            .originalProvider(provider)
            .build();
    }

    @Test
    void testFindApplicableSortsByPriority() {
        registry.add(route("third", 3, "*"));
        registry.add(route("first", 1, "*"));
        registry.add(route("second", 2, "*"));

        assertEquals(List.of("first", "second", "third"), ids(registry.findApplicable(fromProvider("openai"))));
    }

    @Test
    void testEqualPrioritiesKeepInsertionOrder() {
        registry.add(route("b", 1, "*"));
        registry.add(route("a", 1, "*"));
        registry.add(route("c", 1, "*"));

        assertEquals(List.of("b", "a", "c"), ids(registry.findApplicable(fromProvider("openai"))));
    }

    @Test
    void testSourceMatchesProviderAgentOrEndpoint() {
        registry.add(route("by-provider", 1, "openai"));
        registry.add(route("by-agent", 2, "gpt-4"));
        registry.add(route("by-endpoint", 3, "/v1/chat"));
        registry.add(route("other", 4, "gemini"));

        FallbackContext context = FallbackContext.builder()
            .requestId("req-2")
            .originalProvider("openai")
            .originalAgent("gpt-4")
            .originalEndpoint("/v1/chat")
            .build();

        assertEquals(List.of("by-provider", "by-agent", "by-endpoint"), ids(registry.findApplicable(context)));
    }

    @Test
    void testDisabledRoutesAndFalseConditionsAreFiltered() {
        registry.add(route("enabled", 1, "*"));
        registry.add(route("disabled", 2, "*").toBuilder().enabled(false).build());
        registry.add(route("never", 3, "*").toBuilder().condition(ctx -> false).build());

        assertEquals(List.of("enabled"), ids(registry.findApplicable(fromProvider("openai"))));
    }

    @Test
    void testThrowingConditionCountsAsNotApplicable() {
        registry.add(route("broken", 1, "*").toBuilder()
            .condition(ctx -> {
                throw new IllegalStateException("boom");
            })
            .build());
        registry.add(route("healthy", 2, "*"));

        assertEquals(List.of("healthy"), ids(registry.findApplicable(fromProvider("openai"))));
    }

    @Test
    void testAddReplacesRouteWithSameId() {
        registry.add(route("route", 5, "*"));
        registry.add(route("route", 1, "*").toBuilder().target("replacement").build());

        assertEquals(1, registry.size());
        assertEquals("replacement", registry.get("route").orElseThrow().getTarget());
    }

    @Test
    void testRemove() {
        registry.add(route("route", 1, "*"));

        assertTrue(registry.remove("route"));
        assertFalse(registry.remove("route"));
        assertTrue(registry.get("route").isEmpty());
        assertTrue(registry.findApplicable(fromProvider("openai")).isEmpty());
    }

    @Test
    void testAllReturnsDetachedCopy() {
        registry.add(route("route", 1, "*"));

        List<FallbackRoute> snapshot = registry.all();
        registry.add(route("another", 2, "*"));

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.all().size());
        assertThrows(UnsupportedOperationException.class, () -> registry.asMap().remove("route"));
    }
}
