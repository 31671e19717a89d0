package com.aigateway.fallback;

import com.aigateway.fallback.config.FallbackConfiguration;
import com.aigateway.fallback.execution.RouteExecutor;
import com.aigateway.fallback.execution.Sleeper;
import com.aigateway.fallback.health.HealthProbe;
import com.aigateway.fallback.impl.DefaultFallbackRouter;
import com.aigateway.fallback.model.RouteType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for {@link FallbackRouter} instances.
 * 
 * <pre>{@code
 * FallbackRouter router = FallbackRouterBuilder.create()
 *     .configuration(FallbackConfiguration.builder().fallbackDelay(Duration.ofMillis(200)).build())
 *     .executor(RouteType.PROVIDER, providerExecutor)
 *     .healthProbe(providerId -> pingProvider(providerId))
 *     .build();
 * }</pre>
 */
public class FallbackRouterBuilder {
    
    private FallbackConfiguration configuration = FallbackConfiguration.defaultConfig();
    private final Map<RouteType, RouteExecutor> executors = new EnumMap<>(RouteType.class);
    private HealthProbe healthProbe;
    private MeterRegistry meterRegistry;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper;
    
    public static FallbackRouterBuilder create() {
        return new FallbackRouterBuilder();
    }
    
    public FallbackRouterBuilder configuration(FallbackConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        return this;
    }
    
    public FallbackRouterBuilder executor(RouteType type, RouteExecutor executor) {
        executors.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(executor, "executor"));
        return this;
    }
    
    public FallbackRouterBuilder healthProbe(HealthProbe healthProbe) {
        this.healthProbe = healthProbe;
        return this;
    }
    
    public FallbackRouterBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }
    
    public FallbackRouterBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }
    
    /**
     * Overrides the inter-attempt delay primitive. Defaults to a scheduler-backed sleeper.
     */
    public FallbackRouterBuilder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }
    
    public FallbackRouter build() {
        return new DefaultFallbackRouter(configuration, executors, healthProbe,
                                         meterRegistry != null ? meterRegistry : new SimpleMeterRegistry(),
                                         clock, sleeper);
    }
}
