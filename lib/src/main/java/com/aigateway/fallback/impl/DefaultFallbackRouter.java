package com.aigateway.fallback.impl;

import com.aigateway.fallback.FallbackRouter;
import com.aigateway.fallback.config.FallbackConfiguration;
import com.aigateway.fallback.config.FallbackSwitches;
import com.aigateway.fallback.exception.FallbackException;
import com.aigateway.fallback.execution.RouteExecutor;
import com.aigateway.fallback.execution.RouteExecutorRegistry;
import com.aigateway.fallback.execution.Sleeper;
import com.aigateway.fallback.health.HealthProbe;
import com.aigateway.fallback.health.ProviderHealthMonitor;
import com.aigateway.fallback.model.CircuitBreakerStatus;
import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackMetrics;
import com.aigateway.fallback.model.FallbackResult;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.ProviderHealth;
import com.aigateway.fallback.model.RouteType;
import com.aigateway.fallback.observability.FallbackEvent;
import com.aigateway.fallback.observability.FallbackEventListener;
import com.aigateway.fallback.observability.FallbackEventPublisher;
import com.aigateway.fallback.observability.MetricsAggregator;
import com.aigateway.fallback.resilience.AttemptTimeLimiter;
import com.aigateway.fallback.resilience.CircuitBreakerManager;
import com.aigateway.fallback.routing.DefaultRoutes;
import com.aigateway.fallback.routing.FallbackOrchestrator;
import com.aigateway.fallback.routing.RouteRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Default implementation of {@link FallbackRouter}.
 * Wires the route registry, circuit breakers, health monitor, metrics and events
 * around a {@link FallbackOrchestrator}.
 */
public class DefaultFallbackRouter implements FallbackRouter {
    
    private static final Logger logger = LoggerFactory.getLogger(DefaultFallbackRouter.class);
    
    private final FallbackConfiguration configuration;
    private final FallbackSwitches switches;
    private final RouteRegistry routeRegistry;
    private final RouteExecutorRegistry executors;
    private final CircuitBreakerManager circuitBreakers;
    private final MetricsAggregator metrics;
    private final FallbackEventPublisher eventPublisher;
    private final ScheduledExecutorService scheduler;
    private final ScheduledExecutorService healthScheduler;
    private final ProviderHealthMonitor healthMonitor;
    private final FallbackOrchestrator orchestrator;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    public DefaultFallbackRouter(FallbackConfiguration configuration,
                                 Map<RouteType, RouteExecutor> routeExecutors,
                                 HealthProbe healthProbe,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 Sleeper sleeper) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.switches = new FallbackSwitches(configuration);
        this.routeRegistry = new RouteRegistry();
        this.executors = new RouteExecutorRegistry(clock);
        this.eventPublisher = new FallbackEventPublisher();
        this.metrics = new MetricsAggregator(meterRegistry);
        AtomicInteger threadCount = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "ai-gateway-fallback-scheduler-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.circuitBreakers = new CircuitBreakerManager(configuration, eventPublisher, metrics, clock);
        
        routeExecutors.forEach(executors::register);
        
        this.orchestrator = new FallbackOrchestrator(
            configuration,
            switches,
            routeRegistry,
            circuitBreakers,
            executors,
            metrics,
            eventPublisher,
            new AttemptTimeLimiter(scheduler),
            sleeper != null ? sleeper : Sleeper.scheduled(scheduler),
            clock
        );
        
        installRoutes();
        
        // Health probes wait on their own thread, apart from request delays and deadlines.
        if (healthProbe != null && configuration.isHealthMonitoringEnabled()) {
            this.healthScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "ai-gateway-fallback-health");
                thread.setDaemon(true);
                return thread;
            });
            this.healthMonitor = new ProviderHealthMonitor(configuration, healthProbe, eventPublisher, healthScheduler, clock);
            healthMonitor.start();
        } else {
            this.healthScheduler = null;
            this.healthMonitor = null;
            logger.info("Provider health monitoring disabled");
        }
        
        logger.info("Fallback router initialized with {} routes (fallbacks enabled={}, emergency mode={})",
                   routeRegistry.size(), switches.isFallbacksEnabled(), switches.isEmergencyMode());
    }
    
    private void installRoutes() {
        if (configuration.isInstallDefaultRoutes()) {
            for (FallbackRoute route : DefaultRoutes.providerAndAgentRoutes()) {
                if (executors.hasExecutor(route.getType())) {
                    routeRegistry.add(route);
                } else {
                    logger.debug("Skipping default route {}: no {} executor registered",
                                route.getId(), route.getType().getId());
                }
            }
        }
        routeRegistry.add(DefaultRoutes.emergencyRoute(switches::isEmergencyMode));
    }
    
    @Override
    public void addFallbackRoute(FallbackRoute route) {
        Objects.requireNonNull(route, "route");
        if (!executors.supports(route)) {
            throw new FallbackException.MissingExecutorException(route.getId(), route.getType());
        }
        routeRegistry.add(route);
    }
    
    @Override
    public boolean removeFallbackRoute(String routeId) {
        return routeRegistry.remove(routeId);
    }
    
    @Override
    public CompletableFuture<FallbackResult> executeFallback(FallbackContext context) {
        Objects.requireNonNull(context, "context");
        if (closed.get()) {
            throw new IllegalStateException("Fallback router is closed");
        }
        return orchestrator.executeFallback(context);
    }
    
    @Override
    public void setFallbackEnabled(boolean enabled) {
        boolean previous = switches.setFallbacksEnabled(enabled);
        if (previous != enabled) {
            logger.info("Fallback routing {}", enabled ? "enabled" : "disabled");
        }
    }
    
    @Override
    public boolean isFallbackEnabled() {
        return switches.isFallbacksEnabled();
    }
    
    @Override
    public void setEmergencyMode(boolean enabled) {
        boolean previous = switches.setEmergencyMode(enabled);
        if (previous == enabled) {
            return;
        }
        
        if (enabled) {
            logger.warn("Emergency mode activated: all failures will be served by the emergency response");
            eventPublisher.publish(new FallbackEvent.EmergencyModeActivated(clock.instant()));
        } else {
            logger.info("Emergency mode deactivated");
            eventPublisher.publish(new FallbackEvent.EmergencyModeDeactivated(clock.instant()));
        }
    }
    
    @Override
    public boolean isEmergencyMode() {
        return switches.isEmergencyMode();
    }
    
    @Override
    public FallbackMetrics getMetrics() {
        return metrics.getMetrics();
    }
    
    @Override
    public void resetMetrics() {
        metrics.resetMetrics();
    }
    
    @Override
    public Map<String, ProviderHealth> getProviderHealth() {
        return healthMonitor != null ? healthMonitor.getProviderHealth() : Map.of();
    }
    
    @Override
    public Map<String, CircuitBreakerStatus> getCircuitBreakerStatus() {
        return circuitBreakers.getStatus();
    }
    
    @Override
    public Map<String, FallbackRoute> getFallbackRoutes() {
        return routeRegistry.asMap();
    }
    
    @Override
    public Disposable subscribe(FallbackEventListener listener) {
        return eventPublisher.subscribe(listener);
    }
    
    @Override
    public <T extends FallbackEvent> Disposable subscribe(Class<T> eventType, Consumer<? super T> listener) {
        return eventPublisher.subscribe(eventType, listener);
    }
    
    @Override
    public Flux<FallbackEvent> events() {
        return eventPublisher.getEventStream();
    }
    
    /**
     * Probes every monitored provider once, outside the periodic schedule.
     * Returns an empty map when no health probe is configured.
     */
    public Map<String, ProviderHealth> checkProviderHealth() {
        return healthMonitor != null ? healthMonitor.checkAllProviders() : Map.of();
    }
    
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Closing fallback router...");
            cleanup();
        }
    }
    
    private void cleanup() {
        try {
            if (healthMonitor != null) {
                healthMonitor.stop();
                healthScheduler.shutdownNow();
            }
            
            scheduler.shutdown();
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            
            logger.info("Fallback router closed successfully");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            eventPublisher.close();
        }
    }
}
