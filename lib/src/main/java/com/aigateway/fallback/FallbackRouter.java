package com.aigateway.fallback;

import com.aigateway.fallback.model.CircuitBreakerStatus;
import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackMetrics;
import com.aigateway.fallback.model.FallbackResult;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.ProviderHealth;
import com.aigateway.fallback.observability.FallbackEvent;
import com.aigateway.fallback.observability.FallbackEventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Entry point of the AI gateway fallback layer.
 * 
 * <p>After a primary provider, agent or endpoint call fails, the request pipeline hands
 * the failure to {@link #executeFallback(FallbackContext)}. The router tries the
 * applicable alternative routes in priority order, skipping targets whose circuit
 * breaker is open, and reports the outcome as a {@link FallbackResult}.
 * 
 * <p>Instances are thread-safe and must be closed to stop the health monitor and
 * release the scheduler.
 */
public interface FallbackRouter extends AutoCloseable {
    
    /**
     * Registers a route, replacing any route with the same id.
     * 
     * @throws com.aigateway.fallback.exception.FallbackException.MissingExecutorException
     *         if no executor serves the route's type
     */
    void addFallbackRoute(FallbackRoute route);
    
    /**
     * @return true if a route with this id existed and was removed
     */
    boolean removeFallbackRoute(String routeId);
    
    /**
     * Runs the fallback chain for a failed request. The future never completes
     * exceptionally.
     */
    CompletableFuture<FallbackResult> executeFallback(FallbackContext context);
    
    /**
     * Reactive variant of {@link #executeFallback(FallbackContext)}.
     */
    default Mono<FallbackResult> executeFallbackReactive(FallbackContext context) {
        return Mono.fromFuture(() -> executeFallback(context));
    }
    
    void setFallbackEnabled(boolean enabled);
    
    boolean isFallbackEnabled();
    
    /**
     * Switches emergency mode. While active, the built-in emergency route applies to
     * every failure. Publishes an activation or deactivation event on change.
     */
    void setEmergencyMode(boolean enabled);
    
    boolean isEmergencyMode();
    
    FallbackMetrics getMetrics();
    
    void resetMetrics();
    
    Map<String, ProviderHealth> getProviderHealth();
    
    Map<String, CircuitBreakerStatus> getCircuitBreakerStatus();
    
    Map<String, FallbackRoute> getFallbackRoutes();
    
    Disposable subscribe(FallbackEventListener listener);
    
    <T extends FallbackEvent> Disposable subscribe(Class<T> eventType, Consumer<? super T> listener);
    
    Flux<FallbackEvent> events();
    
    @Override
    void close();
}
