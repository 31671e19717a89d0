package com.aigateway.fallback.execution;

import com.aigateway.fallback.exception.FallbackException;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps each {@link RouteType} to the executor serving it.
 * 
 * <p>The endpoint slot always holds an {@link EmergencyResponseExecutor}, so the
 * emergency route can be served even when no endpoint executor was registered.
 */
public class RouteExecutorRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(RouteExecutorRegistry.class);
    
    private final Map<RouteType, RouteExecutor> executors;
    private final Clock clock;
    
    public RouteExecutorRegistry(Clock clock) {
        this.clock = clock;
        this.executors = new EnumMap<>(RouteType.class);
        executors.put(RouteType.ENDPOINT, new EmergencyResponseExecutor(null, clock));
    }
    
    public synchronized void register(RouteType type, RouteExecutor executor) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(executor, "executor");
        
        RouteExecutor effective = type == RouteType.ENDPOINT && !(executor instanceof EmergencyResponseExecutor)
            ? new EmergencyResponseExecutor(executor, clock)
            : executor;
        executors.put(type, effective);
        logger.info("Registered route executor for type {}", type.getId());
    }
    
    /**
     * Whether a route of this shape can be dispatched.
     */
    public synchronized boolean supports(FallbackRoute route) {
        RouteExecutor executor = executors.get(route.getType());
        if (executor instanceof EmergencyResponseExecutor emergency) {
            return EmergencyResponseExecutor.isEmergencyTarget(route) || emergency.hasDelegate();
        }
        return executor != null;
    }
    
    public synchronized boolean hasExecutor(RouteType type) {
        RouteExecutor executor = executors.get(type);
        if (executor instanceof EmergencyResponseExecutor emergency) {
            return emergency.hasDelegate();
        }
        return executor != null;
    }
    
    /**
     * Returns the executor for the route's type.
     * 
     * @throws FallbackException.MissingExecutorException if none can serve the route
     */
    public synchronized RouteExecutor executorFor(FallbackRoute route) {
        if (!supports(route)) {
            throw new FallbackException.MissingExecutorException(route.getId(), route.getType());
        }
        return executors.get(route.getType());
    }
}
