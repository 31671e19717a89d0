package com.aigateway.fallback.routing;

import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Holds fallback routes and resolves which of them apply to a failure.
 * 
 * <p>Routes keep their registration order; overwriting an id keeps the original
 * position. Candidates are sorted by priority with a stable sort, so routes of equal
 * priority are tried in registration order.
 */
public class RouteRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(RouteRegistry.class);
    
    private final Map<String, FallbackRoute> routes = new LinkedHashMap<>();
    
    /**
     * Inserts the route, replacing any route with the same id.
     */
    public void add(FallbackRoute route) {
        FallbackRoute previous;
        synchronized (routes) {
            previous = routes.put(route.getId(), route);
        }
        
        logger.info("{} fallback route: {} (type={}, source={}, target={}, priority={})",
                   previous == null ? "Added" : "Replaced", route.getId(), route.getType().getId(),
                   route.getSource(), route.getTarget(), route.getPriority());
    }
    
    /**
     * @return true if a route with this id existed and was removed
     */
    public boolean remove(String routeId) {
        boolean removed;
        synchronized (routes) {
            removed = routes.remove(routeId) != null;
        }
        if (removed) {
            logger.info("Removed fallback route: {}", routeId);
        }
        return removed;
    }
    
    public Optional<FallbackRoute> get(String routeId) {
        synchronized (routes) {
            return Optional.ofNullable(routes.get(routeId));
        }
    }
    
    /**
     * Enabled routes whose source matches the context and whose condition holds,
     * ordered by ascending priority.
     */
    public List<FallbackRoute> findApplicable(FallbackContext context) {
        List<FallbackRoute> candidates = all();
        
        List<FallbackRoute> applicable = candidates.stream()
            .filter(FallbackRoute::isEnabled)
            .filter(route -> route.matchesSource(context))
            .filter(route -> conditionHolds(route, context))
            .sorted(Comparator.comparingInt(FallbackRoute::getPriority))
            .collect(Collectors.toList());
        
        if (logger.isDebugEnabled()) {
            logger.debug("Found {} applicable fallback routes for request {}: {}",
                        applicable.size(), context.getRequestId(),
                        applicable.stream()
                            .map(route -> route.getId() + "(p" + route.getPriority() + ")")
                            .collect(Collectors.joining(", ")));
        }
        
        return applicable;
    }
    
    private boolean conditionHolds(FallbackRoute route, FallbackContext context) {
        try {
            return route.getCondition().test(context);
        } catch (RuntimeException e) {
            logger.warn("Condition of route {} failed for request {}, treating route as not applicable",
                       route.getId(), context.getRequestId(), e);
            return false;
        }
    }
    
    /**
     * Snapshot of all routes in registration order.
     */
    public List<FallbackRoute> all() {
        synchronized (routes) {
            return new ArrayList<>(routes.values());
        }
    }
    
    /**
     * Snapshot of all routes keyed by id, in registration order.
     */
    public Map<String, FallbackRoute> asMap() {
        synchronized (routes) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        }
    }
    
    public int size() {
        synchronized (routes) {
            return routes.size();
        }
    }
}
