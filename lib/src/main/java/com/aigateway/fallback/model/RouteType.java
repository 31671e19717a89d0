package com.aigateway.fallback.model;

/**
 * Kind of alternative a fallback route switches to.
 */
public enum RouteType {
    
    /**
     * Switch to another upstream AI provider.
     */
    PROVIDER("provider"),
    
    /**
     * Switch to another agent configuration.
     */
    AGENT("agent"),
    
    /**
     * Switch to another endpoint, including the built-in emergency endpoint.
     */
    ENDPOINT("endpoint"),
    
    /**
     * Switch to another model variant of the same provider.
     */
    MODEL("model");
    
    private final String id;
    
    RouteType(String id) {
        this.id = id;
    }
    
    public String getId() {
        return id;
    }
}
