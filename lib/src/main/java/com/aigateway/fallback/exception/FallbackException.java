package com.aigateway.fallback.exception;

import com.aigateway.fallback.model.RouteType;

/**
 * Base exception for fallback routing.
 */
public class FallbackException extends RuntimeException {
    
    public FallbackException(String message) {
        super(message);
    }
    
    public FallbackException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Reported in the result when fallback routing is globally switched off.
     */
    public static class FallbackDisabledException extends FallbackException {
        public FallbackDisabledException() {
            super("Fallback routing is disabled");
        }
    }
    
    /**
     * Thrown when a route is registered for a type no executor can serve.
     */
    public static class MissingExecutorException extends FallbackException {
        public MissingExecutorException(String routeId, RouteType type) {
            super(String.format("No route executor registered for type '%s' (route '%s')",
                               type.getId(), routeId));
        }
    }
    
    /**
     * Recorded when an executor succeeded below the configured quality threshold.
     */
    public static class LowQualityResultException extends FallbackException {
        private final double qualityScore;
        private final double threshold;
        
        public LowQualityResultException(String routeId, double qualityScore, double threshold) {
            super(String.format("Route '%s' returned quality %.2f below threshold %.2f",
                               routeId, qualityScore, threshold));
            this.qualityScore = qualityScore;
            this.threshold = threshold;
        }
        
        public double getQualityScore() {
            return qualityScore;
        }
        
        public double getThreshold() {
            return threshold;
        }
    }
}
