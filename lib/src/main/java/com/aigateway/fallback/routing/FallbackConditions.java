package com.aigateway.fallback.routing;

import com.aigateway.fallback.exception.ProviderCallException;
import com.aigateway.fallback.model.FallbackContext;

import java.util.Set;

/**
 * Failure classifiers used by the built-in route conditions.
 */
public final class FallbackConditions {
    
    private static final Set<String> PROVIDER_ERROR_CODES = Set.of(
        ProviderCallException.PROVIDER_TIMEOUT,
        ProviderCallException.PROVIDER_UNAVAILABLE,
        ProviderCallException.API_LIMIT_EXCEEDED);
    
    private static final Set<String> MODEL_ERROR_CODES = Set.of(
        ProviderCallException.MODEL_UNAVAILABLE,
        ProviderCallException.MODEL_OVERLOADED,
        ProviderCallException.UNSUPPORTED_OPERATION);
    
    public static final String COST_OPTIMIZATION_KEY = "costOptimization";
    
    private FallbackConditions() {
    }
    
    /**
     * Provider timeouts, outages, exhausted API limits and 5xx responses.
     */
    public static boolean isProviderError(FallbackContext context) {
        if (!(context.getError() instanceof ProviderCallException error)) {
            return false;
        }
        return error.getErrorCode().map(PROVIDER_ERROR_CODES::contains).orElse(false)
            || error.isServerError();
    }
    
    /**
     * Unavailable, overloaded or unsupported models, or any failure naming a model.
     */
    public static boolean isModelError(FallbackContext context) {
        if (!(context.getError() instanceof ProviderCallException error)) {
            return false;
        }
        return error.getErrorCode().map(MODEL_ERROR_CODES::contains).orElse(false)
            || error.getModel().isPresent();
    }
    
    public static boolean isCostConstraint(FallbackContext context) {
        if (Boolean.TRUE.equals(context.getMetadata().get(COST_OPTIMIZATION_KEY))) {
            return true;
        }
        return context.getError() instanceof ProviderCallException error
            && error.getErrorCode().map(ProviderCallException.BUDGET_EXCEEDED::equals).orElse(false);
    }
}
