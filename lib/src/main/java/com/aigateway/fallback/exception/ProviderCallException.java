package com.aigateway.fallback.exception;

import java.util.Optional;

/**
 * Failure of a call to an upstream AI provider, agent or model.
 * 
 * <p>Carries the classification details the built-in route conditions look at:
 * a symbolic error code, the HTTP status (0 when unknown) and the model involved.
 */
public class ProviderCallException extends RuntimeException {
    
    public static final String PROVIDER_TIMEOUT = "PROVIDER_TIMEOUT";
    public static final String PROVIDER_UNAVAILABLE = "PROVIDER_UNAVAILABLE";
    public static final String API_LIMIT_EXCEEDED = "API_LIMIT_EXCEEDED";
    public static final String MODEL_UNAVAILABLE = "MODEL_UNAVAILABLE";
    public static final String MODEL_OVERLOADED = "MODEL_OVERLOADED";
    public static final String UNSUPPORTED_OPERATION = "UNSUPPORTED_OPERATION";
    public static final String BUDGET_EXCEEDED = "BUDGET_EXCEEDED";
    
    private final String errorCode;
    private final int statusCode;
    private final String model;
    
    public ProviderCallException(String message, String errorCode, int statusCode, String model) {
        super(message);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.model = model;
    }
    
    public ProviderCallException(String message, String errorCode, int statusCode, String model, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.model = model;
    }
    
    public static ProviderCallException withCode(String errorCode) {
        return new ProviderCallException("Provider call failed: " + errorCode, errorCode, 0, null);
    }
    
    public static ProviderCallException withStatus(int statusCode) {
        return new ProviderCallException("Provider call failed with status " + statusCode, null, statusCode, null);
    }
    
    public Optional<String> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public Optional<String> getModel() {
        return Optional.ofNullable(model);
    }
    
    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }
}
