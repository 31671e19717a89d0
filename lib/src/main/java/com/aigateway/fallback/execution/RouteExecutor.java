package com.aigateway.fallback.execution;

import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteExecutionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the actual call behind a fallback route, e.g. re-issuing the request
 * to another provider or agent. One executor serves each {@link com.aigateway.fallback.model.RouteType}.
 * 
 * <p>Failure may be signalled by a result with {@code success == false}, by a failed
 * future or by throwing; the orchestrator treats all three alike. Implementations
 * should honour cancellation of the returned future.
 */
@FunctionalInterface
public interface RouteExecutor {
    
    CompletableFuture<RouteExecutionResult> execute(FallbackRoute route, FallbackContext context);
}
