package com.aigateway.fallback.routing;

import com.aigateway.fallback.config.FallbackConfiguration;
import com.aigateway.fallback.config.FallbackSwitches;
import com.aigateway.fallback.exception.FallbackException;
import com.aigateway.fallback.execution.EmergencyResponseExecutor;
import com.aigateway.fallback.execution.RouteExecutor;
import com.aigateway.fallback.execution.RouteExecutorRegistry;
import com.aigateway.fallback.execution.Sleeper;
import com.aigateway.fallback.model.FallbackContext;
import com.aigateway.fallback.model.FallbackResult;
import com.aigateway.fallback.model.FallbackRoute;
import com.aigateway.fallback.model.RouteExecutionResult;
import com.aigateway.fallback.model.RouteType;
import com.aigateway.fallback.observability.FallbackEvent;
import com.aigateway.fallback.observability.FallbackEventPublisher;
import com.aigateway.fallback.observability.MetricsAggregator;
import com.aigateway.fallback.resilience.AttemptTimeLimiter;
import com.aigateway.fallback.resilience.CircuitBreakerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Drives a failed request through its applicable fallback routes.
 * 
 * <p>Routes are tried strictly one after another in priority order. Targets whose
 * circuit breaker is open are skipped without consuming an attempt. Each attempt is
 * preceded by the configured delay and bounded by the attempt deadline. The first
 * successful route ends the execution; otherwise the result carries the last error and
 * every route that was tried.
 * 
 * <p>The orchestrator keeps no state of its own between executions. Route statistics,
 * breakers and counters live in the components it coordinates.
 */
public class FallbackOrchestrator {
    
    private static final Logger logger = LoggerFactory.getLogger(FallbackOrchestrator.class);
    
    private final FallbackConfiguration configuration;
    private final FallbackSwitches switches;
    private final RouteRegistry routeRegistry;
    private final CircuitBreakerManager circuitBreakers;
    private final RouteExecutorRegistry executors;
    private final MetricsAggregator metrics;
    private final FallbackEventPublisher eventPublisher;
    private final AttemptTimeLimiter timeLimiter;
    private final Sleeper sleeper;
    private final Clock clock;
    
    public FallbackOrchestrator(FallbackConfiguration configuration,
                                FallbackSwitches switches,
                                RouteRegistry routeRegistry,
                                CircuitBreakerManager circuitBreakers,
                                RouteExecutorRegistry executors,
                                MetricsAggregator metrics,
                                FallbackEventPublisher eventPublisher,
                                AttemptTimeLimiter timeLimiter,
                                Sleeper sleeper,
                                Clock clock) {
        this.configuration = configuration;
        this.switches = switches;
        this.routeRegistry = routeRegistry;
        this.circuitBreakers = circuitBreakers;
        this.executors = executors;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.timeLimiter = timeLimiter;
        this.sleeper = sleeper;
        this.clock = clock;
    }
    
    /**
     * Executes fallback routing for a failed request.
     * 
     * <p>The returned future always completes normally; failures are reported through
     * {@link FallbackResult#isSuccess()} and {@link FallbackResult#getError()}.
     * 
     * @param context the failure context, its attempt counter is advanced in place
     * @return the outcome of the fallback chain
     */
    public CompletableFuture<FallbackResult> executeFallback(FallbackContext context) {
        Instant startTime = clock.instant();
        metrics.recordFallbackStarted();
        
        if (!switches.isFallbacksEnabled()) {
            logger.debug("Fallback routing disabled, rejecting request {}", context.getRequestId());
            return CompletableFuture.completedFuture(FallbackResult.builder()
                .success(false)
                .error(new FallbackException.FallbackDisabledException())
                .fallbacksAttempted(List.of())
                .totalDuration(elapsedSince(startTime))
                .metadata(Map.of("fallbackDisabled", true))
                .build());
        }
        
        logger.info("Executing fallback routing for request {} (provider={}, agent={}, endpoint={}, error={})",
                   context.getRequestId(),
                   context.getOriginalProvider().orElse(null),
                   context.getOriginalAgent().orElse(null),
                   context.getOriginalEndpoint().orElse(null),
                   context.getError() == null ? null : context.getError().getMessage());
        
        FallbackRun run = new FallbackRun(context, routeRegistry.findApplicable(context),
                                          attemptLimitFor(context), startTime);
        
        return attemptFrom(run, 0)
            .exceptionally(error -> {
                logger.error("Unexpected error during fallback routing for request {}",
                            context.getRequestId(), error);
                run.lastError = unwrap(error);
                return finishWithFailure(run);
            });
    }
    
    private CompletableFuture<FallbackResult> attemptFrom(FallbackRun run, int index) {
        FallbackContext context = run.context;
        
        for (int i = index; i < run.routes.size(); i++) {
            if (context.getAttempt() >= run.attemptLimit) {
                logger.debug("Attempt budget of {} exhausted for request {}",
                            run.attemptLimit, context.getRequestId());
                break;
            }
            
            FallbackRoute route = run.routes.get(i);
            if (circuitBreakers.isOpen(route.getTarget())) {
                logger.warn("Circuit breaker open for target {}, skipping route {}",
                           route.getTarget(), route.getId());
                continue;
            }
            
            run.attempted.add(route.getId());
            int attempt = context.incrementAttempt();
            logger.info("Attempting fallback route {} -> {} (attempt {}) for request {}",
                       route.getId(), route.getTarget(), attempt, context.getRequestId());
            
            int next = i + 1;
            return attempt(route, context).thenCompose(outcome -> {
                if (outcome.success()) {
                    return CompletableFuture.completedFuture(finishWithSuccess(run, route, outcome));
                }
                recordRouteFailure(run, route, outcome.error());
                return attemptFrom(run, next);
            });
        }
        
        return CompletableFuture.completedFuture(finishWithFailure(run));
    }
    
    /**
     * Delay, then call the executor under the attempt deadline. Never completes
     * exceptionally: every failure is folded into a failed {@link RouteExecutionResult}.
     */
    private CompletableFuture<RouteExecutionResult> attempt(FallbackRoute route, FallbackContext context) {
        Duration delay = configuration.getFallbackDelay();
        CompletableFuture<Void> pause = delay.isZero() || delay.isNegative()
            ? CompletableFuture.completedFuture(null)
            : sleeper.sleep(delay);
        
        return pause
            .thenCompose(ignored -> timeLimiter.execute(route.getTarget(), deadlineFor(context),
                                                        () -> invokeExecutor(route, context)))
            .handle((result, error) -> {
                if (error != null) {
                    return RouteExecutionResult.failure(unwrap(error));
                }
                if (result == null) {
                    return RouteExecutionResult.failure(
                        new FallbackException("Executor returned no result for route " + route.getId()));
                }
                if (!result.success()) {
                    return result.error() != null
                        ? result
                        : RouteExecutionResult.failure(
                            new FallbackException("Route " + route.getId() + " reported failure"));
                }
                return applyQualityThreshold(route, result);
            });
    }
    
    private CompletableFuture<RouteExecutionResult> invokeExecutor(FallbackRoute route, FallbackContext context) {
        try {
            RouteExecutor executor = executors.executorFor(route);
            CompletableFuture<RouteExecutionResult> future = executor.execute(route, context);
            if (future == null) {
                return CompletableFuture.failedFuture(
                    new FallbackException("Executor returned no future for route " + route.getId()));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
    
    private RouteExecutionResult applyQualityThreshold(FallbackRoute route, RouteExecutionResult result) {
        if (!configuration.isEnforceQualityThreshold()
            || result.qualityScore() == null
            || isEmergencyRoute(route)) {
            return result;
        }
        double threshold = configuration.getQualityThreshold();
        if (result.qualityScore() < threshold) {
            return RouteExecutionResult.failure(
                new FallbackException.LowQualityResultException(route.getId(), result.qualityScore(), threshold));
        }
        return result;
    }
    
    private void recordRouteFailure(FallbackRun run, FallbackRoute route, Throwable error) {
        double successRate = route.recordOutcome(false);
        metrics.recordRouteAttempt(route.getId(), false);
        circuitBreakers.recordFailure(route.getTarget(), route.getType());
        run.lastError = error;
        
        logger.warn("Fallback route {} failed for request {} (successRate={}): {}",
                   route.getId(), run.context.getRequestId(), String.format("%.3f", successRate),
                   error == null ? null : error.getMessage());
    }
    
    private FallbackResult finishWithSuccess(FallbackRun run, FallbackRoute route, RouteExecutionResult outcome) {
        Instant now = clock.instant();
        route.recordOutcome(true);
        route.markUsed(now);
        metrics.recordRouteAttempt(route.getId(), true);
        circuitBreakers.recordSuccess(route.getTarget());
        
        Duration duration = Duration.between(run.startTime, now);
        if (isEmergencyRoute(route)) {
            metrics.recordEmergencyActivation();
        }
        metrics.recordFallbackSuccess(route.getType(), duration);
        
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("routeId", route.getId());
        metadata.put("routeType", route.getType().getId());
        metadata.put("target", route.getTarget());
        metadata.put("attemptCount", run.context.getAttempt());
        
        FallbackRoute routeUsed = route.snapshot();
        FallbackResult result = FallbackResult.builder()
            .success(true)
            .data(outcome.data())
            .routeUsed(routeUsed)
            .fallbacksAttempted(run.attempted)
            .totalDuration(duration)
            .qualityScore(outcome.qualityScore())
            .metadata(metadata)
            .build();
        
        eventPublisher.publish(new FallbackEvent.FallbackSuccess(run.context, result, routeUsed, now));
        
        logger.info("Fallback successful for request {} via route {} -> {} in {}ms",
                   run.context.getRequestId(), route.getId(), route.getTarget(), duration.toMillis());
        return result;
    }
    
    private FallbackResult finishWithFailure(FallbackRun run) {
        Instant now = clock.instant();
        Duration duration = Duration.between(run.startTime, now);
        metrics.recordFallbackFailure(duration);
        
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("allFallbacksFailed", true);
        metadata.put("totalAttempts", run.context.getAttempt());
        metadata.put("routesEvaluated", run.routes.size());
        
        FallbackResult result = FallbackResult.builder()
            .success(false)
            .error(run.lastError)
            .fallbacksAttempted(run.attempted)
            .totalDuration(duration)
            .metadata(metadata)
            .build();
        
        eventPublisher.publish(new FallbackEvent.FallbackFailed(run.context, result, run.attempted, now));
        
        if (run.routes.isEmpty()) {
            logger.warn("No applicable fallback route for request {}", run.context.getRequestId());
        } else {
            logger.error("All fallback routes failed for request {} (attempted={}, duration={}ms)",
                        run.context.getRequestId(), run.attempted, duration.toMillis());
        }
        return result;
    }
    
    private int attemptLimitFor(FallbackContext context) {
        int configured = configuration.getMaxFallbackAttempts();
        return context.getMaxAttempts() > 0 ? Math.min(context.getMaxAttempts(), configured) : configured;
    }
    
    private Duration deadlineFor(FallbackContext context) {
        return context.getTimeout().orElse(configuration.getAttemptTimeout());
    }
    
    private static boolean isEmergencyRoute(FallbackRoute route) {
        return route.getType() == RouteType.ENDPOINT && EmergencyResponseExecutor.isEmergencyTarget(route);
    }
    
    private Duration elapsedSince(Instant startTime) {
        return Duration.between(startTime, clock.instant());
    }
    
    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
    
    /**
     * Transient state of one execution. Stages run one at a time, each completing
     * before the next starts.
     */
    private static final class FallbackRun {
        private final FallbackContext context;
        private final List<FallbackRoute> routes;
        private final int attemptLimit;
        private final Instant startTime;
        private final List<String> attempted = new ArrayList<>();
        private volatile Throwable lastError;
        
        private FallbackRun(FallbackContext context, List<FallbackRoute> routes, int attemptLimit, Instant startTime) {
            this.context = context;
            this.routes = routes;
            this.attemptLimit = attemptLimit;
            this.startTime = startTime;
            this.lastError = context.getError();
        }
    }
}
