package com.aigateway.fallback.health;

import com.aigateway.fallback.config.FallbackConfiguration;
import com.aigateway.fallback.model.HealthProbeResult;
import com.aigateway.fallback.model.ProviderHealth;
import com.aigateway.fallback.observability.FallbackEvent;
import com.aigateway.fallback.observability.FallbackEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Periodically probes the configured providers and keeps a health record per provider.
 * 
 * <p>Health records are observational only. They are published as
 * {@link FallbackEvent.HealthStatusChanged} events and exposed through
 * {@link #getProviderHealth()}, but never gate which fallback routes are attempted.
 */
public class ProviderHealthMonitor {
    
    private static final Logger logger = LoggerFactory.getLogger(ProviderHealthMonitor.class);
    
    static final double RESPONSE_TIME_WEIGHT = 0.2;
    static final double SUCCESS_RATE_ALPHA = 0.1;
    
    private final FallbackConfiguration configuration;
    private final HealthProbe healthProbe;
    private final FallbackEventPublisher eventPublisher;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Map<String, ProviderHealth> providerHealth = new ConcurrentHashMap<>();
    private volatile boolean running = false;
    private ScheduledFuture<?> healthCheckTask;
    
    public ProviderHealthMonitor(FallbackConfiguration configuration,
                                 HealthProbe healthProbe,
                                 FallbackEventPublisher eventPublisher,
                                 ScheduledExecutorService scheduler,
                                 Clock clock) {
        this.configuration = configuration;
        this.healthProbe = healthProbe;
        this.eventPublisher = eventPublisher;
        this.scheduler = scheduler;
        this.clock = clock;
    }
    
    public synchronized void start() {
        if (running) {
            return;
        }
        
        running = true;
        Duration interval = configuration.getHealthCheckInterval();
        
        healthCheckTask = scheduler.scheduleWithFixedDelay(
            this::performHealthCheck,
            interval.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        
        logger.info("Provider health monitor started for {} with interval: {}",
                   configuration.getMonitoredProviders(), interval);
    }
    
    /**
     * Cancels the periodic check. The scheduler itself belongs to the caller.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        
        running = false;
        
        if (healthCheckTask != null) {
            healthCheckTask.cancel(false);
            healthCheckTask = null;
        }
        
        logger.info("Provider health monitor stopped");
    }
    
    public boolean isRunning() {
        return running;
    }
    
    private void performHealthCheck() {
        try {
            checkAllProviders();
        } catch (Exception e) {
            logger.error("Error during provider health check", e);
        }
    }
    
    /**
     * Probes every monitored provider once, in roster order.
     * 
     * @return the health records after this round
     */
    public synchronized Map<String, ProviderHealth> checkAllProviders() {
        for (String providerId : configuration.getMonitoredProviders()) {
            checkProviderHealth(providerId);
        }
        return getProviderHealth();
    }
    
    private void checkProviderHealth(String providerId) {
        Instant startTime = clock.instant();
        HealthProbeResult result = probe(providerId, startTime);
        Instant now = clock.instant();
        
        ProviderHealth previous = providerHealth.get(providerId);
        ProviderHealth updated = providerHealth.compute(providerId,
            (id, current) -> nextHealth(id, current, result, now));
        
        if (previous != null && previous.isHealthy() != updated.isHealthy()) {
            logger.info("Provider {} health changed: {} -> {}", providerId, previous.isHealthy(), updated.isHealthy());
        }
        if (!updated.isHealthy()) {
            logger.warn("Provider {} is unhealthy ({} consecutive failures): {}",
                       providerId, updated.getConsecutiveFailures(), result.message());
        }
        
        boolean transition = previous == null || previous.isHealthy() != updated.isHealthy();
        if (!configuration.isHealthEventsOnTransitionOnly() || transition) {
            eventPublisher.publish(new FallbackEvent.HealthStatusChanged(
                providerId, updated.isHealthy(), updated.getConsecutiveFailures(), now));
        }
        
        logger.debug("Health check for provider {}: healthy={}, responseTime={}ms",
                    providerId, updated.isHealthy(), result.responseTimeMs());
    }
    
    private HealthProbeResult probe(String providerId, Instant startTime) {
        CompletableFuture<HealthProbeResult> probeFuture = null;
        try {
            probeFuture = healthProbe.probe(providerId).toCompletableFuture();
            HealthProbeResult result = probeFuture.get(
                configuration.getHealthCheckTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return HealthProbeResult.unhealthy(elapsedMillis(startTime), "Health probe returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            probeFuture.cancel(true);
            return HealthProbeResult.unhealthy(elapsedMillis(startTime), "Health check timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return HealthProbeResult.unhealthy(elapsedMillis(startTime), "Health check failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthProbeResult.unhealthy(elapsedMillis(startTime), "Health check interrupted");
        } catch (RuntimeException e) {
            return HealthProbeResult.unhealthy(elapsedMillis(startTime), "Health check failed: " + e.getMessage());
        }
    }
    
    private ProviderHealth nextHealth(String providerId, ProviderHealth current,
                                      HealthProbeResult result, Instant now) {
        double sample = Math.max(0.0, result.responseTimeMs());
        double previousRate = current == null ? 1.0 : current.getSuccessRate();
        double successRate = SUCCESS_RATE_ALPHA * (result.healthy() ? 1.0 : 0.0)
            + (1 - SUCCESS_RATE_ALPHA) * previousRate;
        double averageResponseTime = current == null
            ? sample
            : (1 - RESPONSE_TIME_WEIGHT) * current.getAverageResponseTime() + RESPONSE_TIME_WEIGHT * sample;
        int consecutiveFailures = result.healthy()
            ? 0
            : (current == null ? 0 : current.getConsecutiveFailures()) + 1;
        
        // lastError is sticky; a later healthy probe does not clear it
        String lastError = current == null ? null : current.getLastError().orElse(null);
        if (!result.healthy()) {
            lastError = result.message() != null ? result.message() : "Health check failed for " + providerId;
        }
        
        return ProviderHealth.builder()
            .providerId(providerId)
            .healthy(result.healthy())
            .successRate(successRate)
            .averageResponseTime(averageResponseTime)
            .errorRate(1.0 - successRate)
            .lastHealthCheck(now)
            .consecutiveFailures(consecutiveFailures)
            .lastError(lastError)
            .metadata(Map.of("lastResponseTimeMs", sample))
            .build();
    }
    
    private double elapsedMillis(Instant startTime) {
        return Duration.between(startTime, clock.instant()).toMillis();
    }
    
    public Map<String, ProviderHealth> getProviderHealth() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(providerHealth));
    }
    
    public Optional<ProviderHealth> getProviderHealth(String providerId) {
        return Optional.ofNullable(providerHealth.get(providerId));
    }
}
