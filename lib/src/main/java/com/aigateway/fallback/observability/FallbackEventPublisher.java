package com.aigateway.fallback.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Publishes fallback, circuit breaker, health and emergency events to any number of
 * subscribers. Events are delivered best-effort: nothing is buffered for absent or
 * slow subscribers and publishers never wait for acknowledgement.
 */
public class FallbackEventPublisher {
    
    private static final Logger logger = LoggerFactory.getLogger(FallbackEventPublisher.class);
    
    private final Sinks.Many<FallbackEvent> eventSink;
    private final ConcurrentMap<String, Class<?>> subscribers;
    private final AtomicLong subscriberSequence;
    
    public FallbackEventPublisher() {
        this.eventSink = Sinks.many().multicast().directBestEffort();
        this.subscribers = new ConcurrentHashMap<>();
        this.subscriberSequence = new AtomicLong();
        
        logger.debug("FallbackEventPublisher initialized");
    }
    
    /**
     * Publishes an event. Callers on different threads are serialized because the
     * underlying sink only accepts one emitter at a time.
     * 
     * @param event the event to publish
     */
    public synchronized void publish(FallbackEvent event) {
        Sinks.EmitResult result = eventSink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.trace("No subscribers for event {}", event.type().getEventName());
        } else if (result.isFailure()) {
            logger.warn("Failed to publish {} event: {}", event.type().getEventName(), result);
        } else {
            logger.debug("Published {} event", event.type().getEventName());
        }
    }
    
    /**
     * Subscribes to all events.
     * 
     * @param listener the callback for events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(FallbackEventListener listener) {
        return subscribe(FallbackEvent.class, listener::onEvent);
    }
    
    /**
     * Subscribes to events of one type, e.g. {@code FallbackEvent.CircuitBreakerOpened.class}.
     * 
     * @param eventType the event class to receive
     * @param listener the callback for matching events
     * @return Disposable to unsubscribe
     */
    public <T extends FallbackEvent> Disposable subscribe(Class<T> eventType, Consumer<? super T> listener) {
        String subscriberId = eventType.getSimpleName() + "-" + subscriberSequence.incrementAndGet();
        subscribers.put(subscriberId, eventType);
        
        logger.info("New event subscriber: {} (total subscribers: {})", subscriberId, subscribers.size());
        
        return eventSink.asFlux()
            .ofType(eventType)
            .doOnCancel(() -> {
                subscribers.remove(subscriberId);
                logger.info("Event subscription cancelled: {} (remaining: {})",
                    subscriberId, subscribers.size());
            })
            .subscribe(
                event -> deliver(subscriberId, listener, event),
                error -> logger.error("Event subscriber {} error", subscriberId, error),
                () -> subscribers.remove(subscriberId)
            );
    }
    
    private <T> void deliver(String subscriberId, Consumer<? super T> listener, T event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            // a throwing consumer would otherwise cancel the subscription
            logger.warn("Event subscriber {} failed to handle event", subscriberId, e);
        }
    }
    
    /**
     * Gets the current number of active subscribers.
     * 
     * @return number of active subscribers
     */
    public int getSubscriberCount() {
        return subscribers.size();
    }
    
    /**
     * Gets the event stream for advanced reactive operations.
     * 
     * @return Flux of published events
     */
    public Flux<FallbackEvent> getEventStream() {
        return eventSink.asFlux();
    }
    
    /**
     * Completes the stream for all subscribers.
     */
    public synchronized void close() {
        logger.info("Closing FallbackEventPublisher with {} active subscribers", subscribers.size());
        eventSink.tryEmitComplete();
        subscribers.clear();
    }
}
