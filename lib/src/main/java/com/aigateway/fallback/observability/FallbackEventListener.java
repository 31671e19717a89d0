package com.aigateway.fallback.observability;

/**
 * Callback interface for fallback router events.
 */
@FunctionalInterface
public interface FallbackEventListener {
    /**
     * Called for every event published after the listener subscribed.
     * 
     * @param event the published event
     */
    void onEvent(FallbackEvent event);
}
