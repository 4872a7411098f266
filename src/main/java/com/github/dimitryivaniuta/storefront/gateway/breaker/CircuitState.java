package com.github.dimitryivaniuta.storefront.gateway.breaker;

/**
 * CLOSED lets calls through, OPEN short-circuits them, HALF_OPEN has one trial call in flight.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
