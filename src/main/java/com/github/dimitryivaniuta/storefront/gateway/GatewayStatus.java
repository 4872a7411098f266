package com.github.dimitryivaniuta.storefront.gateway;

import com.github.dimitryivaniuta.storefront.gateway.breaker.CircuitState;

public record GatewayStatus(
        int cacheSize,
        int cacheMaxSize,
        long cacheHitCount,
        long cacheMissCount,
        int rateLimitBudget,
        int rateLimitUsed,
        CircuitState breakerState,
        int consecutiveFailures
) {}
