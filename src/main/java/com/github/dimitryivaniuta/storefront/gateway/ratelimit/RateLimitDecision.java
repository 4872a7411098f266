package com.github.dimitryivaniuta.storefront.gateway.ratelimit;

import java.time.Duration;

public record RateLimitDecision(boolean permitted, Duration retryAfter) {

    private static final RateLimitDecision PERMITTED = new RateLimitDecision(true, Duration.ZERO);

    public static RateLimitDecision permit() {
        return PERMITTED;
    }

    public static RateLimitDecision reject(Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter);
    }
}
