package com.github.dimitryivaniuta.storefront.gateway.ratelimit;

public enum RateLimitMode {
    /** Fail fast once the window budget is used up. */
    REJECT,
    /** Wait for the oldest permit to age out, bounded by max-wait and the caller deadline. */
    QUEUE
}
