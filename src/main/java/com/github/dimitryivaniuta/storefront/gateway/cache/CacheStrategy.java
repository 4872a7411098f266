package com.github.dimitryivaniuta.storefront.gateway.cache;

import java.time.Duration;

/**
 * Per-call caching policy. The durations are defaults; the effective TTLs come from
 * {@link CacheTtlPolicy}.
 */
public enum CacheStrategy {
    NO_CACHE(Duration.ZERO),
    SHORT_TERM(Duration.ofSeconds(300)),
    MEDIUM_TERM(Duration.ofSeconds(900)),
    LONG_TERM(Duration.ofSeconds(3600));

    private final Duration defaultTtl;

    CacheStrategy(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public boolean isCacheable() {
        return this != NO_CACHE;
    }
}
