package com.github.dimitryivaniuta.storefront.gateway.cache;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable strategy to TTL mapping. NO_CACHE is pinned to zero whatever the input says.
 */
public final class CacheTtlPolicy {

    private final Map<CacheStrategy, Duration> ttls;

    private CacheTtlPolicy(Map<CacheStrategy, Duration> ttls) {
        this.ttls = Collections.unmodifiableMap(ttls);
    }

    public static CacheTtlPolicy defaults() {
        return of(CacheStrategy.SHORT_TERM.defaultTtl(),
                CacheStrategy.MEDIUM_TERM.defaultTtl(),
                CacheStrategy.LONG_TERM.defaultTtl());
    }

    public static CacheTtlPolicy of(Duration shortTerm, Duration mediumTerm, Duration longTerm) {
        EnumMap<CacheStrategy, Duration> m = new EnumMap<>(CacheStrategy.class);
        m.put(CacheStrategy.NO_CACHE, Duration.ZERO);
        m.put(CacheStrategy.SHORT_TERM, positive(shortTerm, CacheStrategy.SHORT_TERM));
        m.put(CacheStrategy.MEDIUM_TERM, positive(mediumTerm, CacheStrategy.MEDIUM_TERM));
        m.put(CacheStrategy.LONG_TERM, positive(longTerm, CacheStrategy.LONG_TERM));
        return new CacheTtlPolicy(m);
    }

    public Duration ttlFor(CacheStrategy strategy) {
        return ttls.get(Objects.requireNonNull(strategy, "strategy must not be null"));
    }

    public Map<CacheStrategy, Duration> asMap() {
        return ttls;
    }

    private static Duration positive(Duration d, CacheStrategy strategy) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException("TTL for " + strategy + " must be positive, got " + d);
        }
        return d;
    }
}
