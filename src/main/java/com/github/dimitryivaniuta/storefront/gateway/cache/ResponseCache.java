package com.github.dimitryivaniuta.storefront.gateway.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.storefront.gateway.RequestFingerprint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded fingerprint -> payload store with per-entry TTL and strict LRU eviction.
 *
 * Notes:
 * - Entries carry their own TTL, so one cache serves every {@link CacheStrategy}.
 * - Expired entries are removed on lookup (lazy expiry), not by a sweeper.
 * - Eviction looks only at access order. Hit/miss counters never feed into it.
 * - Every operation is O(1) under a single lock; payloads are immutable JSON trees.
 *
 * Caffeine is not used here: its W-TinyLFU policy may reject a new entry instead of
 * evicting the least recently used one.
 */
@Slf4j
public final class ResponseCache {

    private final int maxSize;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    // accessOrder=true: iteration starts at the least recently used entry
    private final LinkedHashMap<RequestFingerprint, CacheEntry> entries;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ResponseCache(int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.entries = new LinkedHashMap<>(Math.min(maxSize, 1024), 0.75f, true);
    }

    public Optional<CacheEntry> lookup(RequestFingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(fingerprint);
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            if (!entry.isValidAt(now)) {
                entries.remove(fingerprint);
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores (or replaces) the payload. A non-positive TTL is a no-op.
     */
    public void store(RequestFingerprint fingerprint, JsonNode payload, Duration ttl) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        CacheEntry entry = new CacheEntry(fingerprint, payload, clock.instant(), ttl);
        lock.lock();
        try {
            if (!entries.containsKey(fingerprint) && entries.size() >= maxSize) {
                evictEldest();
            }
            entries.put(fingerprint, entry);
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(RequestFingerprint fingerprint) {
        lock.lock();
        try {
            return entries.remove(fingerprint) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }

    public long evictionCount() {
        return evictions.get();
    }

    private void evictEldest() {
        Iterator<Map.Entry<RequestFingerprint, CacheEntry>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            RequestFingerprint eldest = it.next().getKey();
            it.remove();
            evictions.incrementAndGet();
            log.debug("Evicted least recently used cache entry fingerprint={}", eldest);
        }
    }
}
