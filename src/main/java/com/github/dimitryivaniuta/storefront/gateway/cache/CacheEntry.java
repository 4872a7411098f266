package com.github.dimitryivaniuta.storefront.gateway.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.storefront.gateway.RequestFingerprint;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(RequestFingerprint fingerprint, JsonNode payload, Instant storedAt, Duration ttl) {

    public Instant expiresAt() {
        return storedAt.plus(ttl);
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt());
    }
}
