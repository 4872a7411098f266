package com.github.dimitryivaniuta.storefront.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.storefront.gateway.error.CatalogAccessException;
import com.github.dimitryivaniuta.storefront.gateway.error.ErrorKind;
import com.github.dimitryivaniuta.storefront.gateway.error.RateLimitExceededException;

/**
 * The single envelope returned by the Gateway. {@code errorKind} and {@code errorMessage}
 * are null on success; {@code data} is null on failure. {@code retryAfterMs} is only set for
 * {@link ErrorKind#RATE_LIMITED}.
 */
public record UpstreamResponse(
        JsonNode data,
        boolean success,
        ErrorKind errorKind,
        int statusCode,
        boolean cached,
        long elapsedMs,
        String errorMessage,
        long retryAfterMs
) {

    public static UpstreamResponse ok(JsonNode data, long elapsedMs) {
        return new UpstreamResponse(data, true, null, 200, false, elapsedMs, null, 0L);
    }

    public static UpstreamResponse fromCache(JsonNode data, long elapsedMs) {
        return new UpstreamResponse(data, true, null, 200, true, elapsedMs, null, 0L);
    }

    public static UpstreamResponse failure(CatalogAccessException ex, long elapsedMs) {
        long retryAfter = ex instanceof RateLimitExceededException rle ? rle.getRetryAfter().toMillis() : 0L;
        return new UpstreamResponse(null, false, ex.getErrorKind(), ex.getStatusCode(), false, elapsedMs,
                ex.getMessage(), retryAfter);
    }

    public static UpstreamResponse failure(ErrorKind kind, String message) {
        return new UpstreamResponse(null, false, kind, kind.defaultStatus(), false, 0L, message, 0L);
    }

    public boolean isFailure() {
        return !success;
    }

    /** Whole seconds for a {@code Retry-After} header, at least 1. */
    public long retryAfterSeconds() {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }
}
