package com.github.dimitryivaniuta.storefront.gateway.error;

/**
 * Normalized failure categories carried by every failed {@code UpstreamResponse}.
 *
 * Only {@link #TRANSIENT_NETWORK} and {@link #UPSTREAM_SERVER} are retried internally.
 */
public enum ErrorKind {
    TRANSIENT_NETWORK(504, true),
    UPSTREAM_SERVER(502, true),
    UPSTREAM_CLIENT(400, false),
    RATE_LIMITED(429, false),
    CIRCUIT_OPEN(503, false),
    CANCELLED(499, false);

    private final int defaultStatus;
    private final boolean retryable;

    ErrorKind(int defaultStatus, boolean retryable) {
        this.defaultStatus = defaultStatus;
        this.retryable = retryable;
    }

    public int defaultStatus() {
        return defaultStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
