package com.github.dimitryivaniuta.storefront.gateway.error;

import lombok.Getter;

import java.time.Duration;

@Getter
public class RateLimitExceededException extends CatalogAccessException {

    private final Duration retryAfter;

    public RateLimitExceededException(String message, Duration retryAfter) {
        super(ErrorKind.RATE_LIMITED, ErrorKind.RATE_LIMITED.defaultStatus(), message, null);
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public long getRetryAfterSeconds() {
        long s = (retryAfter.toMillis() + 999) / 1000;
        return Math.max(1, s);
    }
}
