package com.github.dimitryivaniuta.storefront.gateway.retry;

import com.github.dimitryivaniuta.storefront.gateway.CallDeadline;
import com.github.dimitryivaniuta.storefront.gateway.Sleeper;
import com.github.dimitryivaniuta.storefront.gateway.error.CallCancelledException;
import com.github.dimitryivaniuta.storefront.gateway.error.CatalogAccessException;
import com.github.dimitryivaniuta.storefront.gateway.metrics.CatalogGatewayMetrics;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs one logical upstream call with bounded exponential backoff.
 *
 * Only retryable {@link CatalogAccessException}s are retried; anything else is rethrown
 * on the spot. Backoff waits go through the {@link Sleeper} so they stay interruptible,
 * and a wait that would cross the caller deadline ends the call as cancelled.
 */
@Slf4j
public final class RetryOrchestrator {

    private final int maxRetries;
    private final IntervalFunction backoff;
    private final Clock clock;
    private final Sleeper sleeper;
    private final CatalogGatewayMetrics metrics;

    public RetryOrchestrator(int maxRetries,
                             Duration baseDelay,
                             Clock clock,
                             Sleeper sleeper,
                             CatalogGatewayMetrics metrics) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (baseDelay == null || baseDelay.toMillis() < 1) {
            throw new IllegalArgumentException("baseDelay must be at least 1ms, got " + baseDelay);
        }
        this.maxRetries = maxRetries;
        this.backoff = IntervalFunction.ofExponentialBackoff(baseDelay, 2.0);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public <T> T execute(String operation, Supplier<T> call, CallDeadline deadline) {
        CallDeadline dl = deadline == null ? CallDeadline.none() : deadline;
        metrics.retryCall(operation);
        long start = System.nanoTime();
        int attempt = 0;

        try {
            while (true) {
                attempt++;
                if (Thread.currentThread().isInterrupted()) {
                    throw new CallCancelledException("Interrupted before attempt " + attempt + " of " + operation);
                }
                if (dl.isExpired(clock)) {
                    throw new CallCancelledException("Deadline passed before attempt " + attempt + " of " + operation);
                }
                metrics.retryAttempt(operation);
                try {
                    return call.get();
                } catch (CatalogAccessException ex) {
                    if (!ex.isRetryable()) {
                        throw ex;
                    }
                    if (attempt > maxRetries) {
                        metrics.retryExhausted(operation);
                        log.warn("Retries exhausted for {} after {} attempts: {}", operation, attempt, ex.getMessage());
                        throw ex;
                    }
                    Duration delay = backoffBefore(attempt);
                    if (!dl.allows(clock, delay)) {
                        throw new CallCancelledException("Backoff of " + delay + " for " + operation
                                + " would cross the call deadline", ex);
                    }
                    log.debug("Attempt {} of {} failed ({}), retrying in {}", attempt, operation, ex.getErrorKind(), delay);
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new CallCancelledException("Interrupted during backoff of " + operation, ie);
                    }
                }
            }
        } finally {
            metrics.recordDuration("catalog_gateway_retry_duration_seconds", operation, System.nanoTime() - start);
        }
    }

    /** Delay slept after failed attempt {@code n} (1-based): baseDelay * 2^(n-1). */
    public Duration backoffBefore(int failedAttempt) {
        return Duration.ofMillis(backoff.apply(failedAttempt));
    }

    public int maxRetries() {
        return maxRetries;
    }
}
