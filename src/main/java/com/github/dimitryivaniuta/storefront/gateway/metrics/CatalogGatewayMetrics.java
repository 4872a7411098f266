package com.github.dimitryivaniuta.storefront.gateway.metrics;

import com.github.dimitryivaniuta.storefront.gateway.breaker.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class CatalogGatewayMetrics {

    private final MeterRegistry registry;

    public CatalogGatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Cache ----
    public void cacheHit(String endpoint) {
        Counter.builder("catalog_gateway_cache_hits_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    public void cacheMiss(String endpoint) {
        Counter.builder("catalog_gateway_cache_misses_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    // ---- Rate limiting ----
    public void rateLimitAllowed(String endpoint) {
        Counter.builder("catalog_gateway_ratelimit_allowed_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    public void rateLimitRejected(String endpoint) {
        Counter.builder("catalog_gateway_ratelimit_rejected_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    // ---- Retry ----
    public void retryCall(String operation) {
        Counter.builder("catalog_gateway_retry_calls_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void retryAttempt(String operation) {
        Counter.builder("catalog_gateway_retry_attempts_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void retryExhausted(String operation) {
        Counter.builder("catalog_gateway_retry_exhausted_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    // ---- Circuit breaker ----
    public void breakerTransition(CircuitState from, CircuitState to) {
        Counter.builder("catalog_gateway_breaker_transitions_total")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    public void breakerRejected(String endpoint) {
        Counter.builder("catalog_gateway_breaker_rejected_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordCall(String endpoint, String outcome, long nanos) {
        Timer.builder("catalog_gateway_call_duration_seconds")
                .tag("endpoint", endpoint)
                .tag("outcome", outcome)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    public void recordDuration(String metricName, String operation, long nanos) {
        Timer.builder(metricName)
                .tag("operation", operation)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
