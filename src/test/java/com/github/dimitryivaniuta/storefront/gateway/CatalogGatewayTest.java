package com.github.dimitryivaniuta.storefront.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.dimitryivaniuta.storefront.gateway.breaker.CircuitBreaker;
import com.github.dimitryivaniuta.storefront.gateway.breaker.CircuitState;
import com.github.dimitryivaniuta.storefront.gateway.cache.CacheStrategy;
import com.github.dimitryivaniuta.storefront.gateway.cache.CacheTtlPolicy;
import com.github.dimitryivaniuta.storefront.gateway.cache.ResponseCache;
import com.github.dimitryivaniuta.storefront.gateway.error.ErrorKind;
import com.github.dimitryivaniuta.storefront.gateway.error.TransientNetworkException;
import com.github.dimitryivaniuta.storefront.gateway.error.UpstreamClientException;
import com.github.dimitryivaniuta.storefront.gateway.metrics.CatalogGatewayMetrics;
import com.github.dimitryivaniuta.storefront.gateway.ratelimit.RateLimitMode;
import com.github.dimitryivaniuta.storefront.gateway.ratelimit.SlidingWindowRateLimiter;
import com.github.dimitryivaniuta.storefront.gateway.retry.RetryOrchestrator;
import com.github.dimitryivaniuta.storefront.gateway.transport.CatalogTransport;
import com.github.dimitryivaniuta.storefront.support.MutableClock;
import com.github.dimitryivaniuta.storefront.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogGatewayTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CatalogGatewayMetrics metrics = new CatalogGatewayMetrics(registry);

    /** Counts fetches and answers with whatever the test plugs in. */
    static final class ScriptedTransport implements CatalogTransport {
        final AtomicInteger calls = new AtomicInteger();
        volatile Function<Integer, JsonNode> behaviour = n -> JsonNodeFactory.instance.arrayNode();

        @Override
        public JsonNode fetch(CatalogEndpoint endpoint, Map<String, String> params) {
            return behaviour.apply(calls.incrementAndGet());
        }
    }

    private final ScriptedTransport transport = new ScriptedTransport();
    private final List<CatalogGateway> built = new ArrayList<>();

    @AfterEach
    void tearDown() {
        Thread.interrupted();
        built.forEach(CatalogGateway::shutdown);
    }

    private CatalogGateway gateway(int budget, int threshold, int maxRetries) {
        CatalogGateway gw = new CatalogGateway(
                new ResponseCache(50, clock),
                CacheTtlPolicy.defaults(),
                new SlidingWindowRateLimiter(budget, Duration.ofSeconds(60), RateLimitMode.REJECT, Duration.ZERO, clock, sleeper),
                new CircuitBreaker(threshold, Duration.ofSeconds(60), clock, metrics),
                new RetryOrchestrator(maxRetries, Duration.ofSeconds(1), clock, sleeper, metrics),
                transport,
                metrics,
                clock);
        built.add(gw);
        return gw;
    }

    private static JsonNode product(String id) {
        return JsonNodeFactory.instance.objectNode().put("id", id);
    }

    @Test
    void secondIdenticalCallShouldBeServedFromCache() {
        CatalogGateway gw = gateway(60, 5, 3);
        transport.behaviour = n -> product("p-" + n);

        UpstreamResponse first = gw.call(CatalogEndpoint.DETAIL, Map.of("id", "7"), CacheStrategy.LONG_TERM);
        UpstreamResponse second = gw.call(CatalogEndpoint.DETAIL, Map.of("id", "7"), CacheStrategy.LONG_TERM);

        assertThat(first.success()).isTrue();
        assertThat(first.cached()).isFalse();
        assertThat(second.cached()).isTrue();
        assertThat(second.data()).isEqualTo(first.data());
        assertThat(transport.calls).hasValue(1);
        assertThat(registry.get("catalog_gateway_cache_hits_total").tag("endpoint", "detail").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void parameterOrderShouldNotDefeatCache() {
        CatalogGateway gw = gateway(60, 5, 3);
        Map<String, String> ab = new LinkedHashMap<>();
        ab.put("page", "1");
        ab.put("search", "dress");
        Map<String, String> ba = new LinkedHashMap<>();
        ba.put("search", "dress");
        ba.put("page", "1");

        gw.call(CatalogEndpoint.SEARCH, ab, CacheStrategy.SHORT_TERM);
        UpstreamResponse again = gw.call(CatalogEndpoint.SEARCH, ba, CacheStrategy.SHORT_TERM);

        assertThat(again.cached()).isTrue();
        assertThat(transport.calls).hasValue(1);
    }

    @Test
    void noCacheStrategyShouldAlwaysReachUpstream() {
        CatalogGateway gw = gateway(60, 5, 3);

        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);

        assertThat(transport.calls).hasValue(2);
        assertThat(gw.getStatus().cacheSize()).isZero();
    }

    @Test
    void cachedEntryShouldExpireAfterTtl() {
        CatalogGateway gw = gateway(60, 5, 3);
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.SHORT_TERM);

        clock.advance(Duration.ofMinutes(5));
        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.SHORT_TERM);

        assertThat(r.cached()).isFalse();
        assertThat(transport.calls).hasValue(2);
    }

    @Test
    void failuresShouldNotBeCached() {
        CatalogGateway gw = gateway(60, 5, 3);
        transport.behaviour = n -> {
            throw new UpstreamClientException(404, "not found");
        };

        UpstreamResponse first = gw.call(CatalogEndpoint.DETAIL, Map.of("id", "x"), CacheStrategy.LONG_TERM);
        gw.call(CatalogEndpoint.DETAIL, Map.of("id", "x"), CacheStrategy.LONG_TERM);

        assertThat(first.success()).isFalse();
        assertThat(first.errorKind()).isEqualTo(ErrorKind.UPSTREAM_CLIENT);
        assertThat(first.statusCode()).isEqualTo(404);
        assertThat(first.data()).isNull();
        assertThat(transport.calls).hasValue(2);
    }

    @Test
    void retriedLogicalCallShouldCountAsOneBreakerFailure() {
        CatalogGateway gw = gateway(60, 5, 3);
        transport.behaviour = n -> {
            throw new TransientNetworkException("timeout", null);
        };

        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);

        assertThat(r.errorKind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(r.statusCode()).isEqualTo(504);
        assertThat(transport.calls).hasValue(4);
        assertThat(gw.getStatus().consecutiveFailures()).isEqualTo(1);
        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void openCircuitShouldShortCircuitWithoutReachingUpstream() {
        CatalogGateway gw = gateway(60, 5, 0);
        transport.behaviour = n -> {
            throw new TransientNetworkException("refused", null);
        };
        for (int i = 0; i < 5; i++) {
            gw.call(CatalogEndpoint.LIST, Map.of("page", String.valueOf(i)), CacheStrategy.NO_CACHE);
        }
        int before = transport.calls.get();

        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);

        assertThat(r.errorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(r.statusCode()).isEqualTo(503);
        assertThat(transport.calls).hasValue(before);
    }

    @Test
    void successfulTrialAfterCooldownShouldCloseCircuit() {
        CatalogGateway gw = gateway(60, 2, 0);
        transport.behaviour = n -> {
            throw new TransientNetworkException("refused", null);
        };
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);
        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.OPEN);

        clock.advance(Duration.ofSeconds(60));
        transport.behaviour = n -> product("back");
        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);

        assertThat(r.success()).isTrue();
        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void clientErrorShouldNotTripBreaker() {
        CatalogGateway gw = gateway(60, 2, 3);
        transport.behaviour = n -> {
            throw new UpstreamClientException(400, "bad filter");
        };

        for (int i = 0; i < 5; i++) {
            gw.call(CatalogEndpoint.SEARCH, Map.of("search", "x" + i), CacheStrategy.NO_CACHE);
        }

        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.CLOSED);
        assertThat(transport.calls).hasValue(5);
    }

    @Test
    void exhaustedBudgetShouldReturnRateLimitedWithRetryAfter() {
        CatalogGateway gw = gateway(1, 5, 0);
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);

        clock.advance(Duration.ofSeconds(20));
        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);

        assertThat(r.errorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(r.statusCode()).isEqualTo(429);
        assertThat(r.retryAfterMs()).isEqualTo(40_000L);
        assertThat(r.retryAfterSeconds()).isEqualTo(40L);
        assertThat(transport.calls).hasValue(1);
    }

    @Test
    void cacheHitShouldNotConsumeRateLimitBudget() {
        CatalogGateway gw = gateway(1, 5, 0);
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.MEDIUM_TERM);

        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.MEDIUM_TERM);

        assertThat(r.success()).isTrue();
        assertThat(r.cached()).isTrue();
    }

    @Test
    void expiredDeadlineShouldReportCancelledWithoutTouchingBreaker() {
        CatalogGateway gw = gateway(60, 1, 3);

        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE,
                CallDeadline.at(clock.instant()));

        assertThat(r.errorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(transport.calls).hasValue(0);
        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.CLOSED);
        assertThat(gw.getStatus().consecutiveFailures()).isZero();
    }

    @Test
    void missingPathVariableShouldFailAsClientErrorWithoutTouchingBreakerOrBudget() {
        CatalogGateway gw = gateway(60, 2, 3);

        UpstreamResponse r = null;
        for (int i = 0; i < 5; i++) {
            r = gw.call(CatalogEndpoint.DETAIL, Map.of(), CacheStrategy.NO_CACHE);
        }

        assertThat(r.success()).isFalse();
        assertThat(r.errorKind()).isEqualTo(ErrorKind.UPSTREAM_CLIENT);
        assertThat(r.statusCode()).isEqualTo(400);
        assertThat(r.errorMessage()).contains("id");
        assertThat(transport.calls).hasValue(0);
        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.CLOSED);
        assertThat(gw.getStatus().consecutiveFailures()).isZero();
        assertThat(gw.getStatus().rateLimitUsed()).isZero();
    }

    @Test
    void blankPathVariableShouldBeRejectedToo() {
        CatalogGateway gw = gateway(60, 1, 0);

        UpstreamResponse r = gw.call(CatalogEndpoint.DETAIL_LEGACY, Map.of("id", "  "), CacheStrategy.LONG_TERM);

        assertThat(r.errorKind()).isEqualTo(ErrorKind.UPSTREAM_CLIENT);
        assertThat(transport.calls).hasValue(0);
        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void deadlineShouldAbortSlowInFlightCall() throws Exception {
        CatalogGateway gw = gateway(60, 1, 3);
        CountDownLatch aborted = new CountDownLatch(1);
        transport.behaviour = n -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                aborted.countDown();
                Thread.currentThread().interrupt();
            }
            return product("late");
        };

        long start = System.nanoTime();
        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE,
                CallDeadline.after(clock, Duration.ofMillis(100)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(r.success()).isFalse();
        assertThat(r.errorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(elapsedMs).isLessThan(5_000L);
        assertThat(aborted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(transport.calls).hasValue(1);
        assertThat(gw.getStatus().breakerState()).isEqualTo(CircuitState.CLOSED);
        assertThat(gw.getStatus().consecutiveFailures()).isZero();
    }

    @Test
    void boundedCallShouldCarryResultAndErrorsFromTheAttempt() {
        CatalogGateway gw = gateway(60, 5, 0);
        AtomicReference<String> worker = new AtomicReference<>();
        transport.behaviour = n -> {
            worker.set(Thread.currentThread().getName());
            if (n == 1) {
                return product("fast");
            }
            throw new UpstreamClientException(404, "gone");
        };

        UpstreamResponse ok = gw.call(CatalogEndpoint.DETAIL, Map.of("id", "1"), CacheStrategy.NO_CACHE,
                CallDeadline.after(clock, Duration.ofSeconds(5)));
        UpstreamResponse missing = gw.call(CatalogEndpoint.DETAIL, Map.of("id", "2"), CacheStrategy.NO_CACHE,
                CallDeadline.after(clock, Duration.ofSeconds(5)));

        assertThat(ok.success()).isTrue();
        assertThat(ok.data().path("id").asText()).isEqualTo("fast");
        assertThat(worker.get()).startsWith("catalog-call-");
        assertThat(missing.errorKind()).isEqualTo(ErrorKind.UPSTREAM_CLIENT);
        assertThat(missing.statusCode()).isEqualTo(404);
    }

    @Test
    void unexpectedRuntimeErrorShouldBecomeUpstreamServerFailure() {
        CatalogGateway gw = gateway(60, 5, 3);
        transport.behaviour = n -> {
            throw new IllegalStateException("boom");
        };

        UpstreamResponse r = gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.NO_CACHE);

        assertThat(r.errorKind()).isEqualTo(ErrorKind.UPSTREAM_SERVER);
        assertThat(r.statusCode()).isEqualTo(500);
        assertThat(r.errorMessage()).contains("boom");
        assertThat(transport.calls).hasValue(1);
    }

    @Test
    void clearCacheShouldForceFreshFetch() {
        CatalogGateway gw = gateway(60, 5, 3);
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.LONG_TERM);

        gw.clearCache();
        gw.call(CatalogEndpoint.LIST, Map.of(), CacheStrategy.LONG_TERM);

        assertThat(transport.calls).hasValue(2);
    }
}
