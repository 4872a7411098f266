package com.github.dimitryivaniuta.storefront.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.storefront.gateway.breaker.CircuitBreaker;
import com.github.dimitryivaniuta.storefront.gateway.cache.CacheEntry;
import com.github.dimitryivaniuta.storefront.gateway.cache.CacheStrategy;
import com.github.dimitryivaniuta.storefront.gateway.cache.CacheTtlPolicy;
import com.github.dimitryivaniuta.storefront.gateway.cache.ResponseCache;
import com.github.dimitryivaniuta.storefront.gateway.error.CallCancelledException;
import com.github.dimitryivaniuta.storefront.gateway.error.CatalogAccessException;
import com.github.dimitryivaniuta.storefront.gateway.error.CircuitOpenException;
import com.github.dimitryivaniuta.storefront.gateway.error.InvalidCatalogRequestException;
import com.github.dimitryivaniuta.storefront.gateway.error.RateLimitExceededException;
import com.github.dimitryivaniuta.storefront.gateway.error.UpstreamClientException;
import com.github.dimitryivaniuta.storefront.gateway.error.UpstreamServerException;
import com.github.dimitryivaniuta.storefront.gateway.metrics.CatalogGatewayMetrics;
import com.github.dimitryivaniuta.storefront.gateway.ratelimit.RateLimitDecision;
import com.github.dimitryivaniuta.storefront.gateway.ratelimit.SlidingWindowRateLimiter;
import com.github.dimitryivaniuta.storefront.gateway.retry.RetryOrchestrator;
import com.github.dimitryivaniuta.storefront.gateway.transport.CatalogTransport;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for reads against the upstream catalog.
 *
 * Order of a call:
 * 1) fingerprint, 2) cache lookup (unless NO_CACHE), 3) circuit breaker,
 * 4) rate limiter, 5) retry-wrapped transport, 6) breaker verdict + cache store.
 *
 * Every outcome, including unexpected runtime errors, is folded into an
 * {@link UpstreamResponse}; nothing thrown by the upstream path reaches the caller.
 * All state (cache, limiter window, breaker) belongs to this instance.
 *
 * Calls with a bounded {@link CallDeadline} run each transport attempt on the call executor
 * and wait at most the remaining time; an attempt still running at the deadline is
 * interrupted and the call reports {@code CANCELLED}.
 */
@Slf4j
public class CatalogGateway {

    private final ResponseCache cache;
    private final CacheTtlPolicy ttlPolicy;
    private final SlidingWindowRateLimiter rateLimiter;
    private final CircuitBreaker breaker;
    private final RetryOrchestrator retry;
    private final CatalogTransport transport;
    private final CatalogGatewayMetrics metrics;
    private final Clock clock;
    private final ExecutorService callExecutor;

    public CatalogGateway(ResponseCache cache,
                          CacheTtlPolicy ttlPolicy,
                          SlidingWindowRateLimiter rateLimiter,
                          CircuitBreaker breaker,
                          RetryOrchestrator retry,
                          CatalogTransport transport,
                          CatalogGatewayMetrics metrics,
                          Clock clock) {
        this(cache, ttlPolicy, rateLimiter, breaker, retry, transport, metrics, clock, newCallExecutor());
    }

    public CatalogGateway(ResponseCache cache,
                          CacheTtlPolicy ttlPolicy,
                          SlidingWindowRateLimiter rateLimiter,
                          CircuitBreaker breaker,
                          RetryOrchestrator retry,
                          CatalogTransport transport,
                          CatalogGatewayMetrics metrics,
                          Clock clock,
                          ExecutorService callExecutor) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.ttlPolicy = Objects.requireNonNull(ttlPolicy, "ttlPolicy must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
    }

    /** Daemon threads, created on demand; idle ones go away after a minute. */
    public static ExecutorService newCallExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "catalog-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static CatalogGateway create(CatalogGatewayProperties props,
                                        CatalogTransport transport,
                                        CatalogGatewayMetrics metrics,
                                        Clock clock,
                                        Sleeper sleeper) {
        return create(props, transport, metrics, clock, sleeper, newCallExecutor());
    }

    /**
     * Builds a gateway with its own cache, limiter and breaker from configuration.
     */
    public static CatalogGateway create(CatalogGatewayProperties props,
                                        CatalogTransport transport,
                                        CatalogGatewayMetrics metrics,
                                        Clock clock,
                                        Sleeper sleeper,
                                        ExecutorService callExecutor) {
        CatalogGatewayProperties.Cache c = props.getCache();
        CatalogGatewayProperties.RateLimit rl = props.getRateLimit();
        CatalogGatewayProperties.Breaker b = props.getBreaker();
        CatalogGatewayProperties.Retry r = props.getRetry();

        return new CatalogGateway(
                new ResponseCache(c.getMaxSize(), clock),
                CacheTtlPolicy.of(c.getTtl().getShortTerm(), c.getTtl().getMediumTerm(), c.getTtl().getLongTerm()),
                new SlidingWindowRateLimiter(rl.getBudget(), rl.getWindow(), rl.getMode(), rl.getMaxWait(), clock, sleeper),
                new CircuitBreaker(b.getFailureThreshold(), b.getCooldown(), clock, metrics),
                new RetryOrchestrator(r.getMaxRetries(), r.getBaseDelay(), clock, sleeper, metrics),
                transport,
                metrics,
                clock,
                callExecutor);
    }

    public UpstreamResponse call(CatalogEndpoint endpoint, Map<String, String> params, CacheStrategy strategy) {
        return call(endpoint, params, strategy, CallDeadline.none());
    }

    public UpstreamResponse call(CatalogEndpoint endpoint,
                                 Map<String, String> params,
                                 CacheStrategy strategy,
                                 CallDeadline deadline) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Map<String, String> safeParams = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        CallDeadline dl = deadline == null ? CallDeadline.none() : deadline;
        String key = endpoint.metricKey();
        long start = System.nanoTime();

        if (!endpoint.acceptsParams(safeParams)) {
            return finish(key, "invalid_request", start, UpstreamResponse.failure(
                    new InvalidCatalogRequestException(endpoint + " requires parameter '" + endpoint.pathVariable() + "'"),
                    elapsedMs(start)));
        }

        RequestFingerprint fingerprint = RequestFingerprint.of(endpoint, safeParams);

        if (strategy.isCacheable()) {
            Optional<CacheEntry> hit = cache.lookup(fingerprint);
            if (hit.isPresent()) {
                metrics.cacheHit(key);
                log.debug("Catalog cache hit endpoint={} fingerprint={}", endpoint, fingerprint);
                return finish(key, "cache_hit", start, UpstreamResponse.fromCache(hit.get().payload(), elapsedMs(start)));
            }
            metrics.cacheMiss(key);
        }

        CircuitBreaker.Permit permit = breaker.tryAcquire();
        if (!permit.isGranted()) {
            metrics.breakerRejected(key);
            return finish(key, "circuit_open", start, UpstreamResponse.failure(
                    new CircuitOpenException("Catalog circuit is open, " + endpoint + " short-circuited"), elapsedMs(start)));
        }

        try {
            RateLimitDecision decision = rateLimiter.acquire(dl);
            if (!decision.permitted()) {
                breaker.releaseTrial(permit);
                metrics.rateLimitRejected(key);
                return finish(key, "rate_limited", start, UpstreamResponse.failure(
                        new RateLimitExceededException("Catalog rate limit exceeded for " + endpoint, decision.retryAfter()),
                        elapsedMs(start)));
            }
            metrics.rateLimitAllowed(key);

            JsonNode payload = retry.execute(key, () -> fetchWithin(endpoint, safeParams, dl), dl);

            breaker.onSuccess(permit);
            if (strategy.isCacheable()) {
                cache.store(fingerprint, payload, ttlPolicy.ttlFor(strategy));
            }
            return finish(key, "success", start, UpstreamResponse.ok(payload, elapsedMs(start)));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            breaker.releaseTrial(permit);
            return finish(key, "cancelled", start, UpstreamResponse.failure(
                    new CallCancelledException("Interrupted while waiting for a rate-limit permit", e), elapsedMs(start)));
        } catch (CallCancelledException e) {
            breaker.releaseTrial(permit);
            return finish(key, "cancelled", start, UpstreamResponse.failure(e, elapsedMs(start)));
        } catch (UpstreamClientException e) {
            // the catalog answered, so it is reachable
            breaker.onSuccess(permit);
            return finish(key, "client_error", start, UpstreamResponse.failure(e, elapsedMs(start)));
        } catch (CatalogAccessException e) {
            breaker.onFailure(permit);
            return finish(key, "failure", start, UpstreamResponse.failure(e, elapsedMs(start)));
        } catch (RuntimeException e) {
            log.error("Unexpected error calling catalog endpoint={}", endpoint, e);
            breaker.onFailure(permit);
            return finish(key, "failure", start, UpstreamResponse.failure(
                    new UpstreamServerException(500, "Unexpected gateway error: " + e.getMessage(), e), elapsedMs(start)));
        }
    }

    private JsonNode fetchWithin(CatalogEndpoint endpoint, Map<String, String> params, CallDeadline deadline) {
        if (!deadline.isBounded()) {
            return transport.fetch(endpoint, params);
        }
        Duration remaining = deadline.remaining(clock);
        if (remaining.isZero()) {
            throw new CallCancelledException("Deadline passed before calling " + endpoint);
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<JsonNode> attempt = callExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return transport.fetch(endpoint, params);
            } finally {
                MDC.clear();
            }
        });

        try {
            return attempt.get(remaining.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            throw new CallCancelledException("Deadline passed while " + endpoint + " was in flight", e);
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            throw new CallCancelledException("Interrupted while " + endpoint + " was in flight", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new UpstreamServerException(500, "Catalog call failed on " + endpoint + ": " + cause, cause);
        }
    }

    public GatewayStatus getStatus() {
        return new GatewayStatus(
                cache.size(),
                cache.maxSize(),
                cache.hitCount(),
                cache.missCount(),
                rateLimiter.budget(),
                rateLimiter.used(),
                breaker.state(),
                breaker.consecutiveFailures());
    }

    /** Drops every cached response. Breaker and limiter state are untouched. */
    public void clearCache() {
        cache.clear();
    }

    public void resetBreaker() {
        breaker.reset();
    }

    /** Stops the call executor; attempts still running are interrupted. */
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    private UpstreamResponse finish(String endpoint, String outcome, long start, UpstreamResponse response) {
        metrics.recordCall(endpoint, outcome, System.nanoTime() - start);
        if (response.isFailure() && !"circuit_open".equals(outcome)) {
            log.warn("Catalog call endpoint={} failed kind={} status={} message={}",
                    endpoint, response.errorKind(), response.statusCode(), response.errorMessage());
        }
        return response;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
