package com.github.dimitryivaniuta.storefront.gateway.ratelimit;

import com.github.dimitryivaniuta.storefront.gateway.CallDeadline;
import com.github.dimitryivaniuta.storefront.gateway.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds outbound calls to {@code budget} per trailing {@code window}.
 *
 * Keeps a log of permit timestamps. Each acquire first drops the timestamps that have
 * aged out of the window, so there is no background sweep. In {@link RateLimitMode#QUEUE}
 * the caller sleeps (outside the lock) until the oldest permit expires, as long as the
 * wait fits both {@code maxWait} and the caller deadline.
 */
@Slf4j
public final class SlidingWindowRateLimiter {

    private final int budget;
    private final Duration window;
    private final RateLimitMode mode;
    private final Duration maxWait;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<Instant> permits = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int budget,
                                    Duration window,
                                    RateLimitMode mode,
                                    Duration maxWait,
                                    Clock clock,
                                    Sleeper sleeper) {
        if (budget < 1) {
            throw new IllegalArgumentException("budget must be >= 1, got " + budget);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        this.budget = budget;
        this.window = window;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.maxWait = (maxWait == null || maxWait.isNegative()) ? Duration.ZERO : maxWait;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public RateLimitDecision acquire() throws InterruptedException {
        return acquire(CallDeadline.none());
    }

    /**
     * @throws InterruptedException if the caller is interrupted while queued
     */
    public RateLimitDecision acquire(CallDeadline deadline) throws InterruptedException {
        CallDeadline dl = deadline == null ? CallDeadline.none() : deadline;
        Duration waited = Duration.ZERO;

        while (true) {
            Duration wait;
            lock.lock();
            try {
                Instant now = clock.instant();
                purge(now);
                if (permits.size() < budget) {
                    permits.addLast(now);
                    return RateLimitDecision.permit();
                }
                wait = Duration.between(now, permits.peekFirst().plus(window));
            } finally {
                lock.unlock();
            }

            if (mode == RateLimitMode.REJECT) {
                log.warn("Catalog rate limit exhausted: budget={} window={} retryAfter={}", budget, window, wait);
                return RateLimitDecision.reject(wait);
            }
            if (wait.compareTo(maxWait.minus(waited)) > 0 || !dl.allows(clock, wait)) {
                log.warn("Catalog rate limit wait {} exceeds allowed wait, rejecting", wait);
                return RateLimitDecision.reject(wait);
            }
            sleeper.sleep(wait);
            waited = waited.plus(wait);
        }
    }

    /** Permits currently counted in the trailing window. */
    public int used() {
        lock.lock();
        try {
            purge(clock.instant());
            return permits.size();
        } finally {
            lock.unlock();
        }
    }

    public int budget() {
        return budget;
    }

    public Duration window() {
        return window;
    }

    public RateLimitMode mode() {
        return mode;
    }

    // caller holds the lock
    private void purge(Instant now) {
        while (!permits.isEmpty() && !permits.peekFirst().plus(window).isAfter(now)) {
            permits.pollFirst();
        }
    }
}
