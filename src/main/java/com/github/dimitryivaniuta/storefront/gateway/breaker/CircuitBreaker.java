package com.github.dimitryivaniuta.storefront.gateway.breaker;

import com.github.dimitryivaniuta.storefront.gateway.metrics.CatalogGatewayMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consecutive-failure circuit breaker guarding the upstream catalog.
 *
 * Notes:
 * - State is one immutable {@link Snapshot} advanced with compare-and-set, no locks.
 * - OPEN becomes HALF_OPEN lazily, on the first {@link #tryAcquire()} after the cooldown.
 *   That caller receives {@link Permit#TRIAL}; everybody else is denied until the trial
 *   reports back.
 * - Verdicts carry the permit they answer. A NORMAL verdict only counts while CLOSED, so a
 *   slow call that started before the circuit opened cannot close it again.
 */
@Slf4j
public final class CircuitBreaker {

    /** Outcome of {@link #tryAcquire()}. */
    public enum Permit {
        NORMAL,
        TRIAL,
        DENIED;

        public boolean isGranted() {
            return this != DENIED;
        }
    }

    private record Snapshot(CircuitState state, int consecutiveFailures, Instant openedAt) {}

    private static final Snapshot FRESH = new Snapshot(CircuitState.CLOSED, 0, null);

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final CatalogGatewayMetrics metrics;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(FRESH);

    public CircuitBreaker(int failureThreshold, Duration cooldown, Clock clock, CatalogGatewayMetrics metrics) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative, got " + cooldown);
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public Permit tryAcquire() {
        while (true) {
            Snapshot s = snapshot.get();
            switch (s.state()) {
                case CLOSED:
                    return Permit.NORMAL;
                case HALF_OPEN:
                    return Permit.DENIED;
                default:
                    if (clock.instant().isBefore(s.openedAt().plus(cooldown))) {
                        return Permit.DENIED;
                    }
                    Snapshot trial = new Snapshot(CircuitState.HALF_OPEN, s.consecutiveFailures(), s.openedAt());
                    if (snapshot.compareAndSet(s, trial)) {
                        transitioned(CircuitState.OPEN, CircuitState.HALF_OPEN);
                        return Permit.TRIAL;
                    }
            }
        }
    }

    public void onSuccess(Permit permit) {
        if (permit == Permit.TRIAL) {
            Snapshot s = snapshot.get();
            if (s.state() == CircuitState.HALF_OPEN && snapshot.compareAndSet(s, FRESH)) {
                transitioned(CircuitState.HALF_OPEN, CircuitState.CLOSED);
            }
            return;
        }
        if (permit != Permit.NORMAL) {
            return;
        }
        while (true) {
            Snapshot s = snapshot.get();
            if (s.state() != CircuitState.CLOSED || s.consecutiveFailures() == 0) {
                return;
            }
            if (snapshot.compareAndSet(s, FRESH)) {
                return;
            }
        }
    }

    public void onFailure(Permit permit) {
        if (permit == Permit.TRIAL) {
            Snapshot s = snapshot.get();
            if (s.state() == CircuitState.HALF_OPEN) {
                Snapshot reopened = new Snapshot(CircuitState.OPEN, s.consecutiveFailures() + 1, clock.instant());
                if (snapshot.compareAndSet(s, reopened)) {
                    transitioned(CircuitState.HALF_OPEN, CircuitState.OPEN);
                }
            }
            return;
        }
        if (permit != Permit.NORMAL) {
            return;
        }
        while (true) {
            Snapshot s = snapshot.get();
            if (s.state() != CircuitState.CLOSED) {
                return;
            }
            int failures = s.consecutiveFailures() + 1;
            Snapshot next = failures >= failureThreshold
                    ? new Snapshot(CircuitState.OPEN, failures, clock.instant())
                    : new Snapshot(CircuitState.CLOSED, failures, null);
            if (snapshot.compareAndSet(s, next)) {
                if (next.state() == CircuitState.OPEN) {
                    transitioned(CircuitState.CLOSED, CircuitState.OPEN);
                }
                return;
            }
        }
    }

    /**
     * Hands back a trial permit that never reached the upstream. The circuit returns to OPEN
     * with its original opening time, so the next caller may trial immediately.
     */
    public void releaseTrial(Permit permit) {
        if (permit != Permit.TRIAL) {
            return;
        }
        Snapshot s = snapshot.get();
        if (s.state() == CircuitState.HALF_OPEN) {
            Snapshot back = new Snapshot(CircuitState.OPEN, s.consecutiveFailures(), s.openedAt());
            if (snapshot.compareAndSet(s, back)) {
                transitioned(CircuitState.HALF_OPEN, CircuitState.OPEN);
            }
        }
    }

    public void reset() {
        Snapshot previous = snapshot.getAndSet(FRESH);
        if (previous.state() != CircuitState.CLOSED) {
            transitioned(previous.state(), CircuitState.CLOSED);
        }
    }

    public CircuitState state() {
        return snapshot.get().state();
    }

    public int consecutiveFailures() {
        return snapshot.get().consecutiveFailures();
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    private void transitioned(CircuitState from, CircuitState to) {
        metrics.breakerTransition(from, to);
        if (to == CircuitState.OPEN) {
            log.warn("Catalog circuit {} -> {} (threshold={}, cooldown={})", from, to, failureThreshold, cooldown);
        } else {
            log.info("Catalog circuit {} -> {}", from, to);
        }
    }
}
