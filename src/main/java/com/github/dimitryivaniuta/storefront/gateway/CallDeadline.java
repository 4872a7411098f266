package com.github.dimitryivaniuta.storefront.gateway;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Optional point in time after which a call must stop waiting and report cancellation.
 * {@link #none()} never expires.
 */
public record CallDeadline(Instant at) {

    private static final CallDeadline NONE = new CallDeadline(null);

    public static CallDeadline none() {
        return NONE;
    }

    public static CallDeadline at(Instant instant) {
        return instant == null ? NONE : new CallDeadline(instant);
    }

    public static CallDeadline after(Clock clock, Duration timeout) {
        return new CallDeadline(clock.instant().plus(timeout));
    }

    public boolean isBounded() {
        return at != null;
    }

    public boolean isExpired(Clock clock) {
        return at != null && !clock.instant().isBefore(at);
    }

    /** Whether waiting {@code wait} from now would still end before the deadline. */
    public boolean allows(Clock clock, Duration wait) {
        return at == null || !clock.instant().plus(wait).isAfter(at);
    }

    public Duration remaining(Clock clock) {
        if (at == null) {
            throw new IllegalStateException("unbounded deadline has no remaining time");
        }
        Duration d = Duration.between(clock.instant(), at);
        return d.isNegative() ? Duration.ZERO : d;
    }
}
