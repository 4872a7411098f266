package com.github.dimitryivaniuta.storefront.gateway;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait used for backoff and rate-limit queueing. Must honour interruption.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> TimeUnit.MILLISECONDS.sleep(Math.max(0, d.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
