package com.isengard.orchestrator.client;

import java.time.Duration;

/**
 * Exponential reconnect delay: {@code initial}, doubling per consecutive
 * failure, capped at {@code max}, back to {@code initial} after a
 * successful connect.
 */
public class ReconnectBackoff {

    private final Duration initial;
    private final Duration max;

    private Duration next;
    private int      failures;

    public ReconnectBackoff(Duration initial, Duration max) {
        if (initial.isZero() || initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Need 0 < initial <= max, got " + initial + " / " + max);
        }
        this.initial = initial;
        this.max     = max;
        this.next    = initial;
    }

    /** 1s doubling up to 30s. */
    public static ReconnectBackoff standard() {
        return new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    /** Delay before the next attempt; each call counts as one more failure. */
    public synchronized Duration nextDelay() {
        Duration delay = next;
        failures++;
        Duration doubled = next.multipliedBy(2);
        next = doubled.compareTo(max) > 0 ? max : doubled;
        return delay;
    }

    public synchronized void reset() {
        next     = initial;
        failures = 0;
    }

    public synchronized int consecutiveFailures() {
        return failures;
    }
}
