package com.myorg.msgstore.retry;

import java.time.Duration;

/**
 * Pacing configuration for a retried operation.
 *
 * @param attempts ceiling on tries; {@code 0} means unbounded where the caller allows it
 * @param initial  first delay, also the delay a {@link Backoff} returns to on reset
 * @param max      upper bound for any computed delay
 * @param factor   growth applied to the current delay on each failure
 * @param jitter   wait a uniform sample of {@code (0, delay]} instead of the full delay
 */
public record RetryPolicy(int attempts, Duration initial, Duration max, double factor, boolean jitter) {

    public static final Duration DEFAULT_INITIAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);
    public static final double DEFAULT_FACTOR = 2.0;

    /** Unbounded attempts, defaults for everything else. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(0, DEFAULT_INITIAL, DEFAULT_MAX, DEFAULT_FACTOR, true);
    }

    public boolean isUnbounded() {
        return attempts <= 0;
    }

    /**
     * Replace zero-valued or inconsistent fields so the policy can never produce a zero or
     * unbounded wait: positive initial, {@code max >= initial}, {@code factor >= 1}.
     */
    public RetryPolicy sanitized() {
        Duration i = isPositive(initial) ? initial : DEFAULT_INITIAL;
        Duration m = isPositive(max) ? max : DEFAULT_MAX;
        if (m.compareTo(i) < 0) m = i;
        double f = (Double.isNaN(factor) || Double.isInfinite(factor) || factor < 1.0) ? DEFAULT_FACTOR : factor;
        int a = Math.max(0, attempts);
        return new RetryPolicy(a, i, m, f, jitter);
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }
}
