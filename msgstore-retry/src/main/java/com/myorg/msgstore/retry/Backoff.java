package com.myorg.msgstore.retry;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Exponential backoff with optional full jitter.
 *
 * <p>Each {@link #advance()} grows the current delay by {@link RetryPolicy#factor()} up to
 * {@link RetryPolicy#max()}; {@link #reset()} brings it back to {@link RetryPolicy#initial()}.
 * Growth is deterministic: jitter only affects how long a caller actually waits, never the
 * stored delay.
 *
 * <p>Not thread-safe. One instance per retrying loop.
 */
public final class Backoff {

    private final RetryPolicy policy;
    private final Supplier<Random> random;
    private Duration currentDelay;

    public Backoff(RetryPolicy policy) {
        this(policy, ThreadLocalRandom::current);
    }

    Backoff(RetryPolicy policy, Supplier<Random> random) {
        this.policy = Objects.requireNonNull(policy, "policy").sanitized();
        this.random = random;
        this.currentDelay = this.policy.initial();
    }

    public RetryPolicy policy() {
        return policy;
    }

    public Duration currentDelay() {
        return currentDelay;
    }

    /**
     * Grow the current delay and return how long the caller should wait for this failure.
     */
    public Duration advance() {
        currentDelay = nextDelay(currentDelay);
        return policy.jitter() ? jitter(currentDelay) : currentDelay;
    }

    /**
     * {@link #advance()} then park until the wait elapses or {@code signal} fires.
     *
     * @return {@code true} if the wait was cut short by cancellation
     */
    public boolean advanceAndWait(CancellationSignal signal) {
        Duration wait = advance();
        if (signal == null) {
            return sleep(wait);
        }
        return signal.awaitCancellation(wait);
    }

    public void reset() {
        currentDelay = policy.initial();
    }

    Duration nextDelay(Duration current) {
        double next = current.toNanos() * policy.factor();
        long maxNanos = policy.max().toNanos();
        if (next >= maxNanos) {
            return policy.max();
        }
        return Duration.ofNanos((long) next);
    }

    /** Uniform in {@code (0, delay]}. */
    Duration jitter(Duration delay) {
        long nanos = delay.toNanos();
        if (nanos <= 1) return delay;
        long sampled = random.get().nextLong(nanos) + 1;
        return Duration.ofNanos(sampled);
    }

    private static boolean sleep(Duration wait) {
        try {
            TimeUnit.NANOSECONDS.sleep(wait.toNanos());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
