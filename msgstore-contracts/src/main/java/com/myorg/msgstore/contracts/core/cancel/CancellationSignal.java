package com.myorg.msgstore.contracts.core.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative, one-shot stop request shared between a component and the code that owns it.
 *
 * <p>Blocking code either polls {@link #isCancelled()} or parks in
 * {@link #awaitCancellation(Duration)}; code blocked inside a third-party call can register an
 * {@link #onCancel(Runnable) unblock hook} (for example {@code consumer::wakeup}).
 */
public final class CancellationSignal {
    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

    /**
     * A signal that is cancelled together with {@code parent}, but can also be cancelled on its own
     * without affecting the parent.
     */
    public static CancellationSignal linkedTo(CancellationSignal parent) {
        CancellationSignal child = new CancellationSignal();
        if (parent != null) {
            parent.onCancel(child::cancel);
        }
        return child;
    }

    /** Idempotent. Hooks run once, on the calling thread. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        latch.countDown();
        for (Runnable hook : hooks) {
            runHook(hook);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Park the caller for at most {@code timeout}.
     *
     * @return {@code true} if the signal fired (or the thread was interrupted) before the timeout
     */
    public boolean awaitCancellation(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        try {
            return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            // interrupt is a harder form of the same request
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Register a hook that runs when the signal fires. Runs immediately if it already fired.
     */
    public void onCancel(Runnable hook) {
        if (hook == null) return;
        hooks.add(hook);
        if (isCancelled() && hooks.remove(hook)) {
            runHook(hook);
        }
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation hook failed: {}", e.toString(), e);
        }
    }
}
