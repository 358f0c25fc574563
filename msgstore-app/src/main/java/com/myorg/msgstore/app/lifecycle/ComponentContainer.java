package com.myorg.msgstore.app.lifecycle;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.exception.MessageStoreException;
import com.myorg.msgstore.contracts.core.exception.ShutdownException;
import com.myorg.msgstore.contracts.core.lifecycle.Component;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts components in the given order and stops them in reverse.
 *
 * <p>If one fails to start, the ones already started are stopped again and the start fails.
 * Stopping never gives up half-way: every started component gets its stop call (or a deadline
 * failure) and the failures come back together.
 */
@Slf4j
public class ComponentContainer {

    private final List<Component> components;
    private final Duration shutdownTimeout;
    private final List<Component> started = new ArrayList<>();

    public ComponentContainer(List<Component> components, Duration shutdownTimeout) {
        this.components = List.copyOf(components);
        this.shutdownTimeout = shutdownTimeout;
    }

    public synchronized void startAll(CancellationSignal signal) {
        for (Component c : components) {
            log.info("starting component={}", c.name());
            try {
                c.start(signal);
            } catch (RuntimeException e) {
                log.error("component {} failed to start; stopping {} started component(s)", c.name(), started.size());
                MessageStoreException failure = new MessageStoreException(c.name() + ": start failed", e);
                try {
                    stopAll();
                } catch (ShutdownException stopFailure) {
                    failure.addSuppressed(stopFailure);
                }
                throw failure;
            }
            started.add(c);
        }
    }

    /**
     * @throws ShutdownException carrying one suppressed exception per component that failed to stop
     */
    public synchronized void stopAll() throws ShutdownException {
        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        List<Throwable> failures = new ArrayList<>();

        for (int i = started.size() - 1; i >= 0; i--) {
            Component c = started.get(i);
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isNegative() || remaining.isZero()) {
                log.error("shutdown deadline exceeded before stopping component={}", c.name());
                failures.add(new ShutdownException(c.name() + ": stop skipped, shutdown deadline exceeded"));
                continue;
            }
            try {
                c.stop(remaining);
                log.info("stopped component={}", c.name());
            } catch (RuntimeException e) {
                log.error("component {} failed to stop", c.name(), e);
                failures.add(e);
            }
        }
        started.clear();

        ShutdownException aggregated = ShutdownException.aggregate("shutdown failed", failures);
        if (aggregated != null) throw aggregated;
    }

    public synchronized List<String> startedComponents() {
        return started.stream().map(Component::name).toList();
    }
}
