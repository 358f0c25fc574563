package com.myorg.msgstore.app.lifecycle;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.exception.ShutdownException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the component container inside the Spring lifecycle. Owns the process-wide cancellation
 * signal: Spring's shutdown hook (SIGINT/SIGTERM) ends up in {@link #stop()}, which fires it.
 */
@Slf4j
public class MessageStoreLifecycle implements SmartLifecycle {

    // start after the context is ready, stop once the web server no longer accepts publishes
    static final int PHASE = Integer.MAX_VALUE - 1024;

    private final ComponentContainer container;
    private volatile CancellationSignal signal;
    private volatile boolean running;

    public MessageStoreLifecycle(ComponentContainer container) {
        this.container = container;
    }

    @Override
    public void start() {
        signal = new CancellationSignal();
        container.startAll(signal);
        running = true;
        log.info("message store started components={}", container.startedComponents());
    }

    @Override
    public void stop() {
        running = false;
        if (signal != null) signal.cancel();
        try {
            container.stopAll();
            log.info("message store stopped");
        } catch (ShutdownException e) {
            log.error("message store stopped with errors", e);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    CancellationSignal signal() {
        return signal;
    }
}
