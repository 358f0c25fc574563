package com.myorg.msgstore.contracts.core.lifecycle;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.exception.ShutdownException;

import java.time.Duration;

/**
 * A subsystem with an explicit start/stop lifecycle (broker connection, document store...).
 */
public interface Component {

    String name();

    /**
     * Connect and launch background work. Background work keeps running until {@code signal}
     * fires or {@link #stop(Duration)} is called.
     *
     * @throws RuntimeException if the component cannot start; nothing is left running in that case
     */
    void start(CancellationSignal signal);

    /**
     * Orderly stop, bounded by {@code timeout}. Release failures do not abort the rest of the stop;
     * they are collected into the thrown exception.
     */
    void stop(Duration timeout) throws ShutdownException;
}
