package com.myorg.msgstore.kafka.broker;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;

/**
 * Exclusively owned read side of a broker connection. Single-threaded: one loop, one reader.
 */
public interface BrokerReader extends AutoCloseable {

    /**
     * Block until the next message is available.
     *
     * @throws java.util.concurrent.CancellationException if {@code signal} fires while waiting
     * @throws RuntimeException on any other (assumed transient) broker failure
     */
    BrokerMessage fetchNext(CancellationSignal signal);

    /**
     * Durably record that {@code message} and everything before it in its partition is processed.
     *
     * @throws java.util.concurrent.CancellationException if {@code signal} fires during the call
     */
    void commit(BrokerMessage message, CancellationSignal signal);

    /**
     * Move the read position of the message's partition back to it, so the next fetch for that
     * partition returns {@code message} again.
     */
    void rewind(BrokerMessage message);

    /** Release the connection. Idempotent. */
    @Override
    void close();
}
