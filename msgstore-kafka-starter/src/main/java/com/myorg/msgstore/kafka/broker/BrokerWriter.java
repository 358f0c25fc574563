package com.myorg.msgstore.kafka.broker;

import com.myorg.msgstore.contracts.core.exception.PublishException;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;

public interface BrokerWriter extends AutoCloseable {

    /**
     * Synchronously write one message. No retry beyond what the client library does on its own.
     */
    void writeOne(String topic, BrokerMessage message) throws PublishException;

    @Override
    void close();
}
