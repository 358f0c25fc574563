package com.myorg.msgstore.kafka.broker;

@FunctionalInterface
public interface BrokerReaderFactory {

    /** A new, independently owned reader. */
    BrokerReader create();
}
