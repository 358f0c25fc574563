package com.myorg.msgstore.kafka.publish;

import com.myorg.msgstore.contracts.core.exception.PublishException;

// Gửi một message lên Kafka, đồng bộ. Không retry: caller quyết định dựa trên PublishFailure.
public interface MessagePublisher {

    /**
     * @param topic destination; the configured {@code msgstore.kafka.topic} when blank
     * @param key   optional partitioning key
     */
    void publish(String topic, String key, byte[] payload) throws PublishException;
}
