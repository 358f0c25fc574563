package com.myorg.msgstore.contracts.core.message;

import java.util.Arrays;
import java.util.Objects;

/**
 * One record read from (or written to) the broker.
 *
 * <p>The payload array is copied on the way in and on the way out, so an instance can be
 * handed to any number of handlers without one of them mutating what the others see.
 */
public record BrokerMessage(String topic, int partition, long offset, String key, byte[] payload) {

    /** Partition/offset placeholder for messages that have not been written yet. */
    public static final int UNASSIGNED = -1;

    public BrokerMessage {
        Objects.requireNonNull(topic, "topic");
        payload = payload == null ? new byte[0] : payload.clone();
    }

    /** Message to be published; the broker assigns partition and offset. */
    public static BrokerMessage outgoing(String topic, String key, byte[] payload) {
        return new BrokerMessage(topic, UNASSIGNED, UNASSIGNED, key, payload);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int size() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BrokerMessage other)) return false;
        return partition == other.partition
                && offset == other.offset
                && topic.equals(other.topic)
                && Objects.equals(key, other.key)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(topic, partition, offset, key);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "BrokerMessage{topic=" + topic + ", partition=" + partition + ", offset=" + offset
                + ", key=" + key + ", size=" + payload.length + "}";
    }
}
