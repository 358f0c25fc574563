package com.myorg.msgstore.kafka.consume;

/** Where a loop reads from; carried into its log lines. */
public record ConsumerIdentity(String address, String topic, String groupId) {
}
