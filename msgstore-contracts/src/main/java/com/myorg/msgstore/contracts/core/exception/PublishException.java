package com.myorg.msgstore.contracts.core.exception;

public class PublishException extends MessageStoreException {

    private final PublishFailure failure;
    private final String topic;

    public PublishException(PublishFailure failure, String topic, Throwable cause) {
        super("kafka: write message failed (" + failure + ") topic=" + topic, cause);
        this.failure = failure == null ? PublishFailure.UNKNOWN : failure;
        this.topic = topic;
    }

    public PublishFailure getFailure() {
        return failure;
    }

    public String getTopic() {
        return topic;
    }
}
