package com.myorg.msgstore.kafka.consume;

import com.myorg.msgstore.contracts.core.exception.MessageStoreException;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;

/** Every commit attempt for one message failed. Handled inside the loop. */
public class CommitRetriesExhaustedException extends MessageStoreException {

    private final int attempts;

    public CommitRetriesExhaustedException(BrokerMessage message, int attempts, Throwable lastFailure) {
        super("commit failed after " + attempts + " attempt(s) topic=" + message.topic()
                + " partition=" + message.partition() + " offset=" + message.offset(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
