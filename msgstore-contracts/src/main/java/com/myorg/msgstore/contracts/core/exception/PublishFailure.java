package com.myorg.msgstore.contracts.core.exception;

/**
 * Why a publish did not reach the broker. Callers use it to decide whether to retry.
 */
public enum PublishFailure {
    TIMEOUT(true),
    INTERRUPTED(true),
    BROKER_REJECTED(true),
    SERIALIZATION(false),
    UNKNOWN(false);

    private final boolean retryable;

    PublishFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
