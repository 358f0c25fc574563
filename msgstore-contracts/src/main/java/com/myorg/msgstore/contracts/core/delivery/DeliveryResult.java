package com.myorg.msgstore.contracts.core.delivery;

import java.util.Objects;

public final class DeliveryResult {

    private static final DeliveryResult SUCCESS = new DeliveryResult(null);

    private final Throwable cause;

    private DeliveryResult(Throwable cause) {
        this.cause = cause;
    }

    public static DeliveryResult success() {
        return SUCCESS;
    }

    public static DeliveryResult failure(Throwable cause) {
        return new DeliveryResult(Objects.requireNonNull(cause, "cause"));
    }

    public static DeliveryResult failure(String message) {
        return failure(new IllegalStateException(message));
    }

    public boolean isSuccess() {
        return cause == null;
    }

    public boolean isFailure() {
        return cause != null;
    }

    /** {@code null} on success. */
    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return isSuccess() ? "DeliveryResult[success]" : "DeliveryResult[failure: " + cause + "]";
    }
}
