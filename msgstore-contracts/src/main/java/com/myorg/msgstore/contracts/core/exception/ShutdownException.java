package com.myorg.msgstore.contracts.core.exception;

import java.util.List;

/**
 * One or more resources failed to release. Each individual failure is attached as a suppressed
 * exception, in the order it happened.
 */
public class ShutdownException extends MessageStoreException {

    public ShutdownException(String message) {
        super(message);
    }

    public ShutdownException(String message, Throwable cause) {
        super(message, cause);
    }

    /** {@code null} when there is nothing to report. */
    public static ShutdownException aggregate(String message, List<? extends Throwable> failures) {
        if (failures == null || failures.isEmpty()) return null;
        ShutdownException ex = new ShutdownException(message + " (" + failures.size() + " failure(s))");
        failures.forEach(ex::addSuppressed);
        return ex;
    }
}
