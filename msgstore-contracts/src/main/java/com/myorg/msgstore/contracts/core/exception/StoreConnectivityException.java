package com.myorg.msgstore.contracts.core.exception;

public class StoreConnectivityException extends MessageStoreException {
    public StoreConnectivityException(String message, Throwable cause) { super(message, cause); }
}
