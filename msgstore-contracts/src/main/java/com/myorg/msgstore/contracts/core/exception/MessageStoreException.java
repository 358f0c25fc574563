package com.myorg.msgstore.contracts.core.exception;

public class MessageStoreException extends RuntimeException {
    public MessageStoreException(String message) { super(message); }
    public MessageStoreException(String message, Throwable cause) { super(message, cause); }
}
