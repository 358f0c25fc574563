package com.myorg.msgstore.contracts.core.exception;

/**
 * The broker could not be reached while starting up. Fatal to the consumption pipeline.
 */
public class BrokerConnectivityException extends MessageStoreException {

    private final String address;

    public BrokerConnectivityException(String network, String address, Throwable cause) {
        super("kafka: ensure connection failed: dial " + network + "://" + address, cause);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
