package com.myorg.msgstore.kafka.broker;

import com.myorg.msgstore.contracts.core.exception.BrokerConnectivityException;

@FunctionalInterface
public interface BrokerConnectivityProbe {

    /**
     * Open a connection to the configured address and close it again.
     */
    void probe() throws BrokerConnectivityException;
}
