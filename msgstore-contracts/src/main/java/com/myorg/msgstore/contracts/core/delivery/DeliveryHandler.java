package com.myorg.msgstore.contracts.core.delivery;

/**
 * A side effect run for every consumed payload (persist, index, count...).
 *
 * <p>Handlers run on the consumer thread of the partition they serve: a slow handler stalls that
 * partition. Keep them fast or hand work off internally.
 */
@FunctionalInterface
public interface DeliveryHandler {

    DeliveryResult handle(byte[] payload);
}
