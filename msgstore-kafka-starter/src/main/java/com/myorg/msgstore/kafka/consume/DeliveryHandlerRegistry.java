package com.myorg.msgstore.kafka.consume;

import com.myorg.msgstore.contracts.core.delivery.DeliveryHandler;
import com.myorg.msgstore.contracts.core.delivery.DeliveryResult;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered set of handlers fed with every consumed message.
 *
 * <p>Open for registration until the first consumption loop starts, then sealed. Every handler
 * runs for every message, even after an earlier one failed; the first failure is the result.
 */
@Slf4j
public class DeliveryHandlerRegistry {

    private final List<DeliveryHandler> handlers = new CopyOnWriteArrayList<>();
    private volatile boolean sealed;

    /** Appends {@code handler}; {@code null} is ignored. */
    public void register(DeliveryHandler handler) {
        if (handler == null) return;
        if (sealed) {
            throw new IllegalStateException("handler registry is sealed: consumption already started");
        }
        handlers.add(handler);
    }

    public DeliveryResult dispatch(BrokerMessage message) {
        DeliveryResult first = null;
        for (DeliveryHandler handler : handlers) {
            DeliveryResult result = invoke(handler, message);
            if (result.isSuccess()) continue;

            if (first == null) {
                first = result;
            } else {
                log.warn("additional handler failure topic={} offset={} handler={} err={}",
                        message.topic(), message.offset(), handler.getClass().getName(), result.cause().toString());
            }
        }
        return first == null ? DeliveryResult.success() : first;
    }

    void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public List<DeliveryHandler> handlers() {
        return Collections.unmodifiableList(handlers);
    }

    private static DeliveryResult invoke(DeliveryHandler handler, BrokerMessage message) {
        try {
            // each handler gets its own copy of the payload
            DeliveryResult r = handler.handle(message.payload());
            return r == null ? DeliveryResult.failure("handler " + handler.getClass().getName() + " returned no result") : r;
        } catch (RuntimeException e) {
            return DeliveryResult.failure(e);
        }
    }
}
