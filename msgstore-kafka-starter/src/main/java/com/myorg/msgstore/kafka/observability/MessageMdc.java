package com.myorg.msgstore.kafka.observability;

import com.myorg.msgstore.contracts.core.message.BrokerMessage;
import org.slf4j.MDC;

public final class MessageMdc {

    public static final String TOPIC = "topic";
    public static final String PARTITION = "partition";
    public static final String OFFSET = "offset";

    private MessageMdc() {
    }

    public static void put(BrokerMessage m) {
        if (m == null) return;
        MDC.put(TOPIC, m.topic());
        if (m.partition() != BrokerMessage.UNASSIGNED) MDC.put(PARTITION, String.valueOf(m.partition()));
        if (m.offset() != BrokerMessage.UNASSIGNED) MDC.put(OFFSET, String.valueOf(m.offset()));
    }

    public static void clear() {
        MDC.remove(TOPIC);
        MDC.remove(PARTITION);
        MDC.remove(OFFSET);
    }
}
