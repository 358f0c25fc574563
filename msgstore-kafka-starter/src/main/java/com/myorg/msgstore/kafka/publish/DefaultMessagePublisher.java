package com.myorg.msgstore.kafka.publish;

import com.myorg.msgstore.contracts.core.exception.PublishException;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;
import com.myorg.msgstore.kafka.broker.BrokerWriter;
import com.myorg.msgstore.kafka.metrics.MessageStoreMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

@Slf4j
@RequiredArgsConstructor
public class DefaultMessagePublisher implements MessagePublisher {

    private final BrokerWriter writer;
    private final String defaultTopic;
    /** nullable */
    private final MessageStoreMetrics metrics;

    @Override
    public void publish(String topic, String key, byte[] payload) throws PublishException {
        String target = StringUtils.hasText(topic) ? topic : defaultTopic;
        if (!StringUtils.hasText(target)) {
            throw new IllegalArgumentException("no topic given and msgstore.kafka.topic is not set");
        }

        BrokerMessage message = BrokerMessage.outgoing(target, key, payload);
        try {
            writer.writeOne(target, message);
        } catch (PublishException e) {
            if (metrics != null) metrics.incPublishFailed(target, e.getFailure());
            log.error("Failed to write message to Kafka topic={} key={} size={} reason={}",
                    target, key, message.size(), e.getFailure(), e);
            throw e;
        }
        if (metrics != null) metrics.incPublished(target);
        log.debug("message published topic={} key={} size={}", target, key, message.size());
    }
}
