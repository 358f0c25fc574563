package com.myorg.msgstore.kafka.broker;

import com.myorg.msgstore.contracts.core.exception.PublishException;
import com.myorg.msgstore.contracts.core.exception.PublishFailure;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.ApiException;
import org.apache.kafka.common.errors.SerializationException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Synchronous {@link BrokerWriter} over {@link KafkaTemplate}: waits for the broker ack up to
 * {@code sendTimeout} and classifies whatever went wrong.
 */
@Slf4j
public class KafkaTemplateBrokerWriter implements BrokerWriter {

    private final KafkaTemplate<String, byte[]> template;
    private final Duration sendTimeout;

    public KafkaTemplateBrokerWriter(KafkaTemplate<String, byte[]> template, Duration sendTimeout) {
        this.template = template;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void writeOne(String topic, BrokerMessage message) throws PublishException {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, message.key(), message.payload());
        try {
            template.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new PublishException(PublishFailure.TIMEOUT, topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(PublishFailure.INTERRUPTED, topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new PublishException(classify(cause), topic, cause);
        } catch (KafkaException e) {
            // serializer and metadata failures surface synchronously from send()
            throw new PublishException(classify(e), topic, e);
        }
    }

    /** Flush pending sends and drop the cached producer. */
    @Override
    public void close() {
        template.flush();
        template.getProducerFactory().reset();
    }

    static PublishFailure classify(Throwable t) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(t);
        if (root instanceof SerializationException) return PublishFailure.SERIALIZATION;
        if (root instanceof org.apache.kafka.common.errors.TimeoutException) return PublishFailure.TIMEOUT;
        if (root instanceof org.apache.kafka.common.errors.InterruptException
                || root instanceof InterruptedException) return PublishFailure.INTERRUPTED;
        if (root instanceof ApiException || root instanceof KafkaException) return PublishFailure.BROKER_REJECTED;
        return PublishFailure.UNKNOWN;
    }
}
