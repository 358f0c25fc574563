package com.myorg.msgstore.kafka.broker;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BrokerReader} over a Kafka {@link Consumer} with auto-commit disabled.
 *
 * <p>{@code poll()} hands out batches; they are buffered here and handed to the loop one record at
 * a time. The buffer of a partition is dropped when it is rewound or revoked.
 */
@Slf4j
public class KafkaBrokerReader implements BrokerReader {

    private final Consumer<String, byte[]> consumer;
    private final Duration pollTimeout;
    private final Duration commitTimeout;
    private final Deque<ConsumerRecord<String, byte[]>> buffer = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private CancellationSignal wired;

    public KafkaBrokerReader(Consumer<String, byte[]> consumer, Duration pollTimeout, Duration commitTimeout) {
        this.consumer = consumer;
        this.pollTimeout = pollTimeout;
        this.commitTimeout = commitTimeout;
    }

    /** Reader subscribed to {@code topic} through the consumer group of {@code consumer}. */
    public static KafkaBrokerReader subscribe(Consumer<String, byte[]> consumer, String topic,
                                              Duration pollTimeout, Duration commitTimeout) {
        KafkaBrokerReader reader = new KafkaBrokerReader(consumer, pollTimeout, commitTimeout);
        consumer.subscribe(List.of(topic), reader.new DropBufferOnRevoke());
        return reader;
    }

    @Override
    public BrokerMessage fetchNext(CancellationSignal signal) {
        wire(signal);
        while (buffer.isEmpty()) {
            if (signal.isCancelled()) {
                throw new CancellationException("fetch cancelled");
            }
            ConsumerRecords<String, byte[]> records;
            try {
                records = consumer.poll(pollTimeout);
            } catch (WakeupException | InterruptException e) {
                if (signal.isCancelled() || e instanceof InterruptException) {
                    throw cancelled("fetch cancelled", e);
                }
                continue;
            }
            records.forEach(buffer::addLast);
        }

        ConsumerRecord<String, byte[]> r = buffer.pollFirst();
        log.debug("message received topic={} partition={} offset={} size={}",
                r.topic(), r.partition(), r.offset(), r.value() == null ? 0 : r.value().length);
        return new BrokerMessage(r.topic(), r.partition(), r.offset(), r.key(), r.value());
    }

    @Override
    public void commit(BrokerMessage message, CancellationSignal signal) {
        wire(signal);
        if (signal.isCancelled()) {
            throw new CancellationException("commit cancelled");
        }
        TopicPartition tp = new TopicPartition(message.topic(), message.partition());
        try {
            // committed offset = next offset to read
            consumer.commitSync(Map.of(tp, new OffsetAndMetadata(message.offset() + 1)), commitTimeout);
        } catch (WakeupException | InterruptException e) {
            if (signal.isCancelled() || e instanceof InterruptException) {
                throw cancelled("commit cancelled", e);
            }
            throw e;
        }
    }

    @Override
    public void rewind(BrokerMessage message) {
        TopicPartition tp = new TopicPartition(message.topic(), message.partition());
        dropBuffered(List.of(tp));
        try {
            consumer.seek(tp, message.offset());
        } catch (IllegalStateException e) {
            // partition no longer assigned: its new owner resumes from the committed offset
            log.warn("rewind skipped topic={} partition={} offset={}: {}",
                    tp.topic(), tp.partition(), message.offset(), e.getMessage());
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        buffer.clear();
        consumer.close();
    }

    private void wire(CancellationSignal signal) {
        if (signal != null && signal != wired) {
            // wakeup() is the only Consumer method that is safe to call from another thread
            signal.onCancel(consumer::wakeup);
            wired = signal;
        }
    }

    private void dropBuffered(Collection<TopicPartition> partitions) {
        buffer.removeIf(r -> partitions.contains(new TopicPartition(r.topic(), r.partition())));
    }

    private static CancellationException cancelled(String message, Throwable cause) {
        CancellationException ex = new CancellationException(message);
        ex.initCause(cause);
        return ex;
    }

    private class DropBufferOnRevoke implements ConsumerRebalanceListener {
        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            dropBuffered(partitions);
            log.debug("partitions revoked {}", partitions);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.debug("partitions assigned {}", partitions);
        }
    }
}
