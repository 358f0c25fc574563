package com.myorg.msgstore.kafka.support;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.exception.PublishException;
import com.myorg.msgstore.contracts.core.exception.PublishFailure;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;
import com.myorg.msgstore.kafka.broker.BrokerReader;
import com.myorg.msgstore.kafka.broker.BrokerWriter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Partitioned log kept in memory: committed offsets per partition, readers with their own
 * positions, and failure injection for fetch, commit and write.
 */
public class InMemoryBroker implements BrokerWriter {

    private final String topic;
    private final List<List<BrokerMessage>> partitions = new ArrayList<>();
    private final Map<Integer, Long> committed = new ConcurrentHashMap<>();

    public final List<BrokerMessage> commitLog = new CopyOnWriteArrayList<>();
    public final List<BrokerMessage> fetchLog = new CopyOnWriteArrayList<>();
    public final AtomicInteger fetchCalls = new AtomicInteger();
    public final AtomicInteger commitCalls = new AtomicInteger();
    public final AtomicInteger failNextFetches = new AtomicInteger();
    public final AtomicInteger failNextCommits = new AtomicInteger();
    public final AtomicInteger failNextWrites = new AtomicInteger();
    public final AtomicInteger writerCloses = new AtomicInteger();

    public InMemoryBroker(String topic, int partitionCount) {
        this.topic = topic;
        for (int i = 0; i < partitionCount; i++) {
            partitions.add(new ArrayList<>());
        }
    }

    public synchronized BrokerMessage append(int partition, String key, String payload) {
        List<BrokerMessage> log = partitions.get(partition);
        BrokerMessage m = new BrokerMessage(topic, partition, log.size(), key,
                payload.getBytes(StandardCharsets.UTF_8));
        log.add(m);
        notifyAll();
        return m;
    }

    /** Next offset to read for {@code partition} by a new reader; 0 when nothing is committed. */
    public long committedOffset(int partition) {
        return committed.getOrDefault(partition, 0L);
    }

    public synchronized List<BrokerMessage> messages(int partition) {
        return Collections.unmodifiableList(new ArrayList<>(partitions.get(partition)));
    }

    public Reader newReader() {
        return new Reader();
    }

    @Override
    public void writeOne(String topic, BrokerMessage message) throws PublishException {
        if (failNextWrites.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new PublishException(PublishFailure.BROKER_REJECTED, topic, new IllegalStateException("injected write failure"));
        }
        int partition = message.key() == null ? 0 : Math.floorMod(message.key().hashCode(), partitions.size());
        append(partition, message.key(), new String(message.payload(), StandardCharsets.UTF_8));
    }

    @Override
    public void close() {
        writerCloses.incrementAndGet();
    }

    private synchronized BrokerMessage next(Map<Integer, Long> position) {
        for (int p = 0; p < partitions.size(); p++) {
            long pos = position.computeIfAbsent(p, this::committedOffset);
            List<BrokerMessage> log = partitions.get(p);
            if (pos < log.size()) {
                position.put(p, pos + 1);
                return log.get((int) pos);
            }
        }
        return null;
    }

    public class Reader implements BrokerReader {

        private final Map<Integer, Long> position = new HashMap<>();
        public final AtomicInteger closeCount = new AtomicInteger();

        @Override
        public BrokerMessage fetchNext(CancellationSignal signal) {
            fetchCalls.incrementAndGet();
            if (failNextFetches.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("injected fetch failure");
            }
            while (true) {
                if (signal.isCancelled()) throw new CancellationException("fetch cancelled");
                BrokerMessage m = next(position);
                if (m != null) {
                    fetchLog.add(m);
                    return m;
                }
                synchronized (InMemoryBroker.this) {
                    try {
                        InMemoryBroker.this.wait(10);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CancellationException("interrupted");
                    }
                }
            }
        }

        @Override
        public void commit(BrokerMessage message, CancellationSignal signal) {
            commitCalls.incrementAndGet();
            if (signal.isCancelled()) throw new CancellationException("commit cancelled");
            if (failNextCommits.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("injected commit failure");
            }
            committed.merge(message.partition(), message.offset() + 1, Math::max);
            commitLog.add(message);
        }

        @Override
        public void rewind(BrokerMessage message) {
            synchronized (InMemoryBroker.this) {
                position.put(message.partition(), message.offset());
            }
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
        }
    }
}
