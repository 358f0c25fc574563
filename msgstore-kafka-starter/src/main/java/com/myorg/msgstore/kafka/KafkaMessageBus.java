package com.myorg.msgstore.kafka;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.exception.BrokerConnectivityException;
import com.myorg.msgstore.contracts.core.exception.MessageStoreException;
import com.myorg.msgstore.contracts.core.exception.ShutdownException;
import com.myorg.msgstore.contracts.core.lifecycle.Component;
import com.myorg.msgstore.kafka.broker.BrokerConnectivityProbe;
import com.myorg.msgstore.kafka.broker.BrokerReader;
import com.myorg.msgstore.kafka.broker.BrokerReaderFactory;
import com.myorg.msgstore.kafka.broker.BrokerWriter;
import com.myorg.msgstore.kafka.consume.ConsumerIdentity;
import com.myorg.msgstore.kafka.consume.ConsumptionLoop;
import com.myorg.msgstore.kafka.consume.DeliveryHandlerRegistry;
import com.myorg.msgstore.kafka.metrics.MessageStoreMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The Kafka side of the service as one lifecycle component.
 *
 * <p>start: probe the broker, then launch {@code consumer.concurrency} loops, each on its own
 * thread with its own reader. stop: cancel the loops, wait for them, close the writer.
 */
@Slf4j
public class KafkaMessageBus implements Component {

    private final KafkaProperties props;
    private final BrokerConnectivityProbe probe;
    private final BrokerReaderFactory readerFactory;
    private final BrokerWriter writer;
    private final DeliveryHandlerRegistry registry;
    private final MessageStoreMetrics metrics;

    private final List<ConsumptionLoop> loops = new ArrayList<>();
    private final List<Future<?>> running = new ArrayList<>();
    private ExecutorService executor;
    private CancellationSignal loopSignal;
    private boolean started;

    public KafkaMessageBus(KafkaProperties props,
                           BrokerConnectivityProbe probe,
                           BrokerReaderFactory readerFactory,
                           BrokerWriter writer,
                           DeliveryHandlerRegistry registry,
                           MessageStoreMetrics metrics) {
        this.props = props;
        this.probe = probe;
        this.readerFactory = readerFactory;
        this.writer = writer;
        this.registry = registry;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public synchronized void start(CancellationSignal signal) {
        if (started) {
            throw new IllegalStateException("kafka component already started");
        }
        try {
            probe.probe();
        } catch (BrokerConnectivityException e) {
            log.error("Kafka connection failed network={} address={}", props.getNetwork(), props.getAddress());
            throw e;
        }

        if (props.getConsumer().isEnabled()) {
            if (props.getTopic() == null || props.getTopic().isBlank()) {
                throw new MessageStoreException("msgstore.kafka.topic is required when the consumer is enabled");
            }
            startLoops(signal);
        }
        started = true;

        log.info("Connected to Kafka network={} address={} group_id={} topic={} loops={}",
                props.getNetwork(), props.getAddress(), props.getGroupId(), props.getTopic(), loops.size());
    }

    private void startLoops(CancellationSignal signal) {
        loopSignal = CancellationSignal.linkedTo(signal);
        int concurrency = Math.max(1, props.getConsumer().getConcurrency());
        AtomicInteger seq = new AtomicInteger();
        String topic = props.getTopic();
        executor = Executors.newFixedThreadPool(concurrency,
                r -> new Thread(r, "msgstore-consumer-" + topic + "-" + seq.incrementAndGet()));

        ConsumerIdentity identity = new ConsumerIdentity(props.getAddress(), topic, props.getGroupId());
        try {
            for (int i = 0; i < concurrency; i++) {
                BrokerReader reader = readerFactory.create();
                ConsumptionLoop loop = new ConsumptionLoop(identity, reader, registry,
                        props.getFetchBackoff().toPolicy(), props.getCommitBackoff().toPolicy(),
                        loopSignal, metrics);
                loops.add(loop);
                running.add(executor.submit(loop));
            }
        } catch (RuntimeException e) {
            // loops already submitted close their own readers on the way out
            loopSignal.cancel();
            executor.shutdown();
            throw new MessageStoreException("failed to create Kafka consumer for topic " + topic, e);
        }
    }

    @Override
    public synchronized void stop(Duration timeout) throws ShutdownException {
        List<Throwable> failures = new ArrayList<>();

        if (executor != null) {
            loopSignal.cancel();
            executor.shutdown();
            try {
                if (!executor.awaitTermination(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                    failures.add(new ShutdownException("kafka: consumer loops did not stop within " + timeout));
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(new ShutdownException("kafka: interrupted while waiting for consumer loops", e));
                executor.shutdownNow();
            }
            collectLoopFailures(failures);
        }

        try {
            writer.close();
        } catch (RuntimeException e) {
            log.error("Failed to close Kafka producer connection address={}", props.getAddress(), e);
            failures.add(e);
        }

        ShutdownException aggregated = ShutdownException.aggregate("kafka: stop failed", failures);
        if (aggregated != null) throw aggregated;
        log.info("Kafka connections closed address={} topic={}", props.getAddress(), props.getTopic());
    }

    public List<ConsumptionLoop> loops() {
        return List.copyOf(loops);
    }

    private void collectLoopFailures(List<Throwable> failures) {
        for (Future<?> f : running) {
            if (!f.isDone()) continue;
            try {
                f.get();
            } catch (ExecutionException e) {
                failures.add(e.getCause() == null ? e : e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(e);
            } catch (java.util.concurrent.CancellationException e) {
                failures.add(e);
            }
        }
        for (ConsumptionLoop loop : loops) {
            if (loop.closeFailure() != null) failures.add(loop.closeFailure());
        }
    }
}
