package com.myorg.msgstore.kafka.consume;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.delivery.DeliveryResult;
import com.myorg.msgstore.contracts.core.message.BrokerMessage;
import com.myorg.msgstore.kafka.broker.BrokerReader;
import com.myorg.msgstore.kafka.metrics.MessageStoreMetrics;
import com.myorg.msgstore.kafka.observability.MessageMdc;
import com.myorg.msgstore.retry.Backoff;
import com.myorg.msgstore.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetch, dispatch, commit; one message at a time.
 *
 * <p>Guarantees, per loop instance:
 * <ul>
 *   <li>an offset is committed only after every handler succeeded for it (at-least-once);</li>
 *   <li>message N is dispatched and its commit decided before N+1 is fetched;</li>
 *   <li>a message that fails dispatch, or whose commit is never acknowledged, is fetched again;</li>
 *   <li>the reader is closed exactly once, whatever the exit path.</li>
 * </ul>
 * Fetch failures are retried forever, paced by the fetch policy. Commit failures are retried up to
 * the commit policy's attempts, each message starting from a fresh backoff.
 */
@Slf4j
public class ConsumptionLoop implements Runnable {

    public enum State { CREATED, FETCHING, DISPATCHING, COMMITTING, STOPPED }

    private final ConsumerIdentity identity;
    private final BrokerReader reader;
    private final DeliveryHandlerRegistry registry;
    private final RetryPolicy fetchPolicy;
    private final RetryPolicy commitPolicy;
    private final CancellationSignal signal;
    private final MessageStoreMetrics metrics;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile State state = State.CREATED;
    private volatile RuntimeException closeFailure;

    public ConsumptionLoop(ConsumerIdentity identity,
                           BrokerReader reader,
                           DeliveryHandlerRegistry registry,
                           RetryPolicy fetchPolicy,
                           RetryPolicy commitPolicy,
                           CancellationSignal signal,
                           MessageStoreMetrics metrics) {
        this.identity = identity;
        this.reader = reader;
        this.registry = registry;
        this.fetchPolicy = fetchPolicy;
        this.commitPolicy = commitPolicy;
        this.signal = signal;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("consumption loop already started");
        }
        registry.seal();
        Backoff fetchBackoff = new Backoff(fetchPolicy);
        try {
            while (!signal.isCancelled()) {
                state = State.FETCHING;
                BrokerMessage message;
                try {
                    message = reader.fetchNext(signal);
                } catch (CancellationException e) {
                    log.debug("Kafka consumer fetch cancelled topic={}", identity.topic());
                    return;
                } catch (RuntimeException e) {
                    if (metrics != null) metrics.incFetchFailed();
                    log.error("Kafka consumer fetch failed address={} topic={} group={} backoff={}",
                            identity.address(), identity.topic(), identity.groupId(), fetchBackoff.currentDelay(), e);
                    if (fetchBackoff.advanceAndWait(signal)) return;
                    continue;
                }
                fetchBackoff.reset();

                state = State.DISPATCHING;
                DeliveryResult result = dispatch(message);
                if (result.isFailure()) {
                    if (metrics != null) metrics.incDispatchFailed();
                    log.error("Delivery failed, message will be redelivered topic={} partition={} offset={}",
                            message.topic(), message.partition(), message.offset(), result.cause());
                    redeliver(message);
                    continue;
                }

                state = State.COMMITTING;
                try {
                    commit(message);
                } catch (CancellationException e) {
                    log.debug("Kafka consumer commit cancelled topic={} offset={}", message.topic(), message.offset());
                    return;
                } catch (CommitRetriesExhaustedException e) {
                    if (metrics != null) metrics.incCommitFailed();
                    log.error("Kafka consumer commit failed topic={} partition={} offset={} attempts={}",
                            message.topic(), message.partition(), message.offset(), e.getAttempts(), e);
                    redeliver(message);
                }
            }
            log.debug("Kafka consumer stopped topic={}", identity.topic());
        } finally {
            state = State.STOPPED;
            closeReader();
        }
    }

    public State state() {
        return state;
    }

    /** Failure raised while closing the reader on exit, or {@code null}. */
    public RuntimeException closeFailure() {
        return closeFailure;
    }

    private DeliveryResult dispatch(BrokerMessage message) {
        MessageMdc.put(message);
        try {
            return registry.dispatch(message);
        } finally {
            MessageMdc.clear();
        }
    }

    private void commit(BrokerMessage message) {
        // zero or negative attempts still means one try
        int attempts = Math.max(1, commitPolicy.attempts());
        Backoff backoff = new Backoff(commitPolicy);
        RuntimeException last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (signal.isCancelled()) throw new CancellationException("commit cancelled");
            try {
                reader.commit(message, signal);
                if (metrics != null) metrics.incCommitted();
                log.debug("Kafka message committed topic={} partition={} offset={}",
                        message.topic(), message.partition(), message.offset());
                return;
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                log.warn("Kafka consumer commit attempt failed topic={} offset={} attempt={}/{} err={}",
                        message.topic(), message.offset(), attempt, attempts, e.toString());
                if (attempt < attempts) {
                    if (metrics != null) metrics.incCommitRetry();
                    if (backoff.advanceAndWait(signal)) throw new CancellationException("commit cancelled");
                }
            }
        }
        throw new CommitRetriesExhaustedException(message, attempts, last);
    }

    private void redeliver(BrokerMessage message) {
        try {
            reader.rewind(message);
        } catch (RuntimeException e) {
            log.warn("rewind failed topic={} partition={} offset={}: {}",
                    message.topic(), message.partition(), message.offset(), e.toString());
        }
    }

    private void closeReader() {
        try {
            reader.close();
        } catch (RuntimeException e) {
            closeFailure = e;
            log.error("Failed to close Kafka consumer connection topic={} group={}",
                    identity.topic(), identity.groupId(), e);
        }
    }
}
