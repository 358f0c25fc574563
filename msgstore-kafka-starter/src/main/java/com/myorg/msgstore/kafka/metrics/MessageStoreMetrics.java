package com.myorg.msgstore.kafka.metrics;

import com.myorg.msgstore.contracts.core.exception.PublishFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

/**
 * Counters of the consumption pipeline and the publish path, tagged with the topic.
 */
@RequiredArgsConstructor
public class MessageStoreMetrics {

    public static final String FETCH_FAILED = "msgstore.consume.fetch.failed";
    public static final String DISPATCH_FAILED = "msgstore.consume.dispatch.failed";
    public static final String COMMIT_RETRY = "msgstore.consume.commit.retry";
    public static final String COMMIT_FAILED = "msgstore.consume.commit.failed";
    public static final String COMMITTED = "msgstore.consume.committed";
    public static final String PUBLISH_SUCCESS = "msgstore.publish.success";
    public static final String PUBLISH_FAILED = "msgstore.publish.failed";

    private final MeterRegistry registry;
    private final String topic;

    // Pre-created base meters (so actuator never 404)
    private Counter cFetchFailed;
    private Counter cDispatchFailed;
    private Counter cCommitRetry;
    private Counter cCommitFailed;
    private Counter cCommitted;
    private Counter cPublished;

    /** Call once on startup. */
    public void preRegisterBaseMeters() {
        cFetchFailed    = Counter.builder(FETCH_FAILED).tag("topic", tagValue(topic)).register(registry);
        cDispatchFailed = Counter.builder(DISPATCH_FAILED).tag("topic", tagValue(topic)).register(registry);
        cCommitRetry    = Counter.builder(COMMIT_RETRY).tag("topic", tagValue(topic)).register(registry);
        cCommitFailed   = Counter.builder(COMMIT_FAILED).tag("topic", tagValue(topic)).register(registry);
        cCommitted      = Counter.builder(COMMITTED).tag("topic", tagValue(topic)).register(registry);
        cPublished      = Counter.builder(PUBLISH_SUCCESS).tag("topic", tagValue(topic)).register(registry);
    }

    public void incFetchFailed()    { if (cFetchFailed != null) cFetchFailed.increment(); }
    public void incDispatchFailed() { if (cDispatchFailed != null) cDispatchFailed.increment(); }
    public void incCommitRetry()    { if (cCommitRetry != null) cCommitRetry.increment(); }
    public void incCommitFailed()   { if (cCommitFailed != null) cCommitFailed.increment(); }
    public void incCommitted()      { if (cCommitted != null) cCommitted.increment(); }

    /** Publishes may target any topic, so these are looked up per call. */
    public void incPublished(String publishTopic) {
        if (topic != null && topic.equals(publishTopic) && cPublished != null) {
            cPublished.increment();
            return;
        }
        registry.counter(PUBLISH_SUCCESS, "topic", tagValue(publishTopic)).increment();
    }

    public void incPublishFailed(String publishTopic, PublishFailure reason) {
        registry.counter(PUBLISH_FAILED,
                "topic", tagValue(publishTopic),
                "reason", reason == null ? PublishFailure.UNKNOWN.name() : reason.name()).increment();
    }

    private static String tagValue(String v) {
        return v == null || v.isBlank() ? "unknown" : v;
    }
}
