package com.myorg.msgstore.kafka;

import com.myorg.msgstore.retry.RetryPolicy;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
// binds msgstore.kafka.* ; defaults are safe for a single local broker
@ConfigurationProperties(prefix = "msgstore.kafka")
public class KafkaProperties {
    /** host:port list of the brokers. */
    private String address = "localhost:9092";
    /** Transport name, only used for logging/identification. */
    private String network = "tcp";
    private String topic;
    private String groupId;
    private Duration probeTimeout = Duration.ofSeconds(5);

    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    /** Pacing between failed fetches. Attempts are ignored: fetching never gives up. */
    private final Retry fetchBackoff = new Retry(0);
    /** Bounded retry of offset commits. */
    private final Retry commitBackoff = new Retry(3);

    @Data
    public static class Producer {
        private String acks = "all";
        private boolean idempotence = true;
        private int retries = 10;
        private int lingerMs = 5;
        private int batchSize = 65536;
        private Duration sendTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Consumer {
        private boolean enabled = true;
        /**
         * Kafka consumer auto.offset.reset (earliest/latest/none).
         */
        private String autoOffsetReset = "earliest";
        /** Number of independent consumption loops; effective max is the partition count. */
        private int concurrency = 1;
        private int maxPollRecords = 500;
        private Duration pollTimeout = Duration.ofMillis(500);
        private Duration commitTimeout = Duration.ofSeconds(5);
    }

    @Data
    @NoArgsConstructor
    public static class Retry {
        private int attempts = 3;
        private Duration initial = RetryPolicy.DEFAULT_INITIAL;
        private Duration max = RetryPolicy.DEFAULT_MAX;
        private double factor = RetryPolicy.DEFAULT_FACTOR;
        private boolean jitter = true;

        Retry(int attempts) {
            this.attempts = attempts;
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(attempts, initial, max, factor, jitter).sanitized();
        }
    }
}
