package com.myorg.msgstore.mongo;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "msgstore.mongo")
public class MongoStoreProperties {
    private boolean enabled = true;
    /** Collection the consumed payloads are written to. */
    private String collection = "messages";
    /**
     * Upper bound for finding a reachable server; bounds the startup ping and every write.
     */
    private Duration pingTimeout = Duration.ofSeconds(5);
}
