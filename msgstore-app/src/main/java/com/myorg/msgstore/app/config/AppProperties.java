package com.myorg.msgstore.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "msgstore.app")
public class AppProperties {
    /** Budget for stopping every component, shared across all of them. */
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    /** Expose POST /api/v1/messages. */
    private boolean httpEnabled = true;
}
