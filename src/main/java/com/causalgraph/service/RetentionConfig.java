package com.causalgraph.service;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the scheduled eviction job under {@code causal-graph.retention}.
 * The window itself is {@code causal-graph.store.retention-window}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal-graph.retention")
public class RetentionConfig {

    private boolean enabled = true;
    private Duration interval = Duration.ofMinutes(5);
}
