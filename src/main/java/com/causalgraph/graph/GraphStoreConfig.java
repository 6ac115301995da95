package com.causalgraph.graph;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the in-memory graph under the {@code causal-graph.store} prefix.
 *
 * <ul>
 *   <li>{@code retentionWindow} -- entities older than now minus this window are evicted (default 30 days)</li>
 *   <li>{@code maxEntities} -- hard cap; the oldest entities are evicted after an insert that exceeds it</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal-graph.store")
public class GraphStoreConfig {

    private Duration retentionWindow = Duration.ofDays(30);
    private int maxEntities = 10_000;
}
