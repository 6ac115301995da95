package com.causalgraph.archive;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for write-behind persistence under {@code causal-graph.archive}.
 *
 * <ul>
 *   <li>{@code enabled} -- when false nothing is queued</li>
 *   <li>{@code flushInterval} -- schedule of the batch flush</li>
 *   <li>{@code batchSize} -- max rows per table per flush</li>
 *   <li>{@code failureThreshold} -- consecutive failed flushes that open the circuit</li>
 *   <li>{@code recoveryInterval} -- how long an open circuit skips flushes</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal-graph.archive")
public class ArchiveConfig {

    private boolean enabled = true;
    private Duration flushInterval = Duration.ofSeconds(5);
    private int batchSize = 200;
    private int failureThreshold = 3;
    private Duration recoveryInterval = Duration.ofMinutes(1);
}
