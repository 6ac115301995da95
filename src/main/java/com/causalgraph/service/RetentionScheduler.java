package com.causalgraph.service;

import com.causalgraph.graph.EvictionResult;
import com.causalgraph.graph.GraphStoreConfig;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts entities older than the retention window on a fixed delay.
 *
 * <p>The store only exposes {@code evictBefore(cutoff)}; choosing when to call it is this
 * job's concern. Disabled with {@code causal-graph.retention.enabled=false}.
 */
@Component
@EnableConfigurationProperties(RetentionConfig.class)
public class RetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetentionScheduler.class);

    private final TemporalGraphService temporalGraphService;
    private final GraphStoreConfig graphStoreConfig;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    public RetentionScheduler(
            TemporalGraphService temporalGraphService,
            GraphStoreConfig graphStoreConfig,
            RetentionConfig retentionConfig,
            Clock clock) {
        this.temporalGraphService = temporalGraphService;
        this.graphStoreConfig = graphStoreConfig;
        this.retentionConfig = retentionConfig;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${causal-graph.retention.interval:PT5M}",
            initialDelayString = "${causal-graph.retention.interval:PT5M}")
    public void evictExpired() {
        if (!retentionConfig.isEnabled()) {
            return;
        }
        Instant cutoff = clock.instant().minus(graphStoreConfig.getRetentionWindow());
        EvictionResult result = temporalGraphService.evictBefore(cutoff);
        if (result.isEmpty()) {
            log.debug("Retention sweep: nothing older than {}", cutoff);
        }
    }
}
