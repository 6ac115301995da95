package com.causalgraph.observability;

import com.causalgraph.event.AnalyticsEvent;
import com.causalgraph.event.AnalyticsEventType;
import com.causalgraph.event.EntityEvent;
import com.causalgraph.event.EntityEventType;
import com.causalgraph.event.RelationEvent;
import com.causalgraph.event.RelationEventType;
import com.causalgraph.graph.TemporalGraph;
import com.causalgraph.service.TemporalGraphService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the graph's Micrometer meters.
 * <ul>
 *   <li><b>graph.entities.ingested</b> / <b>graph.entities.evicted</b> (counters)</li>
 *   <li><b>graph.relations.added</b> / <b>graph.relations.removed</b> (counters)</li>
 *   <li><b>graph.analytics.results</b> (counter, tagged by run type): items each run produced</li>
 *   <li><b>graph.analytics.duration</b> (timer, tagged by run type)</li>
 *   <li><b>graph.entities</b>, <b>graph.relations</b>, <b>graph.chains</b>, <b>graph.patterns</b>,
 *       <b>graph.causal.inferences</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are polled by Micrometer at scrape time. Counters and timers are driven by the
 * graph's application events.
 */
@Service
public class GraphMetricsService {

    private final Counter entitiesIngestedCounter;
    private final Counter entitiesEvictedCounter;
    private final Counter relationsAddedCounter;
    private final Counter relationsRemovedCounter;
    private final Map<AnalyticsEventType, Counter> analyticsResultCounters = new EnumMap<>(AnalyticsEventType.class);
    private final Map<AnalyticsEventType, Timer> analyticsTimers = new EnumMap<>(AnalyticsEventType.class);

    public GraphMetricsService(
            MeterRegistry meterRegistry, TemporalGraph temporalGraph, TemporalGraphService temporalGraphService) {
        this.entitiesIngestedCounter = Counter.builder("graph.entities.ingested")
                .description("Entities accepted into the store")
                .register(meterRegistry);
        this.entitiesEvictedCounter = Counter.builder("graph.entities.evicted")
                .description("Entities removed by retention or the capacity cap")
                .register(meterRegistry);
        this.relationsAddedCounter = Counter.builder("graph.relations.added")
                .description("Relations added by clients or hypothesis promotion")
                .register(meterRegistry);
        this.relationsRemovedCounter = Counter.builder("graph.relations.removed")
                .description("Relations dropped by eviction cascade")
                .register(meterRegistry);

        for (AnalyticsEventType type : AnalyticsEventType.values()) {
            String tag = type.name().toLowerCase();
            analyticsResultCounters.put(type, Counter.builder("graph.analytics.results")
                    .description("Items produced by analytics runs")
                    .tag("type", tag)
                    .register(meterRegistry));
            analyticsTimers.put(type, Timer.builder("graph.analytics.duration")
                    .description("Wall time of analytics runs")
                    .tag("type", tag)
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .maximumExpectedValue(Duration.ofSeconds(30))
                    .register(meterRegistry));
        }

        meterRegistry.gauge("graph.entities", temporalGraph, TemporalGraph::entityCount);
        meterRegistry.gauge("graph.relations", temporalGraph, TemporalGraph::relationCount);
        meterRegistry.gauge("graph.chains", temporalGraphService, service -> service.currentChains().size());
        meterRegistry.gauge("graph.patterns", temporalGraphService, service -> service.currentPatterns().size());
        meterRegistry.gauge(
                "graph.causal.inferences", temporalGraphService, TemporalGraphService::getCausalInferenceCount);
    }

    @EventListener
    @Order(20)
    public void onEntityEvent(EntityEvent event) {
        if (event.getEventType() == EntityEventType.ADDED) {
            entitiesIngestedCounter.increment();
        } else if (event.getEventType() == EntityEventType.EVICTED) {
            entitiesEvictedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRelationEvent(RelationEvent event) {
        if (event.getEventType() == RelationEventType.ADDED) {
            relationsAddedCounter.increment();
        } else if (event.getEventType() == RelationEventType.REMOVED) {
            relationsRemovedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onAnalyticsEvent(AnalyticsEvent event) {
        analyticsResultCounters.get(event.getEventType()).increment(event.getResultCount());
        analyticsTimers.get(event.getEventType()).record(event.getElapsed());
    }
}
