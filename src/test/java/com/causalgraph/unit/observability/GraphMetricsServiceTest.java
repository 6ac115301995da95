package com.causalgraph.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.enums.RelationKind;
import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.event.AnalyticsEvent;
import com.causalgraph.event.AnalyticsEventType;
import com.causalgraph.event.EntityEvent;
import com.causalgraph.event.EntityEventType;
import com.causalgraph.event.RelationEvent;
import com.causalgraph.event.RelationEventType;
import com.causalgraph.graph.TemporalGraph;
import com.causalgraph.observability.GraphMetricsService;
import com.causalgraph.service.TemporalGraphService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for GraphMetricsService.
 *
 * <p>Uses SimpleMeterRegistry to verify that counters, timers and gauges are registered and
 * updated correctly in response to graph events.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GraphMetricsServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @Mock
    private TemporalGraph temporalGraph;

    @Mock
    private TemporalGraphService temporalGraphService;

    private MeterRegistry meterRegistry;
    private GraphMetricsService graphMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(temporalGraph.entityCount()).thenReturn(12);
        when(temporalGraph.relationCount()).thenReturn(5);
        when(temporalGraphService.currentChains()).thenReturn(List.of(
                CausalChain.builder().id("c1").entities(List.of("a", "b")).build()));
        when(temporalGraphService.currentPatterns()).thenReturn(List.of());
        when(temporalGraphService.getCausalInferenceCount()).thenReturn(3L);
        graphMetricsService = new GraphMetricsService(meterRegistry, temporalGraph, temporalGraphService);
    }

    private static TemporalEntity entity(String id) {
        return TemporalEntity.builder().id(id).kind(EntityKind.NEWS_EVENT).timestamp(T0).confidence(1.0).build();
    }

    private static TemporalRelation relation(String id) {
        return TemporalRelation.builder()
                .id(id)
                .sourceEntity("a")
                .targetEntity("b")
                .kind(RelationKind.CAUSES)
                .startTime(T0)
                .strength(0.9)
                .confidence(0.9)
                .build();
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("entity events increment the ingested and evicted counters")
        void entityCounters() {
            graphMetricsService.onEntityEvent(new EntityEvent(this, "a", entity("a"), EntityEventType.ADDED));
            graphMetricsService.onEntityEvent(new EntityEvent(this, "b", entity("b"), EntityEventType.ADDED));
            graphMetricsService.onEntityEvent(new EntityEvent(this, "a", null, EntityEventType.EVICTED));

            assertThat(meterRegistry.get("graph.entities.ingested").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("graph.entities.evicted").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("relation events increment the added and removed counters")
        void relationCounters() {
            graphMetricsService.onRelationEvent(new RelationEvent(this, relation("r1"), RelationEventType.ADDED));
            graphMetricsService.onRelationEvent(new RelationEvent(this, relation("r1"), RelationEventType.REMOVED));

            assertThat(meterRegistry.get("graph.relations.added").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("graph.relations.removed").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("analytics events count results and record duration per type")
        void analyticsMetrics() {
            graphMetricsService.onAnalyticsEvent(new AnalyticsEvent(
                    this, AnalyticsEventType.HYPOTHESES_DISCOVERED, List.of("h1", "h2", "h3"), Duration.ofMillis(40), 1));

            assertThat(meterRegistry.get("graph.analytics.results").tag("type", "hypotheses_discovered")
                    .counter().count()).isEqualTo(3.0);
            assertThat(meterRegistry.get("graph.analytics.results").tag("type", "chains_built")
                    .counter().count()).isZero();
            Timer timer = meterRegistry.get("graph.analytics.duration").tag("type", "hypotheses_discovered").timer();
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
        }
    }

    @Nested
    @DisplayName("Gauges")
    class Gauges {

        @Test
        @DisplayName("gauges read the live graph and the published analytics results")
        void gauges() {
            assertThat(meterRegistry.get("graph.entities").gauge().value()).isEqualTo(12.0);
            assertThat(meterRegistry.get("graph.relations").gauge().value()).isEqualTo(5.0);
            assertThat(meterRegistry.get("graph.chains").gauge().value()).isEqualTo(1.0);
            assertThat(meterRegistry.get("graph.patterns").gauge().value()).isZero();
            assertThat(meterRegistry.get("graph.causal.inferences").gauge().value()).isEqualTo(3.0);
        }
    }
}
