package com.causalgraph.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;

import com.causalgraph.archive.ArchiveConfig;
import com.causalgraph.archive.GraphArchiveService;
import com.causalgraph.chain.ChainBuilder;
import com.causalgraph.chain.ChainBuilderConfig;
import com.causalgraph.discovery.CausalDiscoveryEngine;
import com.causalgraph.discovery.DiscoveryConfig;
import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.enums.RelationKind;
import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.CausalHypothesis;
import com.causalgraph.domain.model.GraphStats;
import com.causalgraph.domain.model.Prediction;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalPattern;
import com.causalgraph.event.AnalyticsEvent;
import com.causalgraph.event.EntityEvent;
import com.causalgraph.event.EventPublisherHelper;
import com.causalgraph.event.RelationEvent;
import com.causalgraph.graph.EvictionResult;
import com.causalgraph.graph.GraphStoreConfig;
import com.causalgraph.graph.TemporalGraph;
import com.causalgraph.observability.GraphMetricsService;
import com.causalgraph.pattern.PatternMiner;
import com.causalgraph.pattern.PatternMinerConfig;
import com.causalgraph.prediction.Predictor;
import com.causalgraph.prediction.PredictorConfig;
import com.causalgraph.repository.jpa.CausalChainJpaRepository;
import com.causalgraph.repository.jpa.TemporalEntityJpaRepository;
import com.causalgraph.repository.jpa.TemporalPatternJpaRepository;
import com.causalgraph.repository.jpa.TemporalRelationJpaRepository;
import com.causalgraph.service.TemporalGraphService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-service integration test for the analytics pipeline.
 * Wires real TemporalGraph + TemporalGraphService + analytics components + EventPublisherHelper,
 * with GraphMetricsService and GraphArchiveService listening, and only the JPA repositories
 * mocked, to verify the full flow:
 * ingest -> discover -> promote -> chains -> patterns -> predictions -> evict -> archive.
 */
@ExtendWith(MockitoExtension.class)
class CausalPipelineIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    private static final Instant NOW = T0.plus(Duration.ofMinutes(60));

    @Mock
    private TemporalEntityJpaRepository temporalEntityJpaRepository;

    @Mock
    private TemporalRelationJpaRepository temporalRelationJpaRepository;

    @Mock
    private CausalChainJpaRepository causalChainJpaRepository;

    @Mock
    private TemporalPatternJpaRepository temporalPatternJpaRepository;

    private SimpleMeterRegistry meterRegistry;
    private TemporalGraph temporalGraph;
    private TemporalGraphService service;
    private GraphMetricsService graphMetricsService;
    private GraphArchiveService graphArchiveService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        DiscoveryConfig discoveryConfig = new DiscoveryConfig();
        ChainBuilderConfig chainBuilderConfig = new ChainBuilderConfig();
        PredictorConfig predictorConfig = new PredictorConfig();
        predictorConfig.setMinPredictionPower(0.3);

        // synchronous dispatch in listener order, as Spring does for non-async listeners
        ApplicationEventPublisher publisher = this::dispatch;

        temporalGraph = new TemporalGraph(new GraphStoreConfig());
        service = new TemporalGraphService(
                temporalGraph,
                new CausalDiscoveryEngine(discoveryConfig),
                new ChainBuilder(chainBuilderConfig),
                new PatternMiner(new PatternMinerConfig()),
                new Predictor(predictorConfig),
                new EventPublisherHelper(publisher),
                discoveryConfig,
                chainBuilderConfig,
                predictorConfig,
                clock);

        meterRegistry = new SimpleMeterRegistry();
        graphMetricsService = new GraphMetricsService(meterRegistry, temporalGraph, service);
        graphArchiveService = new GraphArchiveService(
                temporalEntityJpaRepository,
                temporalRelationJpaRepository,
                causalChainJpaRepository,
                temporalPatternJpaRepository,
                new ArchiveConfig(),
                clock);
    }

    private void dispatch(Object event) {
        if (event instanceof EntityEvent) {
            graphMetricsService.onEntityEvent((EntityEvent) event);
            graphArchiveService.onEntityEvent((EntityEvent) event);
        } else if (event instanceof RelationEvent) {
            graphMetricsService.onRelationEvent((RelationEvent) event);
            graphArchiveService.onRelationEvent((RelationEvent) event);
        } else if (event instanceof AnalyticsEvent) {
            graphMetricsService.onAnalyticsEvent((AnalyticsEvent) event);
            graphArchiveService.onAnalyticsEvent((AnalyticsEvent) event);
        }
    }

    /** Six news items ten minutes apart, each followed five minutes later by a price move echoing it. */
    private void ingestNewsAndPriceStreams() {
        double[] news = {1, 3, 2, 5, 4, 6};
        double[] price = {0.5, 1, 3, 2, 5, 4};
        for (int i = 0; i < news.length; i++) {
            Instant ts = T0.plus(Duration.ofMinutes(10L * i));
            service.addEntity(entity("news_" + i, EntityKind.NEWS_EVENT, ts, "news_feed", news[i]));
            service.addEntity(entity("price_" + i, EntityKind.PRICE_MOVEMENT, ts.plus(Duration.ofMinutes(5)),
                    "price_feed", price[i]));
        }
    }

    private static TemporalEntity entity(String id, EntityKind kind, Instant ts, String source, double value) {
        return TemporalEntity.builder()
                .id(id)
                .kind(kind)
                .timestamp(ts)
                .confidence(0.9)
                .source(source)
                .properties(Map.of("value", value))
                .build();
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("Full pipeline: discovery feeds chains, chains feed predictions, metrics and archive follow")
    void fullPipeline() {
        ingestNewsAndPriceStreams();
        assertThat(counter("graph.entities.ingested")).isEqualTo(12.0);
        assertThat(meterRegistry.get("graph.entities").gauge().value()).isEqualTo(12.0);

        // Discovery: candidates are published, the validated subset is promoted to CAUSES relations
        List<CausalHypothesis> candidates = service.discoverCausalRelationships(Duration.ofMinutes(60));
        assertThat(candidates).isNotEmpty().allSatisfy(h -> assertThat(h.isValidated()).isFalse());

        List<CausalHypothesis> validated = service.currentValidatedHypotheses();
        assertThat(validated).isNotEmpty()
                .anySatisfy(h -> {
                    assertThat(h.getCauseId()).isEqualTo("news_5");
                    assertThat(h.getEffectId()).isEqualTo("price_5");
                    assertThat(h.getStrength()).isGreaterThan(0.75);
                });
        assertThat(service.getCausalInferenceCount()).isEqualTo(validated.size());
        assertThat(service.outgoingRelations("news_5"))
                .anySatisfy(r -> {
                    assertThat(r.getId()).isEqualTo("causal_news_5_price_5");
                    assertThat(r.getKind()).isEqualTo(RelationKind.CAUSES);
                    assertThat(r.getCausalLag()).isEqualTo(Duration.ofMinutes(5));
                });
        assertThat(counter("graph.relations.added")).isEqualTo(validated.size());

        // Chains are built over the validated hypotheses only
        List<CausalChain> chains = service.buildCausalChains();
        assertThat(chains).isNotEmpty()
                .anySatisfy(c -> assertThat(c.getEntities()).containsExactly("news_5", "price_5"));
        assertThat(chains).allSatisfy(c -> {
            assertThat(c.getEntities()).doesNotHaveDuplicates();
            assertThat(c.getTotalStrength()).isBetween(0.0, 1.0);
        });

        // Both feeds arrive every ten minutes
        List<TemporalPattern> patterns = service.discoverTemporalPatterns();
        assertThat(patterns).extracting(TemporalPattern::getPatternType)
                .containsExactlyInAnyOrder("periodic_news_event", "periodic_price_movement");
        assertThat(patterns).allSatisfy(p -> {
            assertThat(p.getTemporalSignature().getMeanIntervalSeconds()).isEqualTo(600.0);
            assertThat(p.getNextPredicted()).isAfter(p.getLastOccurrence());
        });

        // Predictions come from the published chains and name the kind of the chain's last entity
        List<Prediction> predictions = service.predictFutureEvents();
        Map<String, CausalChain> chainsById = new HashMap<>();
        chains.forEach(c -> chainsById.put(c.getId(), c));
        assertThat(predictions).isNotEmpty().allSatisfy(p -> {
            CausalChain source = chainsById.get(p.getChainId());
            assertThat(source).isNotNull();
            String lastId = source.getEntities().get(source.getEntities().size() - 1);
            assertThat(p.getPredictedKind()).isEqualTo(temporalGraph.getEntity(lastId).orElseThrow().getKind());
            assertThat(p.getConfidence()).isGreaterThan(0.3);
            assertThat(p.getPredictedTime()).isAfter(NOW);
        });

        assertThat(meterRegistry.get("graph.analytics.duration").tag("type", "chains_built").timer().count())
                .isEqualTo(1);
        assertThat(meterRegistry.get("graph.chains").gauge().value()).isEqualTo(chains.size());

        // Archive has queued entities, promoted relations, chains and patterns
        assertThat(graphArchiveService.getPendingCount())
                .isEqualTo(12 + validated.size() + chains.size() + patterns.size());
        graphArchiveService.flush();
        assertThat(graphArchiveService.getPendingCount()).isZero();
        verify(temporalEntityJpaRepository).saveAll(anyList());
        verify(temporalRelationJpaRepository).saveAll(anyList());
        verify(causalChainJpaRepository).saveAll(anyList());
        verify(temporalPatternJpaRepository).saveAll(anyList());
    }

    @Test
    @DisplayName("Eviction cascades into relations, validated hypotheses and the next chain build")
    void evictionCascade() {
        ingestNewsAndPriceStreams();
        service.discoverCausalRelationships(Duration.ofMinutes(60));
        int relationsBefore = temporalGraph.relationCount();

        EvictionResult result = service.evictBefore(T0.plus(Duration.ofMinutes(30)));

        Set<String> evicted = Set.copyOf(result.entityIds());
        assertThat(evicted).containsExactlyInAnyOrder("news_0", "news_1", "news_2", "price_0", "price_1", "price_2");
        assertThat(counter("graph.entities.evicted")).isEqualTo(6.0);
        assertThat(counter("graph.relations.removed")).isEqualTo(result.relations().size());
        assertThat(temporalGraph.relationCount()).isEqualTo(relationsBefore - result.relations().size());

        assertThat(service.currentValidatedHypotheses()).allSatisfy(h -> {
            assertThat(evicted).doesNotContain(h.getCauseId());
            assertThat(evicted).doesNotContain(h.getEffectId());
        });

        List<CausalChain> chains = service.buildCausalChains();
        Set<String> chainEntities = chains.stream()
                .flatMap(c -> c.getEntities().stream())
                .collect(Collectors.toSet());
        assertThat(chainEntities).doesNotContainAnyElementsOf(evicted);

        GraphStats stats = service.getStatistics();
        assertThat(stats.getEntityCount()).isEqualTo(6);
        assertThat(stats.getRelationCount()).isEqualTo(temporalGraph.relationCount());
        assertThat(stats.getChainCount()).isEqualTo(chains.size());
    }
}
