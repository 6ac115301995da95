package com.causalgraph.service;

import com.causalgraph.chain.CancellationToken;
import com.causalgraph.chain.ChainBuilder;
import com.causalgraph.chain.ChainBuilderConfig;
import com.causalgraph.discovery.CausalDiscoveryEngine;
import com.causalgraph.discovery.DiscoveryConfig;
import com.causalgraph.domain.enums.AnalyticsKind;
import com.causalgraph.domain.enums.RelationKind;
import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.CausalHypothesis;
import com.causalgraph.domain.model.GraphStats;
import com.causalgraph.domain.model.Prediction;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalPattern;
import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.event.AnalyticsEventType;
import com.causalgraph.event.EventPublisherHelper;
import com.causalgraph.exception.AnalyticsInProgressException;
import com.causalgraph.exception.BaseException;
import com.causalgraph.exception.InvalidWindowException;
import com.causalgraph.exception.ResourceNotFoundException;
import com.causalgraph.graph.EvictionResult;
import com.causalgraph.graph.GraphSnapshot;
import com.causalgraph.graph.GraphTopology;
import com.causalgraph.graph.TemporalGraph;
import com.causalgraph.pattern.PatternMiner;
import com.causalgraph.prediction.Predictor;
import com.causalgraph.prediction.PredictorConfig;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingestion and query facade over the temporal graph and its four analytics components.
 *
 * <p>Ingestion calls go straight to {@link TemporalGraph}, which serializes writers. Every
 * analytics run takes a {@link GraphSnapshot}, computes without holding any lock, then
 * publishes its result by swapping an {@link AtomicReference}, so readers of the current
 * chains or patterns always see one complete run.
 *
 * <p>At most one run per {@link AnalyticsKind} is active at a time; a concurrent second call
 * fails fast with {@link AnalyticsInProgressException} rather than queueing.
 *
 * <p>Validated hypotheses from every discovery run are accumulated by (cause, effect) pair and
 * feed chain building. They are pruned when either endpoint is evicted.
 */
@Service
public class TemporalGraphService {

    private static final Logger log = LoggerFactory.getLogger(TemporalGraphService.class);

    private final TemporalGraph temporalGraph;
    private final CausalDiscoveryEngine causalDiscoveryEngine;
    private final ChainBuilder chainBuilder;
    private final PatternMiner patternMiner;
    private final Predictor predictor;
    private final EventPublisherHelper eventPublisherHelper;
    private final DiscoveryConfig discoveryConfig;
    private final ChainBuilderConfig chainBuilderConfig;
    private final PredictorConfig predictorConfig;
    private final Clock clock;

    private final Map<AnalyticsKind, AtomicBoolean> inFlight = new EnumMap<>(AnalyticsKind.class);

    private final AtomicReference<List<CausalHypothesis>> currentHypotheses = new AtomicReference<>(List.of());
    private final AtomicReference<List<CausalChain>> currentChains = new AtomicReference<>(List.of());
    private final AtomicReference<List<TemporalPattern>> currentPatterns = new AtomicReference<>(List.of());
    private final AtomicReference<List<Prediction>> currentPredictions = new AtomicReference<>(List.of());

    /** Keyed {@code cause->effect}; sorted so chain building sees a stable input order. */
    private final Map<String, CausalHypothesis> validatedHypotheses = new TreeMap<>();

    private final AtomicLong causalInferenceCount = new AtomicLong();

    public TemporalGraphService(
            TemporalGraph temporalGraph,
            CausalDiscoveryEngine causalDiscoveryEngine,
            ChainBuilder chainBuilder,
            PatternMiner patternMiner,
            Predictor predictor,
            EventPublisherHelper eventPublisherHelper,
            DiscoveryConfig discoveryConfig,
            ChainBuilderConfig chainBuilderConfig,
            PredictorConfig predictorConfig,
            Clock clock) {
        this.temporalGraph = temporalGraph;
        this.causalDiscoveryEngine = causalDiscoveryEngine;
        this.chainBuilder = chainBuilder;
        this.patternMiner = patternMiner;
        this.predictor = predictor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.discoveryConfig = discoveryConfig;
        this.chainBuilderConfig = chainBuilderConfig;
        this.predictorConfig = predictorConfig;
        this.clock = clock;
        for (AnalyticsKind kind : AnalyticsKind.values()) {
            inFlight.put(kind, new AtomicBoolean(false));
        }
    }

    // ---- Ingestion ----

    /**
     * @throws com.causalgraph.exception.DuplicateIdException if the id is already stored
     */
    public void addEntity(TemporalEntity entity) {
        EvictionResult capEviction = temporalGraph.addEntity(entity);
        log.debug("Added entity {} ({}) at {}", entity.getId(), entity.getKind(), entity.getTimestamp());
        eventPublisherHelper.publishEntityAdded(this, entity);
        if (!capEviction.isEmpty()) {
            onEviction(capEviction);
        }
    }

    /**
     * @throws com.causalgraph.exception.UnknownEntityException if an endpoint is not stored
     * @throws com.causalgraph.exception.DuplicateIdException if the relation id is already stored
     */
    public void addRelation(TemporalRelation relation) {
        temporalGraph.addRelation(relation);
        log.debug("Added relation {} {} -[{}]-> {}",
                relation.getId(), relation.getSourceEntity(), relation.getKind(), relation.getTargetEntity());
        eventPublisherHelper.publishRelationAdded(this, relation);
    }

    /** Evicts entities with {@code timestamp < cutoff} and every relation touching them. */
    public EvictionResult evictBefore(Instant cutoff) {
        EvictionResult result = temporalGraph.evictBefore(cutoff);
        if (!result.isEmpty()) {
            log.info("Evicted {} entities and {} relations older than {}",
                    result.entityIds().size(), result.relations().size(), cutoff);
            onEviction(result);
        }
        return result;
    }

    // ---- Lookups ----

    public TemporalEntity getEntity(String id) {
        return temporalGraph.getEntity(id).orElseThrow(() -> new ResourceNotFoundException("Entity", id));
    }

    /** Entities with {@code from <= timestamp < to}, ordered by timestamp. */
    public List<TemporalEntity> entitiesInWindow(Instant from, Instant to) {
        if (to.isBefore(from)) {
            throw new InvalidWindowException(String.format("Window end %s is before its start %s", to, from));
        }
        return temporalGraph.entitiesInWindow(from, to);
    }

    public List<TemporalRelation> outgoingRelations(String entityId) {
        requireEntity(entityId);
        return temporalGraph.outgoingRelations(entityId);
    }

    public List<TemporalRelation> incomingRelations(String entityId) {
        requireEntity(entityId);
        return temporalGraph.incomingRelations(entityId);
    }

    // ---- Analytics ----

    /**
     * Scores entity pairs in {@code [now - window, now]} and screens them against their history.
     *
     * <p>Returns the raw candidates of this run. The validated subset is accumulated for chain
     * building and, if configured, promoted into {@code CAUSES} relations.
     */
    public List<CausalHypothesis> discoverCausalRelationships(Duration window) {
        requirePositive("Discovery window", window);
        return runExclusive(AnalyticsKind.CAUSAL_DISCOVERY, () -> {
            long start = System.nanoTime();
            GraphSnapshot snapshot = temporalGraph.snapshot();
            Instant now = clock.instant();

            List<CausalHypothesis> candidates = causalDiscoveryEngine.discover(snapshot, now, window);
            List<CausalHypothesis> validated = causalDiscoveryEngine.validate(snapshot, candidates);
            recordValidated(validated);
            int promoted = discoveryConfig.isPromoteValidated() ? promote(validated) : 0;

            List<CausalHypothesis> published = List.copyOf(candidates);
            currentHypotheses.set(published);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Causal discovery over {}: {} candidates, {} validated, {} promoted in {}ms",
                    window, published.size(), validated.size(), promoted, elapsed.toMillis());
            eventPublisherHelper.publishAnalytics(
                    this, AnalyticsEventType.HYPOTHESES_DISCOVERED, published, elapsed, snapshot.getGeneration());
            return published;
        });
    }

    /** Rebuilds the ranked chains from all validated hypotheses accumulated so far. */
    public List<CausalChain> buildCausalChains(int maxLength) {
        if (maxLength <= 0) {
            throw new InvalidWindowException("Chain length must be positive, was " + maxLength);
        }
        return runExclusive(AnalyticsKind.CHAIN_BUILDING, () -> {
            long start = System.nanoTime();
            List<CausalHypothesis> edges = currentValidatedHypotheses();
            CancellationToken token = CancellationToken.withTimeout(clock, chainBuilderConfig.getBuildTimeout());

            List<CausalChain> chains = chainBuilder.build(edges, maxLength, token);
            currentChains.set(chains);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Built {} causal chains from {} validated hypotheses (max length {}) in {}ms",
                    chains.size(), edges.size(), maxLength, elapsed.toMillis());
            eventPublisherHelper.publishAnalytics(
                    this, AnalyticsEventType.CHAINS_BUILT, chains, elapsed, temporalGraph.getGeneration());
            return chains;
        });
    }

    public List<CausalChain> buildCausalChains() {
        return buildCausalChains(chainBuilderConfig.getDefaultMaxLength());
    }

    public List<TemporalPattern> discoverTemporalPatterns() {
        return runExclusive(AnalyticsKind.PATTERN_MINING, () -> {
            long start = System.nanoTime();
            GraphSnapshot snapshot = temporalGraph.snapshot();

            List<TemporalPattern> patterns = List.copyOf(patternMiner.discoverPatterns(snapshot));
            currentPatterns.set(patterns);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Discovered {} temporal patterns over {} entities in {}ms",
                    patterns.size(), snapshot.entityCount(), elapsed.toMillis());
            eventPublisherHelper.publishAnalytics(
                    this, AnalyticsEventType.PATTERNS_DISCOVERED, patterns, elapsed, snapshot.getGeneration());
            return patterns;
        });
    }

    /** Predictions from the currently published chains whose effect falls within {@code horizon}. */
    public List<Prediction> predictFutureEvents(Duration horizon) {
        requirePositive("Prediction horizon", horizon);
        return runExclusive(AnalyticsKind.PREDICTION, () -> {
            long start = System.nanoTime();
            GraphSnapshot snapshot = temporalGraph.snapshot();
            List<CausalChain> chains = currentChains.get();

            List<Prediction> predictions = predictor.predict(chains, snapshot, clock.instant(), horizon);
            currentPredictions.set(predictions);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Generated {} predictions from {} chains over horizon {} in {}ms",
                    predictions.size(), chains.size(), horizon, elapsed.toMillis());
            eventPublisherHelper.publishAnalytics(
                    this, AnalyticsEventType.PREDICTIONS_GENERATED, predictions, elapsed, snapshot.getGeneration());
            return predictions;
        });
    }

    public List<Prediction> predictFutureEvents() {
        return predictFutureEvents(predictorConfig.getDefaultHorizon());
    }

    public GraphStats getStatistics() {
        GraphSnapshot snapshot = temporalGraph.snapshot();
        return GraphStats.builder()
                .entityCount(snapshot.entityCount())
                .relationCount(snapshot.getRelations().size())
                .chainCount(currentChains.get().size())
                .patternCount(currentPatterns.get().size())
                .entityKindHistogram(snapshot.entityKindHistogram())
                .relationKindHistogram(snapshot.relationKindHistogram())
                .graphDensity(GraphTopology.density(snapshot))
                .stronglyConnectedComponents(GraphTopology.stronglyConnectedComponents(snapshot))
                .causalInferenceCount(causalInferenceCount.get())
                .generation(snapshot.getGeneration())
                .build();
    }

    // ---- Published results ----

    public List<CausalHypothesis> currentHypotheses() {
        return currentHypotheses.get();
    }

    public List<CausalChain> currentChains() {
        return currentChains.get();
    }

    public List<TemporalPattern> currentPatterns() {
        return currentPatterns.get();
    }

    public List<Prediction> currentPredictions() {
        return currentPredictions.get();
    }

    public List<CausalHypothesis> currentValidatedHypotheses() {
        synchronized (validatedHypotheses) {
            return List.copyOf(validatedHypotheses.values());
        }
    }

    public long getCausalInferenceCount() {
        return causalInferenceCount.get();
    }

    public boolean isRunning(AnalyticsKind kind) {
        return inFlight.get(kind).get();
    }

    // ---- Internal ----

    private <T> T runExclusive(AnalyticsKind kind, Supplier<T> run) {
        AtomicBoolean flag = inFlight.get(kind);
        if (!flag.compareAndSet(false, true)) {
            throw new AnalyticsInProgressException(kind);
        }
        try {
            return run.get();
        } finally {
            flag.set(false);
        }
    }

    private void recordValidated(List<CausalHypothesis> validated) {
        synchronized (validatedHypotheses) {
            for (CausalHypothesis hypothesis : validated) {
                validatedHypotheses.put(pairKey(hypothesis), hypothesis);
            }
        }
        causalInferenceCount.addAndGet(validated.size());
    }

    /**
     * Adds a {@code CAUSES} relation per validated hypothesis. A pair already promoted, or whose
     * endpoint was evicted since the snapshot, is skipped.
     */
    private int promote(List<CausalHypothesis> validated) {
        int promoted = 0;
        for (CausalHypothesis hypothesis : validated) {
            String relationId = promotedRelationId(hypothesis);
            if (temporalGraph.containsRelation(relationId)) {
                continue;
            }
            TemporalRelation relation = TemporalRelation.builder()
                    .id(relationId)
                    .sourceEntity(hypothesis.getCauseId())
                    .targetEntity(hypothesis.getEffectId())
                    .kind(RelationKind.CAUSES)
                    .startTime(hypothesis.getCauseTimestamp())
                    .endTime(hypothesis.getEffectTimestamp())
                    .strength(hypothesis.getStrength())
                    .confidence(hypothesis.getStrength())
                    .causalLag(hypothesis.lag())
                    .evidence(hypothesis.getEvidence())
                    .metadata(Map.of("mechanism", hypothesis.getMechanism()))
                    .build();
            try {
                addRelation(relation);
                promoted++;
            } catch (BaseException e) {
                log.debug("Hypothesis {} not promoted: {}", relationId, e.getMessage());
            }
        }
        return promoted;
    }

    private void onEviction(EvictionResult result) {
        Set<String> evicted = new HashSet<>(result.entityIds());
        List<String> pruned = new ArrayList<>();
        synchronized (validatedHypotheses) {
            validatedHypotheses.entrySet().removeIf(entry -> {
                CausalHypothesis hypothesis = entry.getValue();
                boolean stale = evicted.contains(hypothesis.getCauseId()) || evicted.contains(hypothesis.getEffectId());
                if (stale) {
                    pruned.add(entry.getKey());
                }
                return stale;
            });
        }
        if (!pruned.isEmpty()) {
            log.debug("Pruned {} validated hypotheses with evicted endpoints", pruned.size());
        }
        eventPublisherHelper.publishEviction(this, result);
    }

    private void requireEntity(String entityId) {
        if (temporalGraph.getEntity(entityId).isEmpty()) {
            throw new ResourceNotFoundException("Entity", entityId);
        }
    }

    /** Positive, and small enough that {@code now - duration} and {@code now + duration} are valid instants. */
    private void requirePositive(String what, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidWindowException(what + " must be positive, was " + duration);
        }
        Instant now = clock.instant();
        try {
            now.minus(duration);
            now.plus(duration);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidWindowException(what + " is out of range, was " + duration);
        }
    }

    private static String pairKey(CausalHypothesis hypothesis) {
        return hypothesis.getCauseId() + "->" + hypothesis.getEffectId();
    }

    private static String promotedRelationId(CausalHypothesis hypothesis) {
        return "causal_" + hypothesis.getCauseId() + "_" + hypothesis.getEffectId();
    }
}
