package com.causalgraph.archive;

import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalPattern;
import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.event.AnalyticsEvent;
import com.causalgraph.event.AnalyticsEventType;
import com.causalgraph.event.EntityEvent;
import com.causalgraph.event.EntityEventType;
import com.causalgraph.event.RelationEvent;
import com.causalgraph.event.RelationEventType;
import com.causalgraph.mapper.GraphRecordMapper;
import com.causalgraph.repository.jpa.CausalChainJpaRepository;
import com.causalgraph.repository.jpa.TemporalEntityJpaRepository;
import com.causalgraph.repository.jpa.TemporalPatternJpaRepository;
import com.causalgraph.repository.jpa.TemporalRelationJpaRepository;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Write-behind persistence of entities, relations, chains and patterns to H2, with circuit
 * breaker protection.
 *
 * <p>Graph events queue domain objects; a scheduled flush drains up to {@code batchSize} per
 * table and saves them through Spring Data JPA. Ingestion and analytics never touch the
 * database, so archive failures cannot slow or fail them.
 *
 * <p>Circuit breaker: after {@code failureThreshold} consecutive failed flushes the circuit
 * opens and flushes are skipped until {@code recoveryInterval} has elapsed. A failed batch is
 * re-queued at the tail. Rows are keyed by domain id, so a retried batch overwrites rather
 * than duplicates.
 */
@Service
@EnableConfigurationProperties(ArchiveConfig.class)
public class GraphArchiveService {

    private static final Logger log = LoggerFactory.getLogger(GraphArchiveService.class);

    private final TemporalEntityJpaRepository temporalEntityJpaRepository;
    private final TemporalRelationJpaRepository temporalRelationJpaRepository;
    private final CausalChainJpaRepository causalChainJpaRepository;
    private final TemporalPatternJpaRepository temporalPatternJpaRepository;
    private final ArchiveConfig archiveConfig;
    private final Clock clock;
    private final GraphRecordMapper graphRecordMapper = Mappers.getMapper(GraphRecordMapper.class);

    private final Queue<TemporalEntity> pendingEntities = new ConcurrentLinkedQueue<>();
    private final Queue<TemporalRelation> pendingRelations = new ConcurrentLinkedQueue<>();
    private final Queue<CausalChain> pendingChains = new ConcurrentLinkedQueue<>();
    private final Queue<TemporalPattern> pendingPatterns = new ConcurrentLinkedQueue<>();

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicBoolean circuitOpen = new AtomicBoolean(false);
    private volatile long circuitOpenedAt = 0;

    public GraphArchiveService(
            TemporalEntityJpaRepository temporalEntityJpaRepository,
            TemporalRelationJpaRepository temporalRelationJpaRepository,
            CausalChainJpaRepository causalChainJpaRepository,
            TemporalPatternJpaRepository temporalPatternJpaRepository,
            ArchiveConfig archiveConfig,
            Clock clock) {
        this.temporalEntityJpaRepository = temporalEntityJpaRepository;
        this.temporalRelationJpaRepository = temporalRelationJpaRepository;
        this.causalChainJpaRepository = causalChainJpaRepository;
        this.temporalPatternJpaRepository = temporalPatternJpaRepository;
        this.archiveConfig = archiveConfig;
        this.clock = clock;
    }

    // ---- Event intake ----

    @EventListener
    @Order(30)
    public void onEntityEvent(EntityEvent event) {
        if (archiveConfig.isEnabled() && event.getEventType() == EntityEventType.ADDED) {
            pendingEntities.add(event.getEntity());
        }
    }

    @EventListener
    @Order(30)
    public void onRelationEvent(RelationEvent event) {
        if (archiveConfig.isEnabled() && event.getEventType() == RelationEventType.ADDED) {
            pendingRelations.add(event.getRelation());
        }
    }

    @EventListener
    @Order(30)
    @SuppressWarnings("unchecked")
    public void onAnalyticsEvent(AnalyticsEvent event) {
        if (!archiveConfig.isEnabled()) {
            return;
        }
        if (event.getEventType() == AnalyticsEventType.CHAINS_BUILT) {
            pendingChains.addAll((List<CausalChain>) event.getResults());
        } else if (event.getEventType() == AnalyticsEventType.PATTERNS_DISCOVERED) {
            pendingPatterns.addAll((List<TemporalPattern>) event.getResults());
        }
    }

    // ---- Flush ----

    /**
     * Flushes one batch per table. Skipped while the circuit is open and the recovery
     * interval has not elapsed.
     */
    @Scheduled(fixedRateString = "${causal-graph.archive.flush-interval:PT5S}")
    public void flush() {
        if (getPendingCount() == 0) {
            return;
        }

        if (circuitOpen.get()) {
            if (clock.millis() - circuitOpenedAt < archiveConfig.getRecoveryInterval().toMillis()) {
                log.debug("Circuit open, skipping flush. {} records queued.", getPendingCount());
                return;
            }
            log.info("Circuit breaker recovery attempt. {} records queued.", getPendingCount());
        }

        List<TemporalEntity> entities = drain(pendingEntities);
        List<TemporalRelation> relations = drain(pendingRelations);
        List<CausalChain> chains = drain(pendingChains);
        List<TemporalPattern> patterns = drain(pendingPatterns);
        int total = entities.size() + relations.size() + chains.size() + patterns.size();

        try {
            saveIfAny(entities, batch -> temporalEntityJpaRepository.saveAll(graphRecordMapper.toEntityRecords(batch)));
            saveIfAny(relations, batch ->
                    temporalRelationJpaRepository.saveAll(graphRecordMapper.toRelationRecords(batch)));
            saveIfAny(chains, batch -> causalChainJpaRepository.saveAll(graphRecordMapper.toChainRecords(batch)));
            saveIfAny(patterns, batch ->
                    temporalPatternJpaRepository.saveAll(graphRecordMapper.toPatternRecords(batch)));

            if (circuitOpen.compareAndSet(true, false)) {
                log.info("Circuit breaker closed after successful flush");
            }
            consecutiveFailures.set(0);
            log.debug("Archived {} entities, {} relations, {} chains, {} patterns",
                    entities.size(), relations.size(), chains.size(), patterns.size());

        } catch (Exception e) {
            int failures = consecutiveFailures.incrementAndGet();
            log.error("Failed to archive {} records (failure {}/{}): {}",
                    total, failures, archiveConfig.getFailureThreshold(), e.getMessage());

            if (failures >= archiveConfig.getFailureThreshold() && circuitOpen.compareAndSet(false, true)) {
                circuitOpenedAt = clock.millis();
                log.warn("Circuit breaker opened after {} consecutive failures. Will retry after {}. {} records queued.",
                        failures, archiveConfig.getRecoveryInterval(), getPendingCount() + total);
            }

            // saveAll is an upsert by id, so re-saving rows that did make it is harmless
            pendingEntities.addAll(entities);
            pendingRelations.addAll(relations);
            pendingChains.addAll(chains);
            pendingPatterns.addAll(patterns);
        }
    }

    /** Flushes once more on shutdown, bypassing and resetting the circuit breaker. */
    @PreDestroy
    public void forceFlush() {
        log.info("Force flushing {} pending archive records", getPendingCount());
        boolean wasCircuitOpen = circuitOpen.getAndSet(false);
        consecutiveFailures.set(0);

        flush();

        if (wasCircuitOpen) {
            log.info("Circuit breaker was reset during force flush");
        }
    }

    // ---- Circuit breaker state (for monitoring) ----

    public boolean isCircuitOpen() {
        return circuitOpen.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getPendingCount() {
        return pendingEntities.size() + pendingRelations.size() + pendingChains.size() + pendingPatterns.size();
    }

    public void resetCircuitBreaker() {
        circuitOpen.set(false);
        consecutiveFailures.set(0);
        log.info("Circuit breaker manually reset");
    }

    // ---- Internal ----

    private <T> List<T> drain(Queue<T> queue) {
        int max = archiveConfig.getBatchSize();
        List<T> batch = new ArrayList<>(Math.min(max, queue.size()));
        for (int i = 0; i < max; i++) {
            T item = queue.poll();
            if (item == null) {
                break;
            }
            batch.add(item);
        }
        return batch;
    }

    private static <T> void saveIfAny(List<T> batch, Consumer<List<T>> save) {
        if (!batch.isEmpty()) {
            save.accept(batch);
        }
    }
}
