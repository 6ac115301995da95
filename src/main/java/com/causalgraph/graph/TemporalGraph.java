package com.causalgraph.graph;

import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.exception.BusinessException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * The live graph: an {@link EntityStore} and a {@link RelationGraph} behind one
 * {@link ReadWriteLock}.
 *
 * <p>Writers (insert, evict) hold the write lock for a single operation. Readers either take
 * the read lock for a short lookup or call {@link #snapshot()} and work on the returned copy,
 * which is what every analytics run does. One lock covers both structures because eviction
 * cascades from entities into relations and must be atomic to readers.
 *
 * <p>A generation counter is bumped on every successful mutation and stamped on snapshots.
 */
@Component
@EnableConfigurationProperties(GraphStoreConfig.class)
public class TemporalGraph {

    private static final Logger log = LoggerFactory.getLogger(TemporalGraph.class);

    private final GraphStoreConfig graphStoreConfig;
    private final EntityStore entityStore = new EntityStore();
    private final RelationGraph relationGraph = new RelationGraph(entityStore);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong generation = new AtomicLong();

    public TemporalGraph(GraphStoreConfig graphStoreConfig) {
        this.graphStoreConfig = graphStoreConfig;
    }

    /**
     * Inserts an entity. If the store then holds more than {@code maxEntities}, the oldest
     * entities are evicted (with their relations) inside the same write.
     *
     * @return what the capacity cap evicted; usually empty
     * @throws com.causalgraph.exception.DuplicateIdException if the id is already stored
     */
    public EvictionResult addEntity(TemporalEntity entity) {
        validate(entity);
        lock.writeLock().lock();
        try {
            entityStore.add(entity);
            generation.incrementAndGet();

            int overflow = entityStore.size() - graphStoreConfig.getMaxEntities();
            if (overflow > 0) {
                EvictionResult result = cascade(entityStore.evictOldest(overflow));
                log.info("Entity cap {} exceeded, evicted {} oldest entities",
                        graphStoreConfig.getMaxEntities(), result.entityIds().size());
                return result;
            }
            return EvictionResult.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws com.causalgraph.exception.UnknownEntityException if an endpoint is not stored
     * @throws com.causalgraph.exception.DuplicateIdException if the relation id is already stored
     */
    public void addRelation(TemporalRelation relation) {
        validate(relation);
        lock.writeLock().lock();
        try {
            relationGraph.add(relation);
            generation.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Evicts entities with {@code timestamp < cutoff} and every relation touching them. */
    public EvictionResult evictBefore(Instant cutoff) {
        lock.writeLock().lock();
        try {
            EvictionResult result = cascade(entityStore.evictBefore(cutoff));
            if (!result.isEmpty()) {
                generation.incrementAndGet();
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<TemporalEntity> getEntity(String id) {
        lock.readLock().lock();
        try {
            return entityStore.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<TemporalRelation> getRelation(String id) {
        lock.readLock().lock();
        try {
            return relationGraph.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsRelation(String id) {
        lock.readLock().lock();
        try {
            return relationGraph.contains(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of the entities with {@code start <= timestamp < end}, ordered by timestamp. */
    public List<TemporalEntity> entitiesInWindow(Instant start, Instant end) {
        lock.readLock().lock();
        try {
            List<TemporalEntity> result = new ArrayList<>();
            entityStore.entitiesInWindow(start, end).forEach(result::add);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TemporalRelation> outgoingRelations(String entityId) {
        lock.readLock().lock();
        try {
            return resolve(relationGraph.neighborsOut(entityId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TemporalRelation> incomingRelations(String entityId) {
        lock.readLock().lock();
        try {
            return resolve(relationGraph.neighborsIn(entityId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public GraphSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new GraphSnapshot(generation.get(), entityStore.allOrdered(), new ArrayList<>(relationGraph.all()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int entityCount() {
        lock.readLock().lock();
        try {
            return entityStore.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int relationCount() {
        lock.readLock().lock();
        try {
            return relationGraph.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getGeneration() {
        return generation.get();
    }

    // ---- Internal ----

    /** Must be called under the write lock. */
    private EvictionResult cascade(List<String> evictedIds) {
        if (evictedIds.isEmpty()) {
            return EvictionResult.empty();
        }
        List<TemporalRelation> removed = new ArrayList<>();
        for (String entityId : evictedIds) {
            removed.addAll(relationGraph.removeEntityCascade(entityId));
        }
        return new EvictionResult(List.copyOf(evictedIds), List.copyOf(removed));
    }

    /** Must be called under the read lock. */
    private List<TemporalRelation> resolve(List<String> relationIds) {
        List<TemporalRelation> result = new ArrayList<>(relationIds.size());
        for (String relationId : relationIds) {
            relationGraph.get(relationId).ifPresent(result::add);
        }
        return result;
    }

    private static void validate(TemporalEntity entity) {
        if (entity.getId() == null || entity.getId().isBlank()) {
            throw new BusinessException("Entity id must not be blank");
        }
        if (entity.getKind() == null) {
            throw new BusinessException("Entity " + entity.getId() + " has no kind");
        }
        if (entity.getTimestamp() == null) {
            throw new BusinessException("Entity " + entity.getId() + " has no timestamp");
        }
        if (entity.getDuration().isNegative()) {
            throw new BusinessException("Entity " + entity.getId() + " has a negative duration");
        }
        requireUnitInterval("confidence", entity.getConfidence(), entity.getId());
    }

    private static void validate(TemporalRelation relation) {
        if (relation.getId() == null || relation.getId().isBlank()) {
            throw new BusinessException("Relation id must not be blank");
        }
        if (relation.getSourceEntity() == null || relation.getTargetEntity() == null) {
            throw new BusinessException("Relation " + relation.getId() + " must name both endpoints");
        }
        if (relation.getKind() == null) {
            throw new BusinessException("Relation " + relation.getId() + " has no kind");
        }
        if (relation.getStartTime() == null) {
            throw new BusinessException("Relation " + relation.getId() + " has no start time");
        }
        if (relation.getEndTime() != null && relation.getEndTime().isBefore(relation.getStartTime())) {
            throw new BusinessException("Relation " + relation.getId() + " ends before it starts");
        }
        requireUnitInterval("strength", relation.getStrength(), relation.getId());
        requireUnitInterval("confidence", relation.getConfidence(), relation.getId());
    }

    private static void requireUnitInterval(String field, double value, String ownerId) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new BusinessException(
                    String.format("%s of %s must be within [0, 1], was %s", field, ownerId, value),
                    Map.of("field", field, "value", value));
        }
    }
}
