package com.causalgraph.graph;

import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.enums.RelationKind;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalRelation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;

/**
 * Immutable copy of the graph taken under the read lock.
 *
 * <p>Analytics runs work on a snapshot so that they never hold the lock while scoring,
 * enumerating or mining, and never observe a write in progress. Entities are immutable, so
 * the snapshot shares them with the live store and only copies the containers.
 */
public class GraphSnapshot {

    @Getter
    private final long generation;

    /** Ordered by timestamp. */
    @Getter
    private final List<TemporalEntity> entities;

    @Getter
    private final List<TemporalRelation> relations;

    private final Map<String, TemporalEntity> entitiesById;

    public GraphSnapshot(long generation, List<TemporalEntity> entities, List<TemporalRelation> relations) {
        this.generation = generation;
        this.entities = Collections.unmodifiableList(new ArrayList<>(entities));
        this.relations = Collections.unmodifiableList(new ArrayList<>(relations));
        Map<String, TemporalEntity> byId = new HashMap<>();
        for (TemporalEntity entity : entities) {
            byId.put(entity.getId(), entity);
        }
        this.entitiesById = Collections.unmodifiableMap(byId);
    }

    public static GraphSnapshot empty() {
        return new GraphSnapshot(0, List.of(), List.of());
    }

    public Optional<TemporalEntity> entity(String id) {
        return Optional.ofNullable(entitiesById.get(id));
    }

    public int entityCount() {
        return entities.size();
    }

    /** Entities with {@code from <= timestamp <= to}, ordered by timestamp. */
    public List<TemporalEntity> entitiesBetween(Instant from, Instant to) {
        List<TemporalEntity> result = new ArrayList<>();
        for (TemporalEntity entity : entities) {
            Instant ts = entity.getTimestamp();
            if (ts.isAfter(to)) {
                break;
            }
            if (!ts.isBefore(from)) {
                result.add(entity);
            }
        }
        return result;
    }

    /**
     * The recorded history of one producer stream: entities of the same kind and source as
     * the given one, up to and including it, ordered by timestamp.
     */
    public List<TemporalEntity> historyOf(TemporalEntity entity) {
        List<TemporalEntity> history = new ArrayList<>();
        for (TemporalEntity candidate : entities) {
            if (candidate.getTimestamp().isAfter(entity.getTimestamp())) {
                break;
            }
            if (candidate.getKind() == entity.getKind()
                    && Objects.equals(candidate.getSource(), entity.getSource())) {
                history.add(candidate);
            }
        }
        return history;
    }

    public List<TemporalEntity> entitiesOfKind(EntityKind kind) {
        List<TemporalEntity> result = new ArrayList<>();
        for (TemporalEntity entity : entities) {
            if (entity.getKind() == kind) {
                result.add(entity);
            }
        }
        return result;
    }

    public Map<EntityKind, Integer> entityKindHistogram() {
        Map<EntityKind, Integer> histogram = new EnumMap<>(EntityKind.class);
        for (TemporalEntity entity : entities) {
            histogram.merge(entity.getKind(), 1, Integer::sum);
        }
        return histogram;
    }

    public Map<RelationKind, Integer> relationKindHistogram() {
        Map<RelationKind, Integer> histogram = new EnumMap<>(RelationKind.class);
        for (TemporalRelation relation : relations) {
            histogram.merge(relation.getKind(), 1, Integer::sum);
        }
        return histogram;
    }
}
