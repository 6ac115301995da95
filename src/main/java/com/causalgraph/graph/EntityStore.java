package com.causalgraph.graph;

import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.exception.DuplicateIdException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Owns every {@link TemporalEntity} and the timestamp -> entity-id index.
 *
 * <p>Not thread-safe on its own: all access goes through {@link TemporalGraph}, which holds
 * the read/write lock shared with the {@link RelationGraph}. Ids within one timestamp are kept
 * sorted so that iteration order is deterministic.
 */
public class EntityStore {

    private final Map<String, TemporalEntity> entities = new HashMap<>();
    private final NavigableMap<Instant, Set<String>> temporalIndex = new TreeMap<>();

    public void add(TemporalEntity entity) {
        if (entities.containsKey(entity.getId())) {
            throw new DuplicateIdException("Entity", entity.getId());
        }
        entities.put(entity.getId(), entity);
        temporalIndex.computeIfAbsent(entity.getTimestamp(), k -> new TreeSet<>()).add(entity.getId());
    }

    public Optional<TemporalEntity> get(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public boolean contains(String id) {
        return entities.containsKey(id);
    }

    public int size() {
        return entities.size();
    }

    /**
     * Entities with {@code start <= timestamp < end}, ordered by timestamp.
     *
     * <p>The returned view is lazy and restartable: every call to {@code iterator()} walks the
     * index again. It reflects later mutations, so callers outside the write lock must copy it.
     */
    public Iterable<TemporalEntity> entitiesInWindow(Instant start, Instant end) {
        if (!start.isBefore(end)) {
            return Collections.emptyList();
        }
        NavigableMap<Instant, Set<String>> window = temporalIndex.subMap(start, true, end, false);
        return () -> window.values().stream()
                .flatMap(Collection::stream)
                .map(entities::get)
                .iterator();
    }

    /** All entities ordered by timestamp. */
    public List<TemporalEntity> allOrdered() {
        List<TemporalEntity> ordered = new ArrayList<>(entities.size());
        for (Set<String> ids : temporalIndex.values()) {
            for (String id : ids) {
                ordered.add(entities.get(id));
            }
        }
        return ordered;
    }

    /**
     * Removes every entity with {@code timestamp < cutoff}.
     *
     * @return the evicted ids, oldest first
     */
    public List<String> evictBefore(Instant cutoff) {
        NavigableMap<Instant, Set<String>> expired = temporalIndex.headMap(cutoff, false);
        List<String> evicted = new ArrayList<>();
        for (Set<String> ids : expired.values()) {
            for (String id : ids) {
                entities.remove(id);
                evicted.add(id);
            }
        }
        expired.clear();
        return evicted;
    }

    /**
     * Removes the {@code count} oldest entities.
     *
     * @return the evicted ids, oldest first
     */
    public List<String> evictOldest(int count) {
        List<String> evicted = new ArrayList<>(Math.max(count, 0));
        Iterator<Map.Entry<Instant, Set<String>>> buckets = temporalIndex.entrySet().iterator();
        while (evicted.size() < count && buckets.hasNext()) {
            Set<String> ids = buckets.next().getValue();
            Iterator<String> bucket = ids.iterator();
            while (evicted.size() < count && bucket.hasNext()) {
                String id = bucket.next();
                bucket.remove();
                entities.remove(id);
                evicted.add(id);
            }
            if (ids.isEmpty()) {
                buckets.remove();
            }
        }
        return evicted;
    }
}
