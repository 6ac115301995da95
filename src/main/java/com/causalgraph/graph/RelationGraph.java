package com.causalgraph.graph;

import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.exception.DuplicateIdException;
import com.causalgraph.exception.UnknownEntityException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed, typed edges over the entities of an {@link EntityStore}.
 *
 * <p>Keeps outgoing and incoming adjacency sets keyed by entity id, so listing the edges of a
 * node is O(1) expected time. The adjacency maps are back-references for lookup only: the
 * entity store owns the entities. Cycles are allowed here; chain building excludes them by
 * enumerating simple paths.
 *
 * <p>Guarded by the {@link TemporalGraph} lock, like the entity store.
 */
public class RelationGraph {

    private final EntityStore entityStore;
    private final Map<String, TemporalRelation> relations = new LinkedHashMap<>();
    private final Map<String, Set<String>> outgoing = new HashMap<>();
    private final Map<String, Set<String>> incoming = new HashMap<>();

    public RelationGraph(EntityStore entityStore) {
        this.entityStore = entityStore;
    }

    /**
     * Inserts a relation whose endpoints must both be present in the entity store right now.
     * Endpoints are not revalidated later; eviction removes the relation by cascade instead.
     */
    public void add(TemporalRelation relation) {
        if (relations.containsKey(relation.getId())) {
            throw new DuplicateIdException("Relation", relation.getId());
        }
        if (!entityStore.contains(relation.getSourceEntity())) {
            throw new UnknownEntityException(relation.getId(), relation.getSourceEntity());
        }
        if (!entityStore.contains(relation.getTargetEntity())) {
            throw new UnknownEntityException(relation.getId(), relation.getTargetEntity());
        }
        relations.put(relation.getId(), relation);
        outgoing.computeIfAbsent(relation.getSourceEntity(), k -> new LinkedHashSet<>())
                .add(relation.getId());
        incoming.computeIfAbsent(relation.getTargetEntity(), k -> new LinkedHashSet<>())
                .add(relation.getId());
    }

    public Optional<TemporalRelation> get(String relationId) {
        return Optional.ofNullable(relations.get(relationId));
    }

    public boolean contains(String relationId) {
        return relations.containsKey(relationId);
    }

    public List<String> neighborsOut(String entityId) {
        return List.copyOf(outgoing.getOrDefault(entityId, Set.of()));
    }

    public List<String> neighborsIn(String entityId) {
        return List.copyOf(incoming.getOrDefault(entityId, Set.of()));
    }

    /**
     * Drops every relation incident to the entity, in either direction.
     *
     * @return the removed relations
     */
    public List<TemporalRelation> removeEntityCascade(String entityId) {
        Set<String> incident = new LinkedHashSet<>();
        incident.addAll(outgoing.getOrDefault(entityId, Set.of()));
        incident.addAll(incoming.getOrDefault(entityId, Set.of()));

        List<TemporalRelation> removed = new ArrayList<>(incident.size());
        for (String relationId : incident) {
            TemporalRelation relation = relations.remove(relationId);
            if (relation == null) {
                continue;
            }
            detach(outgoing, relation.getSourceEntity(), relationId);
            detach(incoming, relation.getTargetEntity(), relationId);
            removed.add(relation);
        }
        outgoing.remove(entityId);
        incoming.remove(entityId);
        return removed;
    }

    public int size() {
        return relations.size();
    }

    public Collection<TemporalRelation> all() {
        return relations.values();
    }

    private static void detach(Map<String, Set<String>> adjacency, String entityId, String relationId) {
        Set<String> ids = adjacency.get(entityId);
        if (ids != null) {
            ids.remove(relationId);
            if (ids.isEmpty()) {
                adjacency.remove(entityId);
            }
        }
    }
}
