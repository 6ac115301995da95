package com.causalgraph.graph;

import com.causalgraph.domain.model.TemporalRelation;
import java.util.List;

/**
 * Outcome of an eviction: the entity ids removed and the relations dropped with them by cascade.
 */
public record EvictionResult(List<String> entityIds, List<TemporalRelation> relations) {

    public static EvictionResult empty() {
        return new EvictionResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return entityIds.isEmpty();
    }
}
