package com.causalgraph.domain.model;

import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.enums.RelationKind;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Point-in-time summary of the graph and of the latest analytics outputs. */
@Getter
@ToString
@Builder
public class GraphStats {

    private final int entityCount;
    private final int relationCount;
    private final int chainCount;
    private final int patternCount;
    private final Map<EntityKind, Integer> entityKindHistogram;
    private final Map<RelationKind, Integer> relationKindHistogram;

    /** relations / (n * (n - 1)); 0 for fewer than two entities. */
    private final double graphDensity;

    private final int stronglyConnectedComponents;

    /** Validated causal hypotheses accumulated since startup. */
    private final long causalInferenceCount;

    /** Incremented on every mutation of the entity store or relation graph. */
    private final long generation;
}
