package com.causalgraph.domain.model;

import com.causalgraph.domain.enums.RelationKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A directed, typed, weighted edge between two entities.
 *
 * <p>Endpoints are checked against the entity store at insertion time only; the relation is
 * removed by cascade when either endpoint is evicted. Relations are immutable once created.
 */
@Getter
@ToString
public class TemporalRelation {

    private final String id;
    private final String sourceEntity;
    private final String targetEntity;
    private final RelationKind kind;
    private final Instant startTime;

    /** Optional. When present, never before {@link #startTime}. */
    private final Instant endTime;

    private final double strength;
    private final double confidence;
    private final Duration causalLag;
    private final List<String> evidence;
    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    public TemporalRelation(
            String id,
            String sourceEntity,
            String targetEntity,
            RelationKind kind,
            Instant startTime,
            Instant endTime,
            double strength,
            double confidence,
            Duration causalLag,
            List<String> evidence,
            Map<String, Object> metadata) {
        this.id = id;
        this.sourceEntity = sourceEntity;
        this.targetEntity = targetEntity;
        this.kind = kind;
        this.startTime = startTime;
        this.endTime = endTime;
        this.strength = strength;
        this.confidence = confidence;
        this.causalLag = causalLag != null ? causalLag : Duration.ZERO;
        this.evidence = evidence != null ? List.copyOf(evidence) : List.of();
        this.metadata = metadata != null && !metadata.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }
}
