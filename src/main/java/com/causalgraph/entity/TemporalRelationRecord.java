package com.causalgraph.entity;

import com.causalgraph.domain.enums.RelationKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the temporal_relations table. Endpoint ids are plain columns, not foreign
 * keys, because entity rows and relation rows are flushed in independent batches.
 */
@Entity
@Table(name = "temporal_relations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemporalRelationRecord {

    @Id
    @Column(name = "id", length = 400)
    private String id;

    @Column(name = "source_entity", nullable = false, length = 200)
    private String sourceEntity;

    @Column(name = "target_entity", nullable = false, length = 200)
    private String targetEntity;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, columnDefinition = "varchar(50)")
    private RelationKind kind;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "strength")
    private double strength;

    @Column(name = "confidence")
    private double confidence;

    @Column(name = "causal_lag_ms")
    private Long causalLagMillis;

    @Column(name = "evidence", columnDefinition = "TEXT")
    private String evidenceJson;

    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadataJson;
}
