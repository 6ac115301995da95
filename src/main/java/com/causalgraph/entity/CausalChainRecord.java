package com.causalgraph.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the causal_chains table. Chain ids are derived from the path, so a chain
 * found again by a later run overwrites its earlier row with the new scores.
 */
@Entity
@Table(name = "causal_chains")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CausalChainRecord {

    @Id
    @Column(name = "id", length = 32)
    private String id;

    @Column(name = "entities", columnDefinition = "TEXT")
    private String entitiesJson;

    @Column(name = "relations", columnDefinition = "TEXT")
    private String relationsJson;

    @Column(name = "total_strength")
    private double totalStrength;

    @Column(name = "chain_confidence")
    private double chainConfidence;

    @Column(name = "span_ms")
    private Long temporalSpanMillis;

    @Column(name = "prediction_power")
    private double predictionPower;
}
