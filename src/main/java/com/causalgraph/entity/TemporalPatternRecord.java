package com.causalgraph.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the temporal_patterns table; the signature is stored as JSON text. */
@Entity
@Table(name = "temporal_patterns")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemporalPatternRecord {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "pattern_type", nullable = false, length = 100)
    private String patternType;

    @Column(name = "entities", columnDefinition = "TEXT")
    private String entitiesJson;

    @Column(name = "signature", columnDefinition = "TEXT")
    private String signatureJson;

    @Column(name = "frequency")
    private double frequency;

    @Column(name = "predictive_accuracy")
    private double predictiveAccuracy;

    @Column(name = "last_occurrence")
    private Instant lastOccurrence;

    @Column(name = "next_predicted")
    private Instant nextPredicted;
}
