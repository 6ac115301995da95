package com.causalgraph.entity;

import com.causalgraph.domain.enums.EntityKind;
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
 * JPA entity for the temporal_entities table.
 *
 * <p>Append-only archive of every ingested entity. Rows outlive in-memory eviction, so the
 * table is the long-term history the live graph no longer holds. Property and metadata
 * maps are stored as JSON text.
 */
@Entity
@Table(name = "temporal_entities")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemporalEntityRecord {

    @Id
    @Column(name = "id", length = 200)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, columnDefinition = "varchar(50)")
    private EntityKind kind;

    @Column(name = "properties", columnDefinition = "TEXT")
    private String propertiesJson;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "duration_ms")
    private Long durationMillis;

    @Column(name = "confidence")
    private double confidence;

    @Column(name = "source", length = 100)
    private String source;

    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadataJson;
}
