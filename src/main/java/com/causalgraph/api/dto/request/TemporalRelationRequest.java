package com.causalgraph.api.dto.request;

import com.causalgraph.domain.enums.RelationKind;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a producer-asserted relation. Both endpoints must already be stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemporalRelationRequest {

    @NotBlank(message = "Relation id is required")
    private String id;

    @NotBlank(message = "Source entity is required")
    private String sourceEntity;

    @NotBlank(message = "Target entity is required")
    private String targetEntity;

    @NotNull(message = "Relation kind is required")
    private RelationKind kind;

    @NotNull(message = "Start time is required")
    private Instant startTime;

    private Instant endTime;

    @NotNull(message = "Strength is required")
    @DecimalMin(value = "0.0", message = "Strength must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Strength must be between 0 and 1")
    private Double strength;

    @NotNull(message = "Confidence is required")
    @DecimalMin(value = "0.0", message = "Confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Confidence must be between 0 and 1")
    private Double confidence;

    @PositiveOrZero(message = "Causal lag must not be negative")
    private Long causalLagMillis;

    private List<String> evidence;

    private Map<String, Object> metadata;
}
