package com.causalgraph.api.dto.request;

import com.causalgraph.domain.enums.EntityKind;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for ingesting one entity. The producer supplies the id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemporalEntityRequest {

    @NotBlank(message = "Entity id is required")
    @Size(max = 200, message = "Entity id must be 200 characters or less")
    private String id;

    @NotNull(message = "Entity kind is required")
    private EntityKind kind;

    /** Scalar values only; numeric ones take part in causal scoring. */
    private Map<String, Object> properties;

    @NotNull(message = "Timestamp is required")
    private Instant timestamp;

    @PositiveOrZero(message = "Duration must not be negative")
    private Long durationMillis;

    @NotNull(message = "Confidence is required")
    @DecimalMin(value = "0.0", message = "Confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Confidence must be between 0 and 1")
    private Double confidence;

    private String source;

    private Map<String, Object> metadata;
}
