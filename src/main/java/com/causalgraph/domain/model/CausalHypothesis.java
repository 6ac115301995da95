package com.causalgraph.domain.model;

import com.causalgraph.domain.enums.EntityKind;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A candidate cause -> effect pair produced by causal discovery.
 *
 * <p>The endpoint kinds and timestamps are copied at generation time, so chain building can
 * run after the entities themselves have been evicted without chasing dangling ids.
 * {@link #isValidated()} is false for raw candidates and true once the statistical screen
 * accepted the pair (with a boosted strength).
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class CausalHypothesis {

    private final String causeId;
    private final String effectId;
    private final EntityKind causeKind;
    private final EntityKind effectKind;
    private final Instant causeTimestamp;
    private final Instant effectTimestamp;
    private final String mechanism;
    private final double strength;

    @Builder.Default
    private final List<String> evidence = List.of();

    private final boolean validated;

    /** Time between cause and effect. */
    public Duration lag() {
        return Duration.between(causeTimestamp, effectTimestamp);
    }

    /** Returns a validated copy with the given strength and extra evidence appended. */
    public CausalHypothesis validatedWith(double boostedStrength, List<String> extraEvidence) {
        List<String> merged = new ArrayList<>(evidence);
        merged.addAll(extraEvidence);
        return toBuilder()
                .strength(boostedStrength)
                .evidence(List.copyOf(merged))
                .validated(true)
                .build();
    }
}
