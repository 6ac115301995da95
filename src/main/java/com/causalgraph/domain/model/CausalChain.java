package com.causalgraph.domain.model;

import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A simple path of validated causal edges, scored by compounded strength.
 *
 * <p>{@code totalStrength} is the product of edge strengths, so it never exceeds the weakest
 * edge. {@code chainConfidence} divides that by the number of entities on the path and so
 * penalizes long chains. Chains hold copies of ids, never live references, and are rebuilt
 * from scratch on every chain-building run.
 */
@Getter
@ToString
@Builder
public class CausalChain {

    /** Derived from the path itself, so rebuilding an unchanged graph yields the same ids. */
    private final String id;

    private final List<String> entities;

    /** Edge ids along the path, formatted {@code cause->effect}. */
    private final List<String> relations;

    private final double totalStrength;
    private final double chainConfidence;
    private final Duration temporalSpan;
    private final double predictionPower;

    /** Sort key used to rank chains. */
    public double rankScore() {
        return totalStrength * chainConfidence;
    }

    public int length() {
        return entities.size();
    }
}
