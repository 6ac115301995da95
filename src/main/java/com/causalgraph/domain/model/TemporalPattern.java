package com.causalgraph.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A roughly periodic recurrence of one entity kind, with an estimated next occurrence.
 * Rebuilt on every pattern-mining run.
 */
@Getter
@ToString
@Builder
public class TemporalPattern {

    private final String id;

    /** {@code periodic_<kind>}, e.g. {@code periodic_technical_indicator}. */
    private final String patternType;

    private final List<String> entitiesInvolved;
    private final TemporalSignature temporalSignature;

    /** Occurrences per second. */
    private final double frequency;

    private final double predictiveAccuracy;
    private final Instant lastOccurrence;
    private final Instant nextPredicted;
}
