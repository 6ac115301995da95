package com.causalgraph.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Inter-arrival statistics behind a {@link TemporalPattern}. Intervals are in seconds. */
@Getter
@ToString
@Builder
public class TemporalSignature {

    private final double meanIntervalSeconds;
    private final double stdIntervalSeconds;
    private final double frequencyHz;

    /** {@code 1 - std/mean}; 1.0 means perfectly regular spacing. */
    private final double consistencyScore;
}
