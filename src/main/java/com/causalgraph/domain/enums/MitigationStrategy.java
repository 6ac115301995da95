package com.causalgraph.domain.enums;

/**
 * Suggested responses to a prediction. Always includes the two general strategies plus
 * one chosen on the chain's total strength.
 */
public enum MitigationStrategy {
    MONITOR_EARLY_INDICATORS,
    DIVERSIFY_EXPOSURE,
    PREPARE_FOR_HIGH_PROBABILITY_EVENT,
    MAINTAIN_DEFENSIVE_POSITION
}
