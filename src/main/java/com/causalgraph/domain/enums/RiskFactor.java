package com.causalgraph.domain.enums;

/**
 * Heuristic annotations attached to a prediction, derived from the shape of the
 * causal chain it came from. They flag reasons to distrust the prediction, not guarantees.
 */
public enum RiskFactor {
    /** Chain has more than the configured number of entities. */
    LONG_CAUSAL_CHAIN,
    /** Chain confidence below the configured floor. */
    LOW_CONFIDENCE,
    /** Chain spans more time than the configured maximum. */
    EXTENDED_TEMPORAL_SPAN
}
