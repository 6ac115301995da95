package com.causalgraph.event;

/**
 * One constant per analytics run that completed and published a new result.
 */
public enum AnalyticsEventType {
    HYPOTHESES_DISCOVERED,
    CHAINS_BUILT,
    PATTERNS_DISCOVERED,
    PREDICTIONS_GENERATED
}
