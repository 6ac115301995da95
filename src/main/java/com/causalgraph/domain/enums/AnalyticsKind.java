package com.causalgraph.domain.enums;

/** The four analytics runs. At most one run of each kind is in flight at a time. */
public enum AnalyticsKind {
    CAUSAL_DISCOVERY,
    CHAIN_BUILDING,
    PATTERN_MINING,
    PREDICTION
}
