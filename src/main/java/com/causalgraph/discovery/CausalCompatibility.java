package com.causalgraph.discovery;

import com.causalgraph.domain.enums.EntityKind;

/**
 * Fixed lookup tables for how plausible it is that one entity kind causes another, and by
 * which mechanism.
 *
 * <p>Both tables switch exhaustively over the cause kind, so a new {@link EntityKind} does not
 * compile until it has been placed here. Unlisted pairs score {@value #DEFAULT_COMPATIBILITY}
 * and map to {@value #UNKNOWN_MECHANISM}.
 */
public final class CausalCompatibility {

    public static final double DEFAULT_COMPATIBILITY = 0.2;
    public static final String UNKNOWN_MECHANISM = "unknown_mechanism";

    private CausalCompatibility() {}

    public static double score(EntityKind cause, EntityKind effect) {
        return switch (cause) {
            case NEWS_EVENT -> effect == EntityKind.PRICE_MOVEMENT ? 0.9 : DEFAULT_COMPATIBILITY;
            case ECONOMIC_DATA -> effect == EntityKind.MARKET_EVENT ? 0.8 : DEFAULT_COMPATIBILITY;
            case TECHNICAL_INDICATOR -> effect == EntityKind.TRADING_SIGNAL ? 0.7 : DEFAULT_COMPATIBILITY;
            case VOLUME_SPIKE -> effect == EntityKind.PRICE_MOVEMENT ? 0.6 : DEFAULT_COMPATIBILITY;
            case TRADING_SIGNAL -> effect == EntityKind.STRATEGY_OUTPUT ? 0.8 : DEFAULT_COMPATIBILITY;
            case MARKET_EVENT -> effect == EntityKind.VOLUME_SPIKE ? 0.5 : DEFAULT_COMPATIBILITY;
            case PRICE_MOVEMENT, STRATEGY_OUTPUT -> DEFAULT_COMPATIBILITY;
        };
    }

    public static String mechanism(EntityKind cause, EntityKind effect) {
        return switch (cause) {
            case NEWS_EVENT -> effect == EntityKind.PRICE_MOVEMENT ? "information_impact" : UNKNOWN_MECHANISM;
            case ECONOMIC_DATA -> effect == EntityKind.MARKET_EVENT ? "fundamental_analysis" : UNKNOWN_MECHANISM;
            case TECHNICAL_INDICATOR -> effect == EntityKind.TRADING_SIGNAL ? "technical_analysis" : UNKNOWN_MECHANISM;
            case VOLUME_SPIKE -> effect == EntityKind.PRICE_MOVEMENT ? "liquidity_impact" : UNKNOWN_MECHANISM;
            case TRADING_SIGNAL -> effect == EntityKind.STRATEGY_OUTPUT ? "algorithmic_execution" : UNKNOWN_MECHANISM;
            case MARKET_EVENT -> effect == EntityKind.VOLUME_SPIKE ? "market_reaction" : UNKNOWN_MECHANISM;
            case PRICE_MOVEMENT, STRATEGY_OUTPUT -> UNKNOWN_MECHANISM;
        };
    }
}
