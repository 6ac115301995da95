package com.causalgraph.domain.enums;

import java.util.Locale;

/**
 * Kind of fact recorded as a {@link com.causalgraph.domain.model.TemporalEntity}.
 *
 * <p>The causal compatibility and mechanism tables in
 * {@link com.causalgraph.discovery.CausalCompatibility} switch exhaustively over this enum,
 * so adding a kind forces both tables to be revisited.
 */
public enum EntityKind {
    MARKET_EVENT,
    PRICE_MOVEMENT,
    VOLUME_SPIKE,
    NEWS_EVENT,
    TECHNICAL_INDICATOR,
    TRADING_SIGNAL,
    STRATEGY_OUTPUT,
    ECONOMIC_DATA;

    /** Lower-case code used in pattern types and persisted rows (e.g. "news_event"). */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
