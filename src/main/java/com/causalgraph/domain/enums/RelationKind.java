package com.causalgraph.domain.enums;

import java.util.Locale;

/**
 * Type of a directed {@link com.causalgraph.domain.model.TemporalRelation}.
 *
 * <p>Validated causal hypotheses are promoted as {@link #CAUSES}; the other kinds are
 * supplied by producers that already know how two facts relate.
 */
public enum RelationKind {
    CAUSES,
    PRECEDES,
    CORRELATES,
    INFLUENCES,
    TRIGGERS,
    INHIBITS,
    AMPLIFIES,
    FOLLOWS;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
