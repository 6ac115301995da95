package com.causalgraph.discovery;

import com.causalgraph.domain.model.TemporalEntity;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Extraction of numeric values from entity property maps.
 *
 * <p>Only {@link Number} values count; strings, booleans and non-finite numbers are ignored,
 * so a malformed property simply drops out of the comparison instead of failing the run.
 */
public final class NumericProperties {

    /** Keys checked, in order, for an entity's primary value. */
    private static final String[] PRIMARY_KEYS = {"value", "price", "volume"};

    private NumericProperties() {}

    /** Numeric properties of the entity, sorted by key. */
    public static Map<String, Double> of(TemporalEntity entity) {
        Map<String, Double> numeric = new TreeMap<>();
        for (Map.Entry<String, Object> property : entity.getProperties().entrySet()) {
            toDouble(property.getValue()).ifPresent(v -> numeric.put(property.getKey(), v));
        }
        return numeric;
    }

    /**
     * The value that represents this entity in a time series: the first of {@code value},
     * {@code price}, {@code volume} that is numeric, else the first numeric property in key
     * order, else the entity's confidence.
     */
    public static double primaryValue(TemporalEntity entity) {
        for (String key : PRIMARY_KEYS) {
            Optional<Double> value = toDouble(entity.getProperties().get(key));
            if (value.isPresent()) {
                return value.get();
            }
        }
        Map<String, Double> numeric = of(entity);
        if (!numeric.isEmpty()) {
            return numeric.values().iterator().next();
        }
        return entity.getConfidence();
    }

    static Optional<Double> toDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isFinite(d)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
