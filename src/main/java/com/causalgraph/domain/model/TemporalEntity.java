package com.causalgraph.domain.model;

import com.causalgraph.domain.enums.EntityKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A timestamped fact ingested into the graph (a news item, a price move, an indicator reading...).
 *
 * <p>Entities are immutable: the property and metadata maps are copied on construction and
 * exposed read-only, so a reader can never observe a half-populated property map. An entity
 * lives until retention eviction removes it from the
 * {@link com.causalgraph.graph.EntityStore}.
 *
 * <p>Property values are scalars (numbers, strings, booleans). Only numeric values take part
 * in property correlation and time-series extraction.
 */
@Getter
@ToString
public class TemporalEntity {

    private final String id;
    private final EntityKind kind;
    private final Map<String, Object> properties;
    private final Instant timestamp;
    private final Duration duration;

    /** Producer's confidence in this fact, in [0, 1]. */
    private final double confidence;

    /** Producer identifier (e.g. "news_feed", "price_feed"). */
    private final String source;

    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    public TemporalEntity(
            String id,
            EntityKind kind,
            Map<String, Object> properties,
            Instant timestamp,
            Duration duration,
            double confidence,
            String source,
            Map<String, Object> metadata) {
        this.id = id;
        this.kind = kind;
        this.properties = copyOf(properties);
        this.timestamp = timestamp;
        this.duration = duration != null ? duration : Duration.ZERO;
        this.confidence = confidence;
        this.source = source;
        this.metadata = copyOf(metadata);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
