package com.causalgraph.unit.pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalPattern;
import com.causalgraph.graph.GraphSnapshot;
import com.causalgraph.pattern.PatternMiner;
import com.causalgraph.pattern.PatternMinerConfig;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PatternMinerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private PatternMiner patternMiner;

    @BeforeEach
    void setUp() {
        patternMiner = new PatternMiner(new PatternMinerConfig());
    }

    /** Entities of one kind at T0 followed by the given gaps in seconds. */
    private static List<TemporalEntity> series(EntityKind kind, long... gapsSeconds) {
        List<TemporalEntity> entities = new ArrayList<>();
        Instant ts = T0;
        entities.add(entity(kind.code() + "_0", kind, ts));
        for (int i = 0; i < gapsSeconds.length; i++) {
            ts = ts.plusSeconds(gapsSeconds[i]);
            entities.add(entity(kind.code() + "_" + (i + 1), kind, ts));
        }
        return entities;
    }

    private static TemporalEntity entity(String id, EntityKind kind, Instant ts) {
        return TemporalEntity.builder().id(id).kind(kind).timestamp(ts).confidence(0.9).build();
    }

    private static GraphSnapshot snapshotOf(List<TemporalEntity> entities) {
        List<TemporalEntity> ordered = new ArrayList<>(entities);
        ordered.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        return new GraphSnapshot(1, ordered, List.of());
    }

    @Test
    @DisplayName("five indicator readings a minute apart form a periodic pattern")
    void regularSeries() {
        List<TemporalPattern> patterns =
                patternMiner.discoverPatterns(snapshotOf(series(EntityKind.TECHNICAL_INDICATOR, 60, 60, 60, 60)));

        assertThat(patterns).hasSize(1);
        TemporalPattern pattern = patterns.get(0);
        assertThat(pattern.getPatternType()).isEqualTo("periodic_technical_indicator");
        assertThat(pattern.getId()).startsWith("pattern_technical_indicator_").hasSize(
                "pattern_technical_indicator_".length() + 8);
        assertThat(pattern.getFrequency()).isCloseTo(1.0 / 60, within(1e-12));
        assertThat(pattern.getPredictiveAccuracy()).isCloseTo(0.9, within(1e-12));
        assertThat(pattern.getTemporalSignature().getMeanIntervalSeconds()).isCloseTo(60.0, within(1e-12));
        assertThat(pattern.getTemporalSignature().getStdIntervalSeconds()).isZero();
        assertThat(pattern.getTemporalSignature().getConsistencyScore()).isCloseTo(1.0, within(1e-12));
        assertThat(pattern.getEntitiesInvolved()).hasSize(5).startsWith("technical_indicator_0");
        assertThat(pattern.getLastOccurrence()).isEqualTo(T0.plusSeconds(240));
        assertThat(pattern.getNextPredicted()).isEqualTo(T0.plusSeconds(300));
    }

    @Test
    @DisplayName("moderately variable spacing lowers accuracy to the consistency score")
    void variableSeries() {
        List<TemporalPattern> patterns =
                patternMiner.discoverPatterns(snapshotOf(series(EntityKind.VOLUME_SPIKE, 50, 70, 50, 70)));

        assertThat(patterns).singleElement().satisfies(p -> {
            assertThat(p.getTemporalSignature().getStdIntervalSeconds()).isCloseTo(10.0, within(1e-9));
            assertThat(p.getPredictiveAccuracy()).isCloseTo(1.0 - 10.0 / 60.0, within(1e-9));
        });
    }

    @Test
    @DisplayName("fewer than five entities of a kind yield no pattern")
    void tooFewEntities() {
        assertThat(patternMiner.discoverPatterns(snapshotOf(series(EntityKind.NEWS_EVENT, 60, 60, 60)))).isEmpty();
    }

    @Test
    @DisplayName("irregular spacing yields no pattern")
    void irregularSeries() {
        assertThat(patternMiner.discoverPatterns(snapshotOf(series(EntityKind.NEWS_EVENT, 10, 200, 15, 300))))
                .isEmpty();
    }

    @Test
    @DisplayName("a burst sharing one timestamp has no period")
    void zeroIntervals() {
        assertThat(patternMiner.discoverPatterns(snapshotOf(series(EntityKind.MARKET_EVENT, 0, 0, 0, 0)))).isEmpty();
    }

    @Test
    @DisplayName("kinds are analyzed independently and a failing kind does not hide the others")
    void kindsIndependent() {
        List<TemporalEntity> entities = new ArrayList<>(series(EntityKind.TECHNICAL_INDICATOR, 60, 60, 60, 60));
        entities.addAll(series(EntityKind.PRICE_MOVEMENT, 30, 30, 30, 30, 30));
        entities.addAll(series(EntityKind.NEWS_EVENT, 5));

        List<TemporalPattern> patterns = patternMiner.discoverPatterns(snapshotOf(entities));

        assertThat(patterns).extracting(TemporalPattern::getPatternType)
                .containsExactlyInAnyOrder("periodic_technical_indicator", "periodic_price_movement");
    }

    @Test
    @DisplayName("mining the same data twice gives the same pattern id")
    void stableIds() {
        GraphSnapshot snapshot = snapshotOf(series(EntityKind.TECHNICAL_INDICATOR, 60, 60, 60, 60));

        assertThat(patternMiner.discoverPatterns(snapshot).get(0).getId())
                .isEqualTo(patternMiner.discoverPatterns(snapshot).get(0).getId());
    }
}
