package com.causalgraph.pattern;

import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalPattern;
import com.causalgraph.domain.model.TemporalSignature;
import com.causalgraph.exception.InsufficientDataException;
import com.causalgraph.graph.GraphSnapshot;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Detects periodic recurrence per entity kind.
 *
 * <p>For each kind with enough stored entities, the consecutive inter-arrival intervals are
 * reduced to mean and (population) standard deviation. A kind whose coefficient of variation
 * is below {@code maxVariation} yields a pattern with {@code frequency = 1 / mean} and a next
 * occurrence one mean interval after the last one.
 *
 * <p>This is a coarse stability screen, not spectral analysis: it cannot see two interleaved
 * periods, phase drift, or a period hidden behind bursts of noise.
 */
@Component
@EnableConfigurationProperties(PatternMinerConfig.class)
public class PatternMiner {

    private static final Logger log = LoggerFactory.getLogger(PatternMiner.class);

    private final PatternMinerConfig patternMinerConfig;

    public PatternMiner(PatternMinerConfig patternMinerConfig) {
        this.patternMinerConfig = patternMinerConfig;
    }

    public List<TemporalPattern> discoverPatterns(GraphSnapshot snapshot) {
        List<TemporalPattern> patterns = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            List<TemporalEntity> group = snapshot.entitiesOfKind(kind);
            try {
                analyzePeriodicity(kind, group).ifPresent(patterns::add);
            } catch (InsufficientDataException e) {
                log.debug("No pattern for {}: {}", kind, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Pattern analysis failed for {}: {}", kind, e.getMessage());
            }
        }
        return patterns;
    }

    /**
     * @param entities the group, ordered by timestamp
     */
    Optional<TemporalPattern> analyzePeriodicity(EntityKind kind, List<TemporalEntity> entities) {
        if (entities.size() < patternMinerConfig.getMinGroupSize()) {
            throw new InsufficientDataException(kind.name(), patternMinerConfig.getMinGroupSize(), entities.size());
        }

        double[] intervals = new double[entities.size() - 1];
        for (int i = 1; i < entities.size(); i++) {
            Duration gap = Duration.between(entities.get(i - 1).getTimestamp(), entities.get(i).getTimestamp());
            intervals[i - 1] = gap.toMillis() / 1000.0;
        }

        double mean = new Mean().evaluate(intervals);
        if (mean <= 0.0) {
            // all occurrences share one timestamp, no period to speak of
            return Optional.empty();
        }
        double std = new StandardDeviation(false).evaluate(intervals);
        double variation = std / mean;
        if (variation >= patternMinerConfig.getMaxVariation()) {
            return Optional.empty();
        }

        double frequency = 1.0 / mean;
        double consistency = 1.0 - variation;
        TemporalEntity last = entities.get(entities.size() - 1);
        Instant lastOccurrence = last.getTimestamp();

        return Optional.of(TemporalPattern.builder()
                .id("pattern_" + kind.code() + "_" + fingerprint(intervals))
                .patternType("periodic_" + kind.code())
                .entitiesInvolved(entities.stream().map(TemporalEntity::getId).toList())
                .temporalSignature(TemporalSignature.builder()
                        .meanIntervalSeconds(mean)
                        .stdIntervalSeconds(std)
                        .frequencyHz(frequency)
                        .consistencyScore(consistency)
                        .build())
                .frequency(frequency)
                .predictiveAccuracy(Math.min(patternMinerConfig.getMaxAccuracy(), consistency))
                .lastOccurrence(lastOccurrence)
                .nextPredicted(lastOccurrence.plusMillis(Math.round(mean * 1000.0)))
                .build());
    }

    private static String fingerprint(double[] intervals) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(Arrays.toString(intervals).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
