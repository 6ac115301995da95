package com.causalgraph.discovery;

import com.causalgraph.discovery.CausalityStatistics.LaggedCorrelation;
import com.causalgraph.domain.model.CausalHypothesis;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.exception.InsufficientDataException;
import com.causalgraph.graph.GraphSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Generates and statistically screens causal hypotheses between entity pairs.
 *
 * <p><b>Discovery</b> scores every ordered pair (a, b) in the window with
 * {@code a.timestamp < b.timestamp} as a weighted sum of:
 * <ul>
 *   <li>temporal proximity: {@code 1 - dt / maxLag}, zero beyond maxLag</li>
 *   <li>kind compatibility from {@link CausalCompatibility}</li>
 *   <li>mean similarity of the numeric properties both entities share</li>
 * </ul>
 * Pairs scoring above the threshold become unvalidated hypotheses.
 *
 * <p><b>Validation</b> builds a time series for each side from its producer stream's history
 * and keeps the hypothesis only if the lagged-correlation pseudo p-value and the best
 * cross-correlation both pass, boosting its strength to
 * {@code (strength + (1 - p) * |corr|) / 2}.
 *
 * <p>Both steps work on a {@link GraphSnapshot} and are pure functions of it. A candidate that
 * fails for any reason is logged and dropped; the rest of the batch carries on.
 */
@Component
@EnableConfigurationProperties(DiscoveryConfig.class)
public class CausalDiscoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(CausalDiscoveryEngine.class);

    private final DiscoveryConfig discoveryConfig;

    public CausalDiscoveryEngine(DiscoveryConfig discoveryConfig) {
        this.discoveryConfig = discoveryConfig;
    }

    /**
     * Scores all ordered pairs of entities with timestamps in {@code [now - window, now]}.
     *
     * @return unvalidated hypotheses, in (cause time, effect time) order
     */
    public List<CausalHypothesis> discover(GraphSnapshot snapshot, Instant now, Duration window) {
        List<TemporalEntity> entities = snapshot.entitiesBetween(now.minus(window), now);
        List<CausalHypothesis> hypotheses = new ArrayList<>();

        for (int i = 0; i < entities.size(); i++) {
            TemporalEntity cause = entities.get(i);
            for (int j = i + 1; j < entities.size(); j++) {
                TemporalEntity effect = entities.get(j);
                if (!cause.getTimestamp().isBefore(effect.getTimestamp())) {
                    continue;
                }
                try {
                    scorePair(cause, effect).ifPresent(hypotheses::add);
                } catch (RuntimeException e) {
                    log.warn("Skipping pair {} -> {}: {}", cause.getId(), effect.getId(), e.getMessage());
                }
            }
        }

        log.debug("Scored {} entities in window {}, {} candidate hypotheses", entities.size(), window, hypotheses.size());
        return hypotheses;
    }

    /**
     * Screens hypotheses against the recorded history of both endpoints.
     *
     * @return the accepted hypotheses with boosted strength and statistical evidence appended
     */
    public List<CausalHypothesis> validate(GraphSnapshot snapshot, List<CausalHypothesis> hypotheses) {
        List<CausalHypothesis> validated = new ArrayList<>();
        int insufficient = 0;

        for (CausalHypothesis hypothesis : hypotheses) {
            try {
                Optional<CausalHypothesis> accepted = validateOne(snapshot, hypothesis);
                accepted.ifPresent(validated::add);
            } catch (InsufficientDataException e) {
                insufficient++;
                log.debug("Hypothesis {} -> {} dropped: {}",
                        hypothesis.getCauseId(), hypothesis.getEffectId(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Hypothesis {} -> {} dropped after validation error: {}",
                        hypothesis.getCauseId(), hypothesis.getEffectId(), e.getMessage());
            }
        }

        log.debug("Validated {}/{} hypotheses ({} with insufficient data)",
                validated.size(), hypotheses.size(), insufficient);
        return validated;
    }

    /** Combined causal-strength score for a cause/effect pair, clamped to [0, 1]. */
    public double causalStrength(TemporalEntity cause, TemporalEntity effect) {
        Duration lag = Duration.between(cause.getTimestamp(), effect.getTimestamp());
        double score = temporalProximity(lag) * discoveryConfig.getTemporalWeight()
                + CausalCompatibility.score(cause.getKind(), effect.getKind()) * discoveryConfig.getCompatibilityWeight()
                + propertySimilarity(NumericProperties.of(cause), NumericProperties.of(effect))
                        * discoveryConfig.getPropertyWeight();
        return Math.max(0.0, Math.min(1.0, score));
    }

    /** {@code 1 - lag / maxLag}, clipped to [0, 1]; zero beyond maxLag. */
    public double temporalProximity(Duration lag) {
        long maxLagMillis = discoveryConfig.getMaxLag().toMillis();
        long lagMillis = lag.toMillis();
        if (maxLagMillis <= 0 || lagMillis > maxLagMillis) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - (double) lagMillis / maxLagMillis));
    }

    /**
     * Mean per-key similarity over numeric properties present on both sides:
     * {@code 1 - |x - y| / max(|x|, |y|)}, 1.0 when both are zero, 0.0 when only one is.
     * Returns 0.0 when there are no shared keys.
     */
    public static double propertySimilarity(Map<String, Double> cause, Map<String, Double> effect) {
        double sum = 0.0;
        int shared = 0;
        for (Map.Entry<String, Double> entry : cause.entrySet()) {
            Double other = effect.get(entry.getKey());
            if (other == null) {
                continue;
            }
            double x = entry.getValue();
            double y = other;
            double similarity;
            if (x == 0.0 && y == 0.0) {
                similarity = 1.0;
            } else if (x == 0.0 || y == 0.0) {
                similarity = 0.0;
            } else {
                similarity = 1.0 - Math.abs(x - y) / Math.max(Math.abs(x), Math.abs(y));
            }
            sum += similarity;
            shared++;
        }
        return shared == 0 ? 0.0 : sum / shared;
    }

    // ---- Internal ----

    private Optional<CausalHypothesis> scorePair(TemporalEntity cause, TemporalEntity effect) {
        double strength = causalStrength(cause, effect);
        if (strength <= discoveryConfig.getHypothesisThreshold()) {
            return Optional.empty();
        }
        long lagSeconds = Duration.between(cause.getTimestamp(), effect.getTimestamp()).getSeconds();
        return Optional.of(CausalHypothesis.builder()
                .causeId(cause.getId())
                .effectId(effect.getId())
                .causeKind(cause.getKind())
                .effectKind(effect.getKind())
                .causeTimestamp(cause.getTimestamp())
                .effectTimestamp(effect.getTimestamp())
                .mechanism(CausalCompatibility.mechanism(cause.getKind(), effect.getKind()))
                .strength(strength)
                .evidence(List.of("temporal_precedence_" + lagSeconds + "s"))
                .validated(false)
                .build());
    }

    private Optional<CausalHypothesis> validateOne(GraphSnapshot snapshot, CausalHypothesis hypothesis) {
        TemporalEntity cause = snapshot.entity(hypothesis.getCauseId())
                .orElseThrow(() -> new InsufficientDataException("Evicted cause " + hypothesis.getCauseId(),
                        discoveryConfig.getMinSeriesPoints(), 0));
        TemporalEntity effect = snapshot.entity(hypothesis.getEffectId())
                .orElseThrow(() -> new InsufficientDataException("Evicted effect " + hypothesis.getEffectId(),
                        discoveryConfig.getMinSeriesPoints(), 0));

        double[] causeSeries = series(snapshot, cause);
        double[] effectSeries = series(snapshot, effect);
        double[][] aligned = CausalityStatistics.alignLatest(causeSeries, effectSeries);

        double pValue = CausalityStatistics.laggedCausalityPValue(aligned[0], aligned[1]);
        LaggedCorrelation best = CausalityStatistics.crossCorrelation(aligned[0], aligned[1]);
        double correlation = Math.abs(best.correlation());

        if (pValue >= discoveryConfig.getPValueThreshold() || correlation <= discoveryConfig.getCorrelationThreshold()) {
            log.debug("Hypothesis {} -> {} rejected: p={} corr={}",
                    hypothesis.getCauseId(), hypothesis.getEffectId(), pValue, best.correlation());
            return Optional.empty();
        }

        double boosted = (hypothesis.getStrength() + (1.0 - pValue) * correlation) / 2.0;
        return Optional.of(hypothesis.validatedWith(
                boosted,
                List.of(
                        String.format(Locale.ROOT, "granger_p=%.3f", pValue),
                        String.format(Locale.ROOT, "correlation=%.3f", best.correlation()),
                        "lag=" + best.lag())));
    }

    private double[] series(GraphSnapshot snapshot, TemporalEntity entity) {
        List<TemporalEntity> history = snapshot.historyOf(entity);
        if (history.size() < discoveryConfig.getMinSeriesPoints()) {
            throw new InsufficientDataException(
                    "Series of " + entity.getId(), discoveryConfig.getMinSeriesPoints(), history.size());
        }
        double[] values = new double[history.size()];
        for (int i = 0; i < history.size(); i++) {
            values[i] = NumericProperties.primaryValue(history.get(i));
        }
        return values;
    }
}
