package com.causalgraph.prediction;

import com.causalgraph.domain.enums.MitigationStrategy;
import com.causalgraph.domain.enums.RiskFactor;
import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.Prediction;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.graph.GraphSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Turns currently active causal chains into predictions about the chain's final effect.
 *
 * <p>A chain qualifies when its prediction power exceeds {@code minPredictionPower} and its
 * activity exceeds {@code activityThreshold}. Activity is the sum over the chain's stored
 * entities seen within {@code activityWindow} of {@code recency * confidence}, divided by the
 * chain length and capped at 1. Recency falls linearly from 1 (now) to 0 (window edge).
 *
 * <p>The predicted time is {@code now + temporalSpan / max(1, length - 1)}, the mean hop lag.
 * Predictions beyond the horizon are dropped, as are chains whose final entity is no longer
 * stored. The rest are sorted by confidence and capped at {@code maxPredictions}.
 */
@Component
@EnableConfigurationProperties(PredictorConfig.class)
public class Predictor {

    private static final Logger log = LoggerFactory.getLogger(Predictor.class);

    private final PredictorConfig predictorConfig;

    public Predictor(PredictorConfig predictorConfig) {
        this.predictorConfig = predictorConfig;
    }

    public List<Prediction> predict(List<CausalChain> chains, GraphSnapshot snapshot, Instant now, Duration horizon) {
        List<Prediction> predictions = new ArrayList<>();
        int active = 0;

        for (CausalChain chain : chains) {
            if (chain.getPredictionPower() <= predictorConfig.getMinPredictionPower()) {
                continue;
            }
            double activity = chainActivity(chain, snapshot, now);
            if (activity <= predictorConfig.getActivityThreshold()) {
                continue;
            }
            active++;
            predictFromChain(chain, snapshot, now, horizon).ifPresent(predictions::add);
        }

        predictions.sort(Comparator.comparingDouble(Prediction::getConfidence).reversed());
        List<Prediction> top = predictions.size() > predictorConfig.getMaxPredictions()
                ? predictions.subList(0, predictorConfig.getMaxPredictions())
                : predictions;

        log.debug("{} of {} chains active, {} predictions within {}", active, chains.size(), top.size(), horizon);
        return List.copyOf(top);
    }

    /** Recency-weighted confidence of the chain's recent entities, normalized by chain length. */
    public double chainActivity(CausalChain chain, GraphSnapshot snapshot, Instant now) {
        if (chain.getEntities().isEmpty()) {
            return 0.0;
        }
        double windowMillis = predictorConfig.getActivityWindow().toMillis();
        double score = 0.0;
        for (String entityId : chain.getEntities()) {
            Optional<TemporalEntity> entity = snapshot.entity(entityId);
            if (entity.isEmpty()) {
                continue;
            }
            long ageMillis = Duration.between(entity.get().getTimestamp(), now).toMillis();
            if (ageMillis > windowMillis) {
                continue;
            }
            // entities stamped after now count as fully recent
            double recency = Math.min(1.0, 1.0 - ageMillis / windowMillis);
            score += recency * entity.get().getConfidence();
        }
        return Math.min(1.0, score / chain.getEntities().size());
    }

    public List<RiskFactor> riskFactors(CausalChain chain) {
        List<RiskFactor> risks = new ArrayList<>();
        if (chain.length() > predictorConfig.getLongChainEntities()) {
            risks.add(RiskFactor.LONG_CAUSAL_CHAIN);
        }
        if (chain.getChainConfidence() < predictorConfig.getLowConfidence()) {
            risks.add(RiskFactor.LOW_CONFIDENCE);
        }
        if (chain.getTemporalSpan().compareTo(predictorConfig.getExtendedSpan()) > 0) {
            risks.add(RiskFactor.EXTENDED_TEMPORAL_SPAN);
        }
        return risks;
    }

    public List<MitigationStrategy> mitigationStrategies(CausalChain chain) {
        return List.of(
                MitigationStrategy.MONITOR_EARLY_INDICATORS,
                MitigationStrategy.DIVERSIFY_EXPOSURE,
                chain.getTotalStrength() > predictorConfig.getHighProbabilityStrength()
                        ? MitigationStrategy.PREPARE_FOR_HIGH_PROBABILITY_EVENT
                        : MitigationStrategy.MAINTAIN_DEFENSIVE_POSITION);
    }

    // ---- Internal ----

    private Optional<Prediction> predictFromChain(CausalChain chain, GraphSnapshot snapshot, Instant now, Duration horizon) {
        String lastId = chain.getEntities().get(chain.getEntities().size() - 1);
        Optional<TemporalEntity> last = snapshot.entity(lastId);
        if (last.isEmpty()) {
            log.debug("Chain {} ends in evicted entity {}, no prediction", chain.getId(), lastId);
            return Optional.empty();
        }

        Duration meanLag = chain.getTemporalSpan().dividedBy(Math.max(1, chain.length() - 1));
        Instant predictedTime = now.plus(meanLag);
        if (predictedTime.isAfter(now.plus(horizon))) {
            return Optional.empty();
        }

        return Optional.of(Prediction.builder()
                .id("pred_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8))
                .predictedKind(last.get().getKind())
                .predictedTime(predictedTime)
                .confidence(chain.getPredictionPower())
                .chainId(chain.getId())
                .reasoning("Causal chain with " + chain.length() + " entities")
                .expectedProperties(last.get().getProperties())
                .riskFactors(List.copyOf(riskFactors(chain)))
                .mitigationStrategies(mitigationStrategies(chain))
                .build());
    }
}
