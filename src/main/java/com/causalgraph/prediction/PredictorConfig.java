package com.causalgraph.prediction;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for event prediction under the {@code causal-graph.prediction} prefix.
 *
 * <p>Chain gating:
 * <ul>
 *   <li>{@code minPredictionPower} -- chains at or below this are ignored</li>
 *   <li>{@code activityThreshold} -- chains whose recent activity is at or below this are ignored</li>
 *   <li>{@code activityWindow} -- how far back an entity still counts as recent</li>
 *   <li>{@code maxPredictions} -- cap on returned predictions</li>
 *   <li>{@code defaultHorizon} -- horizon used when the caller gives none</li>
 * </ul>
 *
 * <p>Risk annotation: {@code longChainEntities}, {@code lowConfidence}, {@code extendedSpan}
 * and {@code highProbabilityStrength}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal-graph.prediction")
public class PredictorConfig {

    private double minPredictionPower = 0.5;
    private double activityThreshold = 0.3;
    private Duration activityWindow = Duration.ofHours(2);
    private int maxPredictions = 20;
    private Duration defaultHorizon = Duration.ofHours(4);

    private int longChainEntities = 3;
    private double lowConfidence = 0.7;
    private Duration extendedSpan = Duration.ofDays(1);
    private double highProbabilityStrength = 0.8;
}
