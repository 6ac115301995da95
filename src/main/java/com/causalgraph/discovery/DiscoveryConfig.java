package com.causalgraph.discovery;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for causal discovery under the {@code causal-graph.discovery} prefix.
 *
 * <p>The three weights are applied to temporal proximity, kind compatibility and property
 * similarity. The validation thresholds belong to the one-lag correlation screen; they were
 * tuned against that screen and must be revisited if it is ever replaced with a full
 * autoregressive Granger test.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal-graph.discovery")
public class DiscoveryConfig {

    /** Pairs further apart than this get no temporal-proximity credit. */
    private Duration maxLag = Duration.ofHours(1);

    private double temporalWeight = 0.3;
    private double compatibilityWeight = 0.4;
    private double propertyWeight = 0.3;

    /** A pair becomes a hypothesis only when its combined score is strictly above this. */
    private double hypothesisThreshold = 0.5;

    private int minSeriesPoints = 3;
    private double pValueThreshold = 0.1;
    private double correlationThreshold = 0.3;

    /** Promote validated hypotheses into CAUSES relations of the relation graph. */
    private boolean promoteValidated = true;
}
