package com.causalgraph.chain;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for chain building under the {@code causal-graph.chains} prefix.
 *
 * <ul>
 *   <li>{@code defaultMaxLength} -- path length bound (in edges) when the caller gives none</li>
 *   <li>{@code edgeStrengthThreshold} -- only hypotheses stronger than this become edges</li>
 *   <li>{@code maxChains} -- how many ranked chains are retained</li>
 *   <li>{@code predictionPowerMultiplier} -- tunable constant, not a calibrated model</li>
 *   <li>{@code buildTimeout} -- deadline after which path enumeration stops</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal-graph.chains")
public class ChainBuilderConfig {

    private int defaultMaxLength = 5;
    private double edgeStrengthThreshold = 0.6;
    private int maxChains = 100;
    private double predictionPowerMultiplier = 0.8;
    private Duration buildTimeout = Duration.ofSeconds(10);
}
