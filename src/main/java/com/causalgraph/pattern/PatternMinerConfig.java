package com.causalgraph.pattern;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for pattern mining under the {@code causal-graph.patterns} prefix.
 *
 * <ul>
 *   <li>{@code minGroupSize} -- kinds with fewer stored entities are skipped</li>
 *   <li>{@code maxVariation} -- coefficient of variation (std / mean) below which spacing counts as stable</li>
 *   <li>{@code maxAccuracy} -- cap on the reported predictive accuracy</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal-graph.patterns")
public class PatternMinerConfig {

    private int minGroupSize = 5;
    private double maxVariation = 0.5;
    private double maxAccuracy = 0.9;
}
