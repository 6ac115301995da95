package com.causalgraph.domain.model;

import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.enums.MitigationStrategy;
import com.causalgraph.domain.enums.RiskFactor;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A projected future event derived from a currently active causal chain.
 *
 * <p>The predicted kind and expected properties are copied from the chain's final entity;
 * the confidence is the chain's prediction power.
 */
@Getter
@ToString
@Builder
public class Prediction {

    private final String id;
    private final EntityKind predictedKind;
    private final Instant predictedTime;
    private final double confidence;
    private final String chainId;
    private final String reasoning;
    private final Map<String, Object> expectedProperties;
    private final List<RiskFactor> riskFactors;
    private final List<MitigationStrategy> mitigationStrategies;
}
