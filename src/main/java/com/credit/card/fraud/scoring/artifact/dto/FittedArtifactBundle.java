package com.credit.card.fraud.scoring.artifact.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 버전 단위로 고정된 아티팩트 묶음. 서빙 중에는 절대 변경되지 않는다.
 */
@Value
@Builder
public class FittedArtifactBundle {

    String modelVersion;
    FeatureArtifacts featureArtifacts;
    ModelFeatureContracts contracts;

    public FeatureSchema frozenSchema() {
        return featureArtifacts.getFrozenSchema();
    }

    public double decisionThreshold() {
        return contracts.getDecisionThreshold();
    }
}
