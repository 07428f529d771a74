package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.artifact.dto.FittedArtifactBundle;
import com.credit.card.fraud.scoring.decision.service.StackedDecisionModel;
import com.credit.card.fraud.scoring.ensemble.service.BaseSignalEnsemble;
import lombok.Builder;
import lombok.Value;

/**
 * 시작 시 한 번 로드되어 모든 요청이 공유하는 불변 묶음
 */
@Value
@Builder
public class LoadedModelBundle {

    FittedArtifactBundle artifacts;
    BaseSignalEnsemble ensemble;
    StackedDecisionModel decisionModel;

    public String modelVersion() {
        return artifacts.getModelVersion();
    }
}
