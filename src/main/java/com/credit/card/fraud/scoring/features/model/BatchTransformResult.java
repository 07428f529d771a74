package com.credit.card.fraud.scoring.features.model;

import com.credit.card.fraud.scoring.artifact.dto.FeatureArtifacts;
import lombok.Value;

import java.util.List;

/**
 * 배치 변환 결과. vectors는 입력 레코드 순서를 따른다.
 */
@Value
public class BatchTransformResult {
    List<EngineeredFeatureVector> vectors;
    FeatureArtifacts artifacts;
}
