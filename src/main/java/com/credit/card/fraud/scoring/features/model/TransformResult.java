package com.credit.card.fraud.scoring.features.model;

import com.credit.card.fraud.scoring.artifact.dto.FeatureArtifacts;
import lombok.Value;

@Value
public class TransformResult {
    EngineeredFeatureVector vector;
    FeatureArtifacts artifacts;
}
