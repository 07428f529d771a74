package com.credit.card.fraud.scoring.artifact.dto;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactLoadException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * FIT 모드에서 한 번 생성되는 피처 파이프라인 아티팩트
 */
@Value
@Builder
@Jacksonized
public class FeatureArtifacts {

    ScalingParameters amountScaling;
    Map<String, FrequencyTable> frequencyTables;
    LinearProjection projection;
    FeatureSchema frozenSchema;
    long syntheticSeed;

    public FrequencyTable frequencyTable(String column) {
        FrequencyTable table = frequencyTables != null ? frequencyTables.get(column) : null;
        if (table == null) {
            throw new ArtifactLoadException("Frequency table missing for column '" + column + "'");
        }
        return table;
    }
}
