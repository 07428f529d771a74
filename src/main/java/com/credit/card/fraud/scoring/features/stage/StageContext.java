package com.credit.card.fraud.scoring.features.stage;

import com.credit.card.fraud.scoring.artifact.dto.FeatureArtifacts;
import com.credit.card.fraud.scoring.artifact.dto.FeatureSchema;
import com.credit.card.fraud.scoring.artifact.dto.FrequencyTable;
import com.credit.card.fraud.scoring.artifact.dto.LinearProjection;
import com.credit.card.fraud.scoring.artifact.dto.ScalingParameters;
import com.credit.card.fraud.scoring.features.model.PipelineMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 번의 파이프라인 실행에서 스테이지가 공유하는 아티팩트 상태.
 * FIT 모드에서만 record* 호출이 허용된다.
 */
public final class StageContext {

    private final PipelineMode mode;
    private final FeatureArtifacts frozen;
    private final long fitSyntheticSeed;

    private ScalingParameters amountScaling;
    private final Map<String, FrequencyTable> frequencyTables = new LinkedHashMap<>();
    private LinearProjection projection;

    private StageContext(PipelineMode mode, FeatureArtifacts frozen, long fitSyntheticSeed) {
        this.mode = mode;
        this.frozen = frozen;
        this.fitSyntheticSeed = fitSyntheticSeed;
    }

    public static StageContext forFit(long syntheticSeed) {
        return new StageContext(PipelineMode.FIT, null, syntheticSeed);
    }

    public static StageContext forApply(FeatureArtifacts frozen) {
        if (frozen == null) {
            throw new IllegalArgumentException("APPLY mode requires fitted artifacts");
        }
        return new StageContext(PipelineMode.APPLY, frozen, 0L);
    }

    public PipelineMode mode() {
        return mode;
    }

    public boolean isFit() {
        return mode == PipelineMode.FIT;
    }

    public long syntheticSeed() {
        return isFit() ? fitSyntheticSeed : frozen.getSyntheticSeed();
    }

    public ScalingParameters amountScaling() {
        return isFit() ? require(amountScaling, "amountScaling") : frozen.getAmountScaling();
    }

    public FrequencyTable frequencyTable(String column) {
        return isFit() ? require(frequencyTables.get(column), "frequencyTables." + column)
                : frozen.frequencyTable(column);
    }

    public LinearProjection projection() {
        return isFit() ? require(projection, "projection") : frozen.getProjection();
    }

    public void recordAmountScaling(ScalingParameters scaling) {
        assertFitting("amountScaling");
        this.amountScaling = scaling;
    }

    public void recordFrequencyTable(String column, FrequencyTable table) {
        assertFitting("frequencyTables." + column);
        frequencyTables.put(column, table);
    }

    public void recordProjection(LinearProjection projection) {
        assertFitting("projection");
        this.projection = projection;
    }

    public FeatureArtifacts toArtifacts(FeatureSchema schema) {
        assertFitting("frozenSchema");
        return FeatureArtifacts.builder()
                .amountScaling(require(amountScaling, "amountScaling"))
                .frequencyTables(Collections.unmodifiableMap(new LinkedHashMap<>(frequencyTables)))
                .projection(require(projection, "projection"))
                .frozenSchema(schema)
                .syntheticSeed(fitSyntheticSeed)
                .build();
    }

    private void assertFitting(String artifact) {
        if (!isFit()) {
            throw new IllegalStateException("Refitting '" + artifact + "' is forbidden in APPLY mode");
        }
    }

    private static <T> T require(T value, String artifact) {
        if (value == null) {
            throw new IllegalStateException("Artifact '" + artifact + "' has not been fitted yet");
        }
        return value;
    }
}
