package com.credit.card.fraud.scoring.features.service;

import com.credit.card.fraud.scoring.artifact.dto.FeatureArtifacts;
import com.credit.card.fraud.scoring.artifact.dto.FeatureSchema;
import com.credit.card.fraud.scoring.features.model.BatchTransformResult;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import com.credit.card.fraud.scoring.features.model.PipelineMode;
import com.credit.card.fraud.scoring.features.model.RawRecord;
import com.credit.card.fraud.scoring.features.model.TransformResult;
import com.credit.card.fraud.scoring.features.stage.AmountStage;
import com.credit.card.fraud.scoring.features.stage.CategoricalEncodingStage;
import com.credit.card.fraud.scoring.features.stage.FeatureFrame;
import com.credit.card.fraud.scoring.features.stage.FeatureStage;
import com.credit.card.fraud.scoring.features.stage.FrequencyAggregateStage;
import com.credit.card.fraud.scoring.features.stage.InteractionStage;
import com.credit.card.fraud.scoring.features.stage.MissingIndicatorStage;
import com.credit.card.fraud.scoring.features.stage.ProjectionStage;
import com.credit.card.fraud.scoring.features.stage.RollingBehaviorStage;
import com.credit.card.fraud.scoring.features.stage.StageContext;
import com.credit.card.fraud.scoring.features.stage.SyntheticContextStage;
import com.credit.card.fraud.scoring.features.stage.TemporalStage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 원본 레코드 -> 엔지니어링 피처 변환.
 * 학습(FIT)과 서빙(APPLY)이 같은 스테이지 순서를 그대로 공유한다.
 */
@Slf4j
public class FeatureTransformationPipeline {

    private final List<FeatureStage> stages;
    private final long fitSyntheticSeed;

    public FeatureTransformationPipeline(long fitSyntheticSeed) {
        this.fitSyntheticSeed = fitSyntheticSeed;
        this.stages = List.of(
                new TemporalStage(),
                new AmountStage(),
                new SyntheticContextStage(),
                new FrequencyAggregateStage(),
                new RollingBehaviorStage(),
                new MissingIndicatorStage(),
                new CategoricalEncodingStage(),
                new InteractionStage(),
                new ProjectionStage());
    }

    public TransformResult transform(RawRecord record, PipelineMode mode, FeatureArtifacts artifactsIn) {
        BatchTransformResult result = transformBatch(List.of(record), mode, artifactsIn);
        return new TransformResult(result.getVectors().get(0), result.getArtifacts());
    }

    /**
     * FIT: artifactsIn은 null이어야 하며 새 아티팩트를 돌려준다.
     * APPLY: artifactsIn을 그대로 돌려준다 (같은 인스턴스).
     */
    public BatchTransformResult transformBatch(List<RawRecord> records, PipelineMode mode, FeatureArtifacts artifactsIn) {
        StageContext context;
        if (mode == PipelineMode.FIT) {
            if (artifactsIn != null) {
                throw new IllegalArgumentException("FIT mode computes new artifacts; artifactsIn must be null");
            }
            context = StageContext.forFit(fitSyntheticSeed);
        } else {
            context = StageContext.forApply(artifactsIn);
        }

        FeatureFrame frame = FeatureFrame.fromRecords(records);
        for (FeatureStage stage : stages) {
            stage.apply(frame, context);
            frame.verifyRectangular(stage.name());
        }

        List<EngineeredFeatureVector> vectors = frame.toVectors();
        if (mode == PipelineMode.FIT) {
            FeatureSchema schema = new FeatureSchema(frame.columns());
            log.info("FIT complete: {} rows, {} columns, schemaHash={}",
                    records.size(), schema.columns().size(), schema.schemaHash());
            return new BatchTransformResult(vectors, context.toArtifacts(schema));
        }
        return new BatchTransformResult(vectors, artifactsIn);
    }

    public List<String> stageNames() {
        return stages.stream().map(FeatureStage::name).toList();
    }
}
