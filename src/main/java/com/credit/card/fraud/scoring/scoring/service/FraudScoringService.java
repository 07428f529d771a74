package com.credit.card.fraud.scoring.scoring.service;

import com.credit.card.fraud.scoring.artifact.dto.FittedArtifactBundle;
import com.credit.card.fraud.scoring.artifact.service.LoadedModelBundle;
import com.credit.card.fraud.scoring.attribution.model.Explanation;
import com.credit.card.fraud.scoring.attribution.service.ShapleyAttributionEngine;
import com.credit.card.fraud.scoring.contract.service.FeatureContractValidator;
import com.credit.card.fraud.scoring.decision.model.Decision;
import com.credit.card.fraud.scoring.ensemble.service.BaseSignalEnsemble;
import com.credit.card.fraud.scoring.ensemble.service.BaseSignalSet;
import com.credit.card.fraud.scoring.features.exceptions.PipelineStageException;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import com.credit.card.fraud.scoring.features.model.PipelineMode;
import com.credit.card.fraud.scoring.features.model.RawRecord;
import com.credit.card.fraud.scoring.features.service.FeatureTransformationPipeline;
import com.credit.card.fraud.scoring.global.config.FraudScoringProperties;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;
import com.credit.card.fraud.scoring.meta.model.MetaFeatureVector;
import com.credit.card.fraud.scoring.meta.service.MetaFeatureAssembler;
import com.credit.card.fraud.scoring.scoring.dto.ExplainResponse;
import com.credit.card.fraud.scoring.scoring.dto.ScoreResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 요청 한 건 = 원본 레코드 한 건.
 * predict와 explain은 같은 피처 변환 + 계약 검증 경로를 거친다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudScoringService {

    private final LoadedModelBundle bundle;
    private final FeatureTransformationPipeline pipeline;
    private final FeatureContractValidator contractValidator;
    private final MetaFeatureAssembler metaFeatureAssembler;
    private final ShapleyAttributionEngine attributionEngine;
    private final FraudScoringProperties properties;

    public ScoreResponse predict(Map<String, ?> payload) {
        long startTime = System.currentTimeMillis();
        EngineeredFeatureVector vector = engineer(payload);

        BaseSignalSet signals = bundle.getEnsemble().score(vector);
        MetaFeatureVector meta = metaFeatureAssembler.assembleForServing(
                signals, vector, bundle.getArtifacts().getContracts());
        Decision decision = bundle.getDecisionModel().decide(meta);

        log.debug("Scored record: probability={}, label={}, {}ms",
                decision.getProbability(), decision.getLabel(), System.currentTimeMillis() - startTime);
        return ScoreResponse.builder()
                .probability(decision.getProbability())
                .label(decision.getLabel())
                .modelVersion(bundle.modelVersion())
                .build();
    }

    public ExplainResponse explain(Map<String, ?> payload, Integer topK) {
        int k = topK != null ? topK : properties.getExplain().getTopK();
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        EngineeredFeatureVector vector = engineer(payload);

        BaseSignalEnsemble ensemble = bundle.getEnsemble();
        double[] slice = ensemble.classifierSlice(vector);
        Explanation explanation = attributionEngine.explain(ensemble.getClassifier(), slice, k);

        return ExplainResponse.builder()
                .modelVersion(bundle.modelVersion())
                .baseline(explanation.getBaseline())
                .prediction(explanation.getPrediction())
                .attributions(explanation.getAttributions())
                .build();
    }

    private EngineeredFeatureVector engineer(Map<String, ?> payload) {
        RawRecord record = RawRecord.of(payload, properties.getLabelField());
        FittedArtifactBundle artifacts = bundle.getArtifacts();

        EngineeredFeatureVector vector;
        try {
            vector = pipeline.transform(record, PipelineMode.APPLY, artifacts.getFeatureArtifacts()).getVector();
        } catch (FraudScoringException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Feature pipeline failed: {}", e.getMessage());
            throw new PipelineStageException("pipeline", e.getMessage());
        }

        contractValidator.validate(vector, artifacts.frozenSchema());
        return vector;
    }
}
