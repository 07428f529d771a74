package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.artifact.dto.FeatureArtifacts;
import com.credit.card.fraud.scoring.artifact.dto.FeatureSchema;
import com.credit.card.fraud.scoring.artifact.dto.ModelFeatureContracts;
import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactStoreException;
import com.credit.card.fraud.scoring.features.model.BatchTransformResult;
import com.credit.card.fraud.scoring.features.model.PipelineMode;
import com.credit.card.fraud.scoring.features.model.RawRecord;
import com.credit.card.fraud.scoring.features.service.FeatureTransformationPipeline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 학습 데이터로 FIT을 한 번 돌려 피처 아티팩트와 모델 계약을 고정한다.
 * 모델 학습은 하지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFreezeService {

    private final FeatureTransformationPipeline pipeline;
    private final ArtifactStore store;
    private final ObjectMapper objectMapper;

    public BatchTransformResult freeze(String modelVersion, List<RawRecord> records, ModelFeatureContracts contracts) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Cannot freeze features from an empty training set");
        }
        if (store.exists(modelVersion, ArtifactKeys.FEATURE_ARTIFACTS)) {
            throw new ArtifactStoreException("Model version " + modelVersion + " is already frozen");
        }

        log.info("Freezing feature contract {} from {} training records", modelVersion, records.size());
        BatchTransformResult result = pipeline.transformBatch(records, PipelineMode.FIT, null);
        FeatureArtifacts artifacts = result.getArtifacts();

        if (contracts != null) {
            checkContracts(contracts, artifacts.getFrozenSchema());
        }

        store.write(modelVersion, ArtifactKeys.FEATURE_ARTIFACTS, toJson(artifacts));
        if (contracts != null) {
            store.write(modelVersion, ArtifactKeys.MODEL_CONTRACTS, toJson(contracts));
        }

        log.info("Feature contract {} frozen: {} columns, schemaHash={}",
                modelVersion, artifacts.getFrozenSchema().columns().size(),
                artifacts.getFrozenSchema().schemaHash());
        return result;
    }

    private static void checkContracts(ModelFeatureContracts contracts, FeatureSchema schema) {
        List<String> unknown = new ArrayList<>();
        if (contracts.getMemberFeatures() != null) {
            contracts.getMemberFeatures().values().forEach(features -> features.stream()
                    .filter(feature -> !schema.contains(feature) && !unknown.contains(feature))
                    .forEach(unknown::add));
        }
        if (contracts.getMetaEngineeredFeatures() != null) {
            contracts.getMetaEngineeredFeatures().stream()
                    .filter(feature -> !schema.contains(feature) && !unknown.contains(feature))
                    .forEach(unknown::add);
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Model contracts reference columns the pipeline does not produce: "
                    + unknown);
        }
    }

    private byte[] toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ArtifactStoreException("Failed to serialize artifact: " + e.getMessage(), e);
        }
    }
}
