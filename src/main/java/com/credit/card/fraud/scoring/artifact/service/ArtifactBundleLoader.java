package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.artifact.dto.FeatureArtifacts;
import com.credit.card.fraud.scoring.artifact.dto.FeatureSchema;
import com.credit.card.fraud.scoring.artifact.dto.FittedArtifactBundle;
import com.credit.card.fraud.scoring.artifact.dto.ModelFeatureContracts;
import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactLoadException;
import com.credit.card.fraud.scoring.decision.model.LogisticStacker;
import com.credit.card.fraud.scoring.decision.service.StackedDecisionModel;
import com.credit.card.fraud.scoring.ensemble.model.AutoencoderDetector;
import com.credit.card.fraud.scoring.ensemble.model.GradientBoostedTreesClassifier;
import com.credit.card.fraud.scoring.ensemble.model.IsolationForestDetector;
import com.credit.card.fraud.scoring.ensemble.model.KMeansClusterModel;
import com.credit.card.fraud.scoring.ensemble.service.BaseSignalEnsemble;
import com.credit.card.fraud.scoring.features.model.FeatureColumns;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;
import com.credit.card.fraud.scoring.meta.model.MetaFeatureSlots;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * 한 모델 버전의 아티팩트를 모두 읽고 서로 맞는지 확인한다.
 * 하나라도 빠지거나 어긋나면 ArtifactLoadException (서비스 시작 실패).
 */
@Slf4j
@RequiredArgsConstructor
public class ArtifactBundleLoader {

    private final ArtifactStore store;
    private final ObjectMapper objectMapper;

    public LoadedModelBundle load(String modelVersion) {
        log.info("Loading artifact bundle version {}", modelVersion);

        FeatureArtifacts featureArtifacts = read(modelVersion, ArtifactKeys.FEATURE_ARTIFACTS, FeatureArtifacts.class);
        ModelFeatureContracts contracts = read(modelVersion, ArtifactKeys.MODEL_CONTRACTS, ModelFeatureContracts.class);
        validateFeatureArtifacts(featureArtifacts);
        validateContracts(contracts, featureArtifacts.getFrozenSchema());

        GradientBoostedTreesClassifier classifier =
                read(modelVersion, ArtifactKeys.CLASSIFIER, GradientBoostedTreesClassifier.class);
        IsolationForestDetector isolationForest =
                read(modelVersion, ArtifactKeys.ISOLATION_FOREST, IsolationForestDetector.class);
        AutoencoderDetector autoencoder = read(modelVersion, ArtifactKeys.AUTOENCODER, AutoencoderDetector.class);
        KMeansClusterModel clustering = read(modelVersion, ArtifactKeys.CLUSTERING, KMeansClusterModel.class);
        LogisticStacker stacker = read(modelVersion, ArtifactKeys.STACKER, LogisticStacker.class);

        BaseSignalEnsemble ensemble =
                BaseSignalEnsemble.of(contracts, classifier, isolationForest, autoencoder, clustering);
        validateStacker(stacker, contracts, autoencoder.latentDimension());
        StackedDecisionModel decisionModel = new StackedDecisionModel(stacker, contracts.getDecisionThreshold());

        FittedArtifactBundle artifacts = FittedArtifactBundle.builder()
                .modelVersion(modelVersion)
                .featureArtifacts(featureArtifacts)
                .contracts(contracts)
                .build();

        log.info("Artifact bundle {} loaded: schemaHash={}, {} engineered columns, members={}, threshold={}",
                modelVersion, artifacts.frozenSchema().schemaHash(), artifacts.frozenSchema().columns().size(),
                ensemble.memberNames(), decisionModel.threshold());

        return LoadedModelBundle.builder()
                .artifacts(artifacts)
                .ensemble(ensemble)
                .decisionModel(decisionModel)
                .build();
    }

    private <T> T read(String modelVersion, String key, Class<T> type) {
        if (!store.exists(modelVersion, key)) {
            throw new ArtifactLoadException("Missing artifact " + modelVersion + "/" + key);
        }
        try {
            T value = objectMapper.readValue(store.read(modelVersion, key), type);
            if (value == null) {
                throw new ArtifactLoadException("Artifact " + modelVersion + "/" + key + " is empty");
            }
            return value;
        } catch (IOException e) {
            throw new ArtifactLoadException("Artifact " + modelVersion + "/" + key + " is malformed: "
                    + e.getMessage(), e);
        }
    }

    private void validateFeatureArtifacts(FeatureArtifacts artifacts) {
        if (artifacts.getFrozenSchema() == null) {
            throw new ArtifactLoadException("Feature artifacts have no frozen schema");
        }
        if (artifacts.getAmountScaling() == null) {
            throw new ArtifactLoadException("Feature artifacts have no amount scaling");
        }
        if (artifacts.getProjection() == null) {
            throw new ArtifactLoadException("Feature artifacts have no projection");
        }
        for (String column : FeatureColumns.CATEGORICAL_FIELDS) {
            artifacts.frequencyTable(column);
        }
    }

    private void validateContracts(ModelFeatureContracts contracts, FeatureSchema schema) {
        if (contracts.getDecisionThreshold() == null) {
            throw new ArtifactLoadException("Decision threshold is not set in model contracts");
        }
        for (String member : ModelFeatureContracts.MEMBERS) {
            requireInSchema("model '" + member + "'", contracts.featuresOf(member), schema);
        }
        List<String> metaEngineered = contracts.getMetaEngineeredFeatures() != null
                ? contracts.getMetaEngineeredFeatures() : List.of();
        requireInSchema("meta features", metaEngineered, schema);
        if (contracts.getMetaFeatures() == null || contracts.getMetaFeatures().isEmpty()) {
            throw new ArtifactLoadException("Meta feature order is empty");
        }
        List<String> nonSignal = contracts.getMetaFeatures().stream()
                .filter(name -> !MetaFeatureSlots.isSignal(name))
                .toList();
        if (!nonSignal.equals(metaEngineered)) {
            throw new ArtifactLoadException("Meta engineered features " + metaEngineered
                    + " do not match the stacker order " + nonSignal);
        }
    }

    private void validateStacker(LogisticStacker stacker, ModelFeatureContracts contracts, int latentDimension) {
        if (!stacker.features().equals(contracts.getMetaFeatures())) {
            throw new ArtifactLoadException("Stacker feature order " + stacker.features()
                    + " differs from model contracts " + contracts.getMetaFeatures());
        }
        for (String name : stacker.features()) {
            OptionalInt latent = MetaFeatureSlots.latentIndex(name);
            if (latent.isPresent() && latent.getAsInt() >= latentDimension) {
                throw new ArtifactLoadException("Stacker uses '" + name + "' but the autoencoder latent size is "
                        + latentDimension);
            }
        }
    }

    private static void requireInSchema(String owner, List<String> features, FeatureSchema schema) {
        List<String> unknown = new ArrayList<>();
        for (String feature : features) {
            if (!schema.contains(feature)) unknown.add(feature);
        }
        if (!unknown.isEmpty()) {
            throw new ArtifactLoadException("Features of " + owner + " are not in the frozen schema: " + unknown);
        }
    }

    /**
     * 시작 실패 원인을 ArtifactLoadException 하나로 모은다.
     */
    public LoadedModelBundle loadOrFail(String modelVersion) {
        try {
            return load(modelVersion);
        } catch (ArtifactLoadException e) {
            log.error("Artifact bundle {} failed to load: {}", modelVersion, e.getMessage());
            throw e;
        } catch (FraudScoringException | IllegalArgumentException e) {
            log.error("Artifact bundle {} failed to load: {}", modelVersion, e.getMessage());
            throw new ArtifactLoadException("Artifact bundle " + modelVersion + " is invalid: " + e.getMessage(), e);
        }
    }
}
