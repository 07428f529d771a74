package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.ScoringFixtures;
import com.credit.card.fraud.scoring.artifact.dto.FeatureArtifacts;
import com.credit.card.fraud.scoring.artifact.dto.ModelFeatureContracts;
import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactStoreException;
import com.credit.card.fraud.scoring.features.model.BatchTransformResult;
import com.credit.card.fraud.scoring.features.model.PipelineMode;
import com.credit.card.fraud.scoring.features.service.FeatureTransformationPipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureFreezeServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final FeatureTransformationPipeline pipeline = new FeatureTransformationPipeline(ScoringFixtures.SEED);
    private InMemoryArtifactStore store;
    private FeatureFreezeService freezeService;

    @BeforeEach
    void setUp() {
        store = new InMemoryArtifactStore();
        freezeService = new FeatureFreezeService(pipeline, store, mapper);
    }

    @Test
    void freeze_shouldWriteFeatureArtifactsAndContracts() {
        BatchTransformResult result = freezeService.freeze("v1", ScoringFixtures.trainingRecords(),
                ScoringFixtures.contracts(0.5));

        assertEquals(12, result.getVectors().size());
        assertTrue(store.exists("v1", ArtifactKeys.FEATURE_ARTIFACTS));
        assertTrue(store.exists("v1", ArtifactKeys.MODEL_CONTRACTS));
    }

    @Test
    void freeze_shouldReproduceTrainingVectors_afterReload() throws Exception {
        BatchTransformResult result = freezeService.freeze("v1", ScoringFixtures.trainingRecords(), null);

        FeatureArtifacts reloaded = mapper.readValue(store.read("v1", ArtifactKeys.FEATURE_ARTIFACTS),
                FeatureArtifacts.class);

        assertEquals(result.getArtifacts().getFrozenSchema(), reloaded.getFrozenSchema());
        assertEquals(result.getVectors(),
                pipeline.transformBatch(ScoringFixtures.trainingRecords(), PipelineMode.APPLY, reloaded).getVectors());
    }

    @Test
    void freeze_shouldRefuseSecondFreezeOfSameVersion() {
        freezeService.freeze("v1", ScoringFixtures.trainingRecords(), null);

        assertThrows(ArtifactStoreException.class,
                () -> freezeService.freeze("v1", ScoringFixtures.trainingRecords(), null));
    }

    @Test
    void freeze_shouldRejectContractsReferencingUnknownColumns_beforeWriting() {
        ModelFeatureContracts contracts = ModelFeatureContracts.builder()
                .memberFeatures(Map.of(ModelFeatureContracts.CLASSIFIER, List.of("hour", "not_a_feature")))
                .metaFeatures(List.of("xgb_oof_proba"))
                .metaEngineeredFeatures(List.of())
                .decisionThreshold(0.5)
                .build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> freezeService.freeze("v1", ScoringFixtures.trainingRecords(), contracts));

        assertTrue(ex.getMessage().contains("not_a_feature"));
        assertEquals(0, store.size());
    }

    @Test
    void freeze_shouldRejectEmptyTrainingSet() {
        assertThrows(IllegalArgumentException.class, () -> freezeService.freeze("v1", List.of(), null));
    }
}
