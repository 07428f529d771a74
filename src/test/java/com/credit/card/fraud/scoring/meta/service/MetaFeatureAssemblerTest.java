package com.credit.card.fraud.scoring.meta.service;

import com.credit.card.fraud.scoring.ScoringFixtures;
import com.credit.card.fraud.scoring.artifact.dto.ModelFeatureContracts;
import com.credit.card.fraud.scoring.ensemble.service.BaseSignalSet;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import com.credit.card.fraud.scoring.meta.exceptions.MetaFeatureContractViolationException;
import com.credit.card.fraud.scoring.meta.model.MetaFeatureVector;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetaFeatureAssemblerTest {

    private final MetaFeatureAssembler assembler = new MetaFeatureAssembler();

    private final BaseSignalSet signals = BaseSignalSet.builder()
            .supervisedProbability(0.73)
            .anomalyScore(0.05)
            .reconstructionError(1.25)
            .clusterId(2)
            .latent(List.of(0.4))
            .build();

    private final EngineeredFeatureVector vector = vector();

    private static EngineeredFeatureVector vector() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("hour", 3.0);
        values.put("amount_scaled", -0.8);
        values.put("pca_x", 1.1);
        return new EngineeredFeatureVector(values);
    }

    @Test
    void assembleForServing_shouldPlaceValuesInStackerOrder() {
        MetaFeatureVector meta = assembler.assembleForServing(signals, vector, ScoringFixtures.contracts(0.5));

        assertEquals(ScoringFixtures.META_FEATURES, meta.names());
        assertArrayEquals(new double[]{0.73, 0.05, 1.25, 2.0, 0.4, -0.8}, meta.values());
    }

    @Test
    void assemble_shouldRejectReorderedSubset() {
        List<String> order = List.of("xgb_oof_proba", "hour", "amount_scaled");

        MetaFeatureContractViolationException ex = assertThrows(MetaFeatureContractViolationException.class,
                () -> assembler.assemble(signals, vector, List.of("amount_scaled", "hour"), order));

        assertEquals(List.of("hour", "amount_scaled"), ex.getExpected());
        assertEquals(List.of("amount_scaled", "hour"), ex.getActual());
    }

    @Test
    void assemble_shouldRejectOmittedOrExtraSubsetEntries() {
        List<String> order = List.of("xgb_oof_proba", "hour", "amount_scaled");

        assertThrows(MetaFeatureContractViolationException.class,
                () -> assembler.assemble(signals, vector, List.of("hour"), order));
        assertThrows(MetaFeatureContractViolationException.class,
                () -> assembler.assemble(signals, vector, List.of("hour", "amount_scaled", "pca_x"), order));
    }

    @Test
    void assembleForTraining_shouldFillSameSupervisedSlotAsServing() {
        ModelFeatureContracts contracts = ScoringFixtures.contracts(0.5);

        MetaFeatureVector serving = assembler.assembleForServing(signals, vector, contracts);
        MetaFeatureVector training = assembler.assembleForTraining(0.11, signals, vector, contracts);

        assertEquals(serving.names(), training.names());
        assertEquals(0.73, serving.value("xgb_oof_proba"));
        assertEquals(0.11, training.value("xgb_oof_proba"));
        double[] servingValues = serving.values();
        double[] trainingValues = training.values();
        for (int i = 1; i < servingValues.length; i++) {
            assertEquals(servingValues[i], trainingValues[i]);
        }
    }

    @Test
    void assembleForTraining_shouldRejectSubsetThatDiffersFromStackerOrder() {
        ModelFeatureContracts contracts = ModelFeatureContracts.builder()
                .memberFeatures(ScoringFixtures.contracts(0.5).getMemberFeatures())
                .metaFeatures(List.of("xgb_oof_proba", "hour", "amount_scaled"))
                .metaEngineeredFeatures(List.of("amount_scaled", "hour"))
                .decisionThreshold(0.5)
                .build();

        MetaFeatureContractViolationException ex = assertThrows(MetaFeatureContractViolationException.class,
                () -> assembler.assembleForTraining(0.2, signals, vector, contracts));
        assertEquals(List.of("hour", "amount_scaled"), ex.getExpected());
    }

    @Test
    void assemble_shouldRejectLatentSlotBeyondEmbedding() {
        List<String> order = List.of("xgb_oof_proba", "latent_3");

        assertThrows(MetaFeatureContractViolationException.class,
                () -> assembler.assemble(signals, vector, List.of(), order));
    }
}
