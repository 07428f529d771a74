package com.credit.card.fraud.scoring.ensemble.service;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactLoadException;
import com.credit.card.fraud.scoring.contract.exceptions.FeatureContractViolationException;
import com.credit.card.fraud.scoring.ensemble.exceptions.ModelScoringException;
import com.credit.card.fraud.scoring.ensemble.model.AnomalyDetector;
import com.credit.card.fraud.scoring.ensemble.model.ClusterModel;
import com.credit.card.fraud.scoring.ensemble.model.ProbabilisticClassifier;
import com.credit.card.fraud.scoring.ensemble.model.ReconstructionModel;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaseSignalEnsembleTest {

    @Mock
    private ProbabilisticClassifier classifier;
    @Mock
    private AnomalyDetector isolationForest;
    @Mock
    private ReconstructionModel autoencoder;
    @Mock
    private ClusterModel clustering;

    private EngineeredFeatureVector vector;

    @BeforeEach
    void setUp() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("hour", 3.0);
        values.put("amount_log", 5.0);
        values.put("amount_scaled", 1.5);
        values.put("pca_x", -0.7);
        values.put("merchant_id", "42");
        vector = new EngineeredFeatureVector(values);
    }

    private BaseSignalEnsemble ensemble() {
        when(classifier.inputDimension()).thenReturn(2);
        when(isolationForest.inputDimension()).thenReturn(1);
        when(autoencoder.inputDimension()).thenReturn(2);
        when(clustering.inputDimension()).thenReturn(1);
        return new BaseSignalEnsemble(
                new EnsembleMember<>("classifier", List.of("amount_scaled", "hour"), classifier),
                new EnsembleMember<>("isolation_forest", List.of("pca_x"), isolationForest),
                new EnsembleMember<>("autoencoder", List.of("amount_log", "amount_scaled"), autoencoder),
                new EnsembleMember<>("clustering", List.of("hour"), clustering));
    }

    @Test
    void score_shouldSliceEachMemberInItsOwnOrder() {
        BaseSignalEnsemble ensemble = ensemble();
        when(classifier.predictProbability(any())).thenReturn(0.8);
        when(isolationForest.anomalyScore(any())).thenReturn(0.12);
        when(autoencoder.reconstructionError(any())).thenReturn(0.04);
        when(autoencoder.latent(any())).thenReturn(new double[]{0.3, -0.2});
        when(clustering.assign(any())).thenReturn(1);

        BaseSignalSet signals = ensemble.score(vector);

        assertEquals(0.8, signals.getSupervisedProbability());
        assertEquals(0.12, signals.getAnomalyScore());
        assertEquals(0.04, signals.getReconstructionError());
        assertEquals(1, signals.getClusterId());
        assertEquals(List.of(0.3, -0.2), signals.getLatent());

        verify(classifier).predictProbability(aryEq(new double[]{1.5, 3.0}));
        verify(isolationForest).anomalyScore(aryEq(new double[]{-0.7}));
        verify(autoencoder).reconstructionError(aryEq(new double[]{5.0, 1.5}));
        verify(clustering).assign(aryEq(new double[]{3.0}));
    }

    @Test
    void score_shouldWrapModelFailure_withMemberName() {
        BaseSignalEnsemble ensemble = ensemble();
        when(classifier.predictProbability(any())).thenReturn(0.2);
        when(isolationForest.anomalyScore(any())).thenThrow(new IllegalStateException("corrupt tree"));

        ModelScoringException ex = assertThrows(ModelScoringException.class, () -> ensemble.score(vector));

        assertEquals("isolation_forest", ex.getMember());
        assertTrue(ex.getMessage().contains("corrupt tree"));
    }

    @Test
    void score_shouldRejectProbabilityOutsideUnitInterval() {
        BaseSignalEnsemble ensemble = ensemble();
        when(classifier.predictProbability(any())).thenReturn(1.2);

        ModelScoringException ex = assertThrows(ModelScoringException.class, () -> ensemble.score(vector));
        assertEquals("classifier", ex.getMember());
    }

    @Test
    void score_shouldRaiseContractViolation_whenRequiredColumnIsAbsent() {
        BaseSignalEnsemble ensemble = ensemble();
        Map<String, Object> values = new LinkedHashMap<>(vector.asMap());
        values.remove("pca_x");

        FeatureContractViolationException ex = assertThrows(FeatureContractViolationException.class,
                () -> ensemble.score(new EngineeredFeatureVector(values)));

        assertTrue(ex.getViolation().getMissing().contains("pca_x"));
        verify(classifier, never()).predictProbability(any());
    }

    @Test
    void member_shouldRejectDimensionMismatch() {
        when(classifier.inputDimension()).thenReturn(3);

        assertThrows(ArtifactLoadException.class,
                () -> new EnsembleMember<>("classifier", List.of("hour", "amount_log"), classifier));
    }
}
