package com.credit.card.fraud.scoring.decision.service;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactLoadException;
import com.credit.card.fraud.scoring.decision.model.Decision;
import com.credit.card.fraud.scoring.decision.model.FraudLabel;
import com.credit.card.fraud.scoring.decision.model.LogisticStacker;
import com.credit.card.fraud.scoring.meta.exceptions.MetaFeatureContractViolationException;
import com.credit.card.fraud.scoring.meta.model.MetaFeatureVector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StackedDecisionModelTest {

    private static final List<String> ORDER = List.of("xgb_oof_proba", "anomaly_score");

    @Test
    void decide_shouldLabelFraud_whenProbabilityEqualsThreshold() {
        LogisticStacker neutral = new LogisticStacker(ORDER, new double[]{0.0, 0.0}, 0.0, null, null);

        Decision decision = new StackedDecisionModel(neutral, 0.5)
                .decide(new MetaFeatureVector(ORDER, new double[]{0.9, 0.1}));

        assertEquals(0.5, decision.getProbability());
        assertEquals(FraudLabel.FRAUD, decision.getLabel());
    }

    @Test
    void decide_shouldLabelLegit_belowThreshold() {
        LogisticStacker neutral = new LogisticStacker(ORDER, new double[]{0.0, 0.0}, 0.0, null, null);

        Decision decision = new StackedDecisionModel(neutral, 0.51)
                .decide(new MetaFeatureVector(ORDER, new double[]{0.9, 0.1}));

        assertEquals(FraudLabel.LEGIT, decision.getLabel());
    }

    @Test
    void decide_shouldApplyPlattCalibration() {
        LogisticStacker stacker = new LogisticStacker(ORDER, new double[]{2.0, -1.0}, 0.5, 0.8, -0.2);
        double z = 0.5 + 2.0 * 0.9 - 1.0 * 0.3;

        Decision decision = new StackedDecisionModel(stacker, 0.5)
                .decide(new MetaFeatureVector(ORDER, new double[]{0.9, 0.3}));

        assertEquals(1.0 / (1.0 + Math.exp(-(0.8 * z - 0.2))), decision.getProbability(), 1e-12);
    }

    @Test
    void decide_shouldRejectMetaVectorInDifferentOrder() {
        LogisticStacker stacker = new LogisticStacker(ORDER, new double[]{1.0, 1.0}, 0.0, null, null);
        StackedDecisionModel model = new StackedDecisionModel(stacker, 0.5);

        assertThrows(MetaFeatureContractViolationException.class, () -> model.decide(
                new MetaFeatureVector(List.of("anomaly_score", "xgb_oof_proba"), new double[]{0.1, 0.9})));
    }

    @Test
    void constructor_shouldRequireThreshold() {
        LogisticStacker stacker = new LogisticStacker(ORDER, new double[]{1.0, 1.0}, 0.0, null, null);

        assertThrows(ArtifactLoadException.class, () -> new StackedDecisionModel(stacker, null));
        assertThrows(ArtifactLoadException.class, () -> new StackedDecisionModel(stacker, 1.5));
    }
}
