package com.credit.card.fraud.scoring.decision.service;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactLoadException;
import com.credit.card.fraud.scoring.decision.model.Decision;
import com.credit.card.fraud.scoring.decision.model.FraudLabel;
import com.credit.card.fraud.scoring.decision.model.LogisticStacker;
import com.credit.card.fraud.scoring.ensemble.exceptions.ModelScoringException;
import com.credit.card.fraud.scoring.meta.exceptions.MetaFeatureContractViolationException;
import com.credit.card.fraud.scoring.meta.model.MetaFeatureVector;
import lombok.extern.slf4j.Slf4j;

/**
 * 최종 판정. 임계값 이상이면 사기.
 */
@Slf4j
public class StackedDecisionModel {

    public static final String MEMBER_NAME = "stacker";

    private final LogisticStacker stacker;
    private final double threshold;

    public StackedDecisionModel(LogisticStacker stacker, Double threshold) {
        if (threshold == null) {
            throw new ArtifactLoadException("Decision threshold is not set in the artifact bundle");
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new ArtifactLoadException("Decision threshold must be in [0, 1], got " + threshold);
        }
        this.stacker = stacker;
        this.threshold = threshold;
    }

    public Decision decide(MetaFeatureVector meta) {
        if (!meta.names().equals(stacker.features())) {
            log.error("Meta vector order differs from stacker: expected={} actual={}",
                    stacker.features(), meta.names());
            throw new MetaFeatureContractViolationException(
                    "Meta vector order differs from stacker.", stacker.features(), meta.names());
        }

        double probability;
        try {
            probability = stacker.predictProbability(meta.values());
        } catch (RuntimeException e) {
            throw new ModelScoringException(MEMBER_NAME, e.getMessage(), e);
        }
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new ModelScoringException(MEMBER_NAME, "probability out of range: " + probability, null);
        }

        FraudLabel label = probability >= threshold ? FraudLabel.FRAUD : FraudLabel.LEGIT;
        return new Decision(probability, label);
    }

    public double threshold() {
        return threshold;
    }

    public LogisticStacker stacker() {
        return stacker;
    }
}
