package com.credit.card.fraud.scoring.ensemble.service;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactLoadException;
import com.credit.card.fraud.scoring.ensemble.model.FrozenModel;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;

import java.util.List;

/**
 * (모델, 필수 피처 목록) 쌍. 모델은 자기 목록의 슬라이스만 본다.
 */
public final class EnsembleMember<M extends FrozenModel> {

    private final String name;
    private final List<String> requiredFeatures;
    private final M model;

    public EnsembleMember(String name, List<String> requiredFeatures, M model) {
        if (model.inputDimension() != requiredFeatures.size()) {
            throw new ArtifactLoadException("Model '" + name + "' expects " + model.inputDimension()
                    + " inputs but its feature list has " + requiredFeatures.size());
        }
        this.name = name;
        this.requiredFeatures = List.copyOf(requiredFeatures);
        this.model = model;
    }

    public double[] slice(EngineeredFeatureVector vector) {
        return vector.numericSlice(requiredFeatures);
    }

    public String name() {
        return name;
    }

    public List<String> requiredFeatures() {
        return requiredFeatures;
    }

    public M model() {
        return model;
    }
}
