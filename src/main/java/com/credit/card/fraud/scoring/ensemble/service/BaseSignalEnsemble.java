package com.credit.card.fraud.scoring.ensemble.service;

import com.credit.card.fraud.scoring.artifact.dto.ModelFeatureContracts;
import com.credit.card.fraud.scoring.ensemble.exceptions.ModelScoringException;
import com.credit.card.fraud.scoring.ensemble.model.AnomalyDetector;
import com.credit.card.fraud.scoring.ensemble.model.ClusterModel;
import com.credit.card.fraud.scoring.ensemble.model.ProbabilisticClassifier;
import com.credit.card.fraud.scoring.ensemble.model.ReconstructionModel;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 독립적으로 학습된 베이스 모델 네 개. 각 모델은 자기 피처 슬라이스로만 평가된다.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class BaseSignalEnsemble {

    private final EnsembleMember<ProbabilisticClassifier> classifier;
    private final EnsembleMember<AnomalyDetector> isolationForest;
    private final EnsembleMember<ReconstructionModel> autoencoder;
    private final EnsembleMember<ClusterModel> clustering;

    public BaseSignalSet score(EngineeredFeatureVector vector) {
        double[] classifierInput = classifier.slice(vector);
        double[] forestInput = isolationForest.slice(vector);
        double[] autoencoderInput = autoencoder.slice(vector);
        double[] clusteringInput = clustering.slice(vector);

        double probability = invoke(classifier.name(),
                () -> classifier.model().predictProbability(classifierInput));
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new ModelScoringException(classifier.name(), "probability out of range: " + probability, null);
        }
        double anomaly = finite(isolationForest.name(),
                invoke(isolationForest.name(), () -> isolationForest.model().anomalyScore(forestInput)));
        double reconstruction = finite(autoencoder.name(),
                invoke(autoencoder.name(), () -> autoencoder.model().reconstructionError(autoencoderInput)));
        double[] latent = invoke(autoencoder.name(), () -> autoencoder.model().latent(autoencoderInput));
        int cluster = invoke(clustering.name(), () -> clustering.model().assign(clusteringInput));

        List<Double> latentValues = new ArrayList<>(latent.length);
        for (double v : latent) latentValues.add(v);

        return BaseSignalSet.builder()
                .supervisedProbability(probability)
                .anomalyScore(anomaly)
                .reconstructionError(reconstruction)
                .clusterId(cluster)
                .latent(List.copyOf(latentValues))
                .build();
    }

    public double[] classifierSlice(EngineeredFeatureVector vector) {
        return classifier.slice(vector);
    }

    public List<String> memberNames() {
        return List.of(classifier.name(), isolationForest.name(), autoencoder.name(), clustering.name());
    }

    public static BaseSignalEnsemble of(ModelFeatureContracts contracts,
                                        ProbabilisticClassifier classifier,
                                        AnomalyDetector isolationForest,
                                        ReconstructionModel autoencoder,
                                        ClusterModel clustering) {
        return new BaseSignalEnsemble(
                new EnsembleMember<>(ModelFeatureContracts.CLASSIFIER,
                        contracts.featuresOf(ModelFeatureContracts.CLASSIFIER), classifier),
                new EnsembleMember<>(ModelFeatureContracts.ISOLATION_FOREST,
                        contracts.featuresOf(ModelFeatureContracts.ISOLATION_FOREST), isolationForest),
                new EnsembleMember<>(ModelFeatureContracts.AUTOENCODER,
                        contracts.featuresOf(ModelFeatureContracts.AUTOENCODER), autoencoder),
                new EnsembleMember<>(ModelFeatureContracts.CLUSTERING,
                        contracts.featuresOf(ModelFeatureContracts.CLUSTERING), clustering));
    }

    private static <T> T invoke(String member, Supplier<T> call) {
        try {
            return call.get();
        } catch (FraudScoringException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Model '{}' failed during scoring: {}", member, e.getMessage());
            throw new ModelScoringException(member, e.getMessage(), e);
        }
    }

    private static double finite(String member, double value) {
        if (!Double.isFinite(value)) {
            throw new ModelScoringException(member, "non-finite output: " + value, null);
        }
        return value;
    }
}
