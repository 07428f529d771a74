package com.credit.card.fraud.scoring.ensemble.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Isolation Forest. s(x, n) = 2^(-E(h(x)) / c(n)).
 * decision function = -s - offset 이고, 신호는 부호를 뒤집어 s + offset (클수록 이상).
 */
public final class IsolationForestDetector implements AnomalyDetector {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int inputDimension;
    private final int sampleSize;
    private final double offset;
    private final List<DecisionTree> trees;

    @JsonCreator
    public IsolationForestDetector(@JsonProperty("inputDimension") int inputDimension,
                                   @JsonProperty("sampleSize") int sampleSize,
                                   @JsonProperty("offset") Double offset,
                                   @JsonProperty("trees") List<DecisionTree> trees) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("Isolation forest has no trees");
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("Isolation forest sample size must be >= 2");
        }
        for (DecisionTree tree : trees) {
            if (!tree.hasNodeSizes()) {
                throw new IllegalArgumentException("Isolation tree is missing node sizes");
            }
            if (tree.maxFeatureIndex() >= inputDimension) {
                throw new IllegalArgumentException("Tree splits on feature " + tree.maxFeatureIndex()
                        + " but input dimension is " + inputDimension);
            }
        }
        this.inputDimension = inputDimension;
        this.sampleSize = sampleSize;
        this.offset = offset != null ? offset : -0.5;
        this.trees = List.copyOf(trees);
    }

    public double decisionFunction(double[] x) {
        return -isolationScore(x) - offset;
    }

    @Override
    public double anomalyScore(double[] x) {
        return -decisionFunction(x);
    }

    double isolationScore(double[] x) {
        if (x.length != inputDimension) {
            throw new IllegalArgumentException("Expected " + inputDimension + " features, got " + x.length);
        }
        double avgPathLength = 0.0;
        for (DecisionTree tree : trees) {
            int[] leaf = tree.descend(x);
            avgPathLength += leaf[1] + averagePathLength(tree.leafSize(leaf[0]));
        }
        avgPathLength /= trees.size();
        return Math.pow(2.0, -avgPathLength / averagePathLength(sampleSize));
    }

    /**
     * 실패한 BST 탐색의 평균 경로 길이 c(n)
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    @Override
    @JsonProperty("inputDimension")
    public int inputDimension() {
        return inputDimension;
    }

    @JsonProperty("sampleSize")
    public int getSampleSize() {
        return sampleSize;
    }

    @JsonProperty("offset")
    public double getOffset() {
        return offset;
    }

    @JsonProperty("trees")
    public List<DecisionTree> getTrees() {
        return trees;
    }
}
