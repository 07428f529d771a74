package com.credit.card.fraud.scoring.ensemble.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 부스팅 트리 분류기. margin = baseMargin + sum(leaf), 확률 = sigmoid(margin)
 */
public final class GradientBoostedTreesClassifier implements ProbabilisticClassifier {

    private final int inputDimension;
    private final double baseMargin;
    private final List<DecisionTree> trees;
    private final double[] background;

    @JsonCreator
    public GradientBoostedTreesClassifier(@JsonProperty("inputDimension") int inputDimension,
                                          @JsonProperty("baseMargin") double baseMargin,
                                          @JsonProperty("trees") List<DecisionTree> trees,
                                          @JsonProperty("background") double[] background) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("Classifier has no trees");
        }
        for (DecisionTree tree : trees) {
            if (!tree.hasValues()) {
                throw new IllegalArgumentException("Boosted tree is missing leaf values");
            }
            if (tree.maxFeatureIndex() >= inputDimension) {
                throw new IllegalArgumentException("Tree splits on feature " + tree.maxFeatureIndex()
                        + " but input dimension is " + inputDimension);
            }
        }
        if (background == null || background.length != inputDimension) {
            throw new IllegalArgumentException("Classifier background must have " + inputDimension + " values");
        }
        this.inputDimension = inputDimension;
        this.baseMargin = baseMargin;
        this.trees = List.copyOf(trees);
        this.background = background.clone();
    }

    public double margin(double[] x) {
        checkDimension(x);
        double margin = baseMargin;
        for (DecisionTree tree : trees) {
            margin += tree.leafValue(x);
        }
        return margin;
    }

    @Override
    public double predictProbability(double[] x) {
        return 1.0 / (1.0 + Math.exp(-margin(x)));
    }

    @Override
    public double[] background() {
        return background.clone();
    }

    @Override
    @JsonProperty("inputDimension")
    public int inputDimension() {
        return inputDimension;
    }

    @JsonProperty("baseMargin")
    public double getBaseMargin() {
        return baseMargin;
    }

    @JsonProperty("trees")
    public List<DecisionTree> getTrees() {
        return trees;
    }

    @JsonProperty("background")
    public double[] getBackground() {
        return background.clone();
    }

    private void checkDimension(double[] x) {
        if (x.length != inputDimension) {
            throw new IllegalArgumentException("Expected " + inputDimension + " features, got " + x.length);
        }
    }
}
