package com.credit.card.fraud.scoring.ensemble.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GradientBoostedTreesClassifierTest {

    private static DecisionTree stump(int feature, double threshold, double left, double right) {
        return DecisionTree.boosted(new int[]{feature, -1, -1}, new double[]{threshold, 0, 0},
                new int[]{1, -1, -1}, new int[]{2, -1, -1}, new double[]{0, left, right});
    }

    @Test
    void predictProbability_shouldApplySigmoidToSummedMargin() {
        GradientBoostedTreesClassifier classifier = new GradientBoostedTreesClassifier(2, 0.25,
                List.of(stump(0, 0.5, -1.0, 1.0), stump(1, 10.0, 0.5, -0.5)), new double[]{0, 0});

        assertEquals(0.25 - 1.0 + 0.5, classifier.margin(new double[]{0.0, 3.0}), 1e-12);
        assertEquals(1.0 / (1.0 + Math.exp(-(0.25 + 1.0 - 0.5))),
                classifier.predictProbability(new double[]{0.5, 10.0}), 1e-12);
    }

    @Test
    void constructor_shouldRejectTreeSplittingOutsideInput() {
        assertThrows(IllegalArgumentException.class, () -> new GradientBoostedTreesClassifier(1, 0.0,
                List.of(stump(3, 0.5, -1.0, 1.0)), new double[]{0}));
    }

    @Test
    void constructor_shouldRejectBackgroundOfWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new GradientBoostedTreesClassifier(2, 0.0,
                List.of(stump(0, 0.5, -1.0, 1.0)), new double[]{0}));
    }

    @Test
    void decisionTree_shouldRejectBackwardChildIndex() {
        assertThrows(IllegalArgumentException.class, () -> DecisionTree.boosted(
                new int[]{0, 0, -1}, new double[]{1, 1, 0},
                new int[]{1, 0, -1}, new int[]{2, 2, -1}, new double[]{0, 0, 1}));
    }

    @Test
    void decisionTree_shouldRejectNegativeSplitFeature() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> stump(-1, 0.5, -1.0, 1.0));
        assertTrue(ex.getMessage().contains("negative feature"));
    }

    @Test
    void predictProbability_shouldRejectWrongDimension() {
        GradientBoostedTreesClassifier classifier = new GradientBoostedTreesClassifier(1, 0.0,
                List.of(stump(0, 0.5, -1.0, 1.0)), new double[]{0});

        assertThrows(IllegalArgumentException.class, () -> classifier.predictProbability(new double[]{1, 2}));
    }

    @Test
    void json_shouldRestoreIdenticalClassifier() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        GradientBoostedTreesClassifier classifier = new GradientBoostedTreesClassifier(2, 0.25,
                List.of(stump(0, 0.5, -1.0, 1.0), stump(1, 10.0, 0.5, -0.5)), new double[]{0.1, 0.2});

        GradientBoostedTreesClassifier restored = mapper.readValue(
                mapper.writeValueAsBytes(classifier), GradientBoostedTreesClassifier.class);

        double[] x = {0.7, 4.0};
        assertEquals(classifier.predictProbability(x), restored.predictProbability(x));
        assertArrayEquals(classifier.background(), restored.background());
    }
}
