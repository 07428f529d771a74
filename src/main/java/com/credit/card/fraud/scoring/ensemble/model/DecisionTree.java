package com.credit.card.fraud.scoring.ensemble.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 배열로 펼친 이진 트리. left[node] < 0 이면 리프.
 * 분기 규칙: x[feature] < threshold 이면 왼쪽.
 * value는 부스팅 트리의 리프 값, nodeSize는 isolation 트리의 리프 표본 수다.
 */
public final class DecisionTree {

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[] value;
    private final int[] nodeSize;

    @JsonCreator
    public DecisionTree(@JsonProperty("feature") int[] feature,
                        @JsonProperty("threshold") double[] threshold,
                        @JsonProperty("left") int[] left,
                        @JsonProperty("right") int[] right,
                        @JsonProperty("value") double[] value,
                        @JsonProperty("nodeSize") int[] nodeSize) {
        if (feature == null || threshold == null || left == null || right == null || feature.length == 0) {
            throw new IllegalArgumentException("Tree requires non-empty feature/threshold/left/right arrays");
        }
        int n = feature.length;
        if (threshold.length != n || left.length != n || right.length != n
                || (value != null && value.length != n) || (nodeSize != null && nodeSize.length != n)) {
            throw new IllegalArgumentException("Tree node arrays have inconsistent lengths");
        }
        for (int node = 0; node < n; node++) {
            boolean leaf = left[node] < 0;
            if (leaf != right[node] < 0) {
                throw new IllegalArgumentException("Node " + node + " has exactly one child");
            }
            // 자식 인덱스가 항상 커야 순회가 끝난다
            if (!leaf && (left[node] <= node || right[node] <= node || left[node] >= n || right[node] >= n)) {
                throw new IllegalArgumentException("Node " + node + " has invalid child indices");
            }
            if (!leaf && feature[node] < 0) {
                throw new IllegalArgumentException("Node " + node + " splits on negative feature " + feature[node]);
            }
        }
        this.feature = feature.clone();
        this.threshold = threshold.clone();
        this.left = left.clone();
        this.right = right.clone();
        this.value = value != null ? value.clone() : null;
        this.nodeSize = nodeSize != null ? nodeSize.clone() : null;
    }

    public static DecisionTree boosted(int[] feature, double[] threshold, int[] left, int[] right, double[] value) {
        return new DecisionTree(feature, threshold, left, right, value, null);
    }

    public static DecisionTree isolation(int[] feature, double[] threshold, int[] left, int[] right, int[] nodeSize) {
        return new DecisionTree(feature, threshold, left, right, null, nodeSize);
    }

    /**
     * @return {리프 인덱스, 깊이}
     */
    int[] descend(double[] x) {
        int node = 0;
        int depth = 0;
        while (left[node] >= 0) {
            node = x[feature[node]] < threshold[node] ? left[node] : right[node];
            depth++;
        }
        return new int[]{node, depth};
    }

    double leafValue(double[] x) {
        if (value == null) throw new IllegalStateException("Tree has no leaf values");
        return value[descend(x)[0]];
    }

    int leafSize(int leaf) {
        if (nodeSize == null) throw new IllegalStateException("Tree has no node sizes");
        return nodeSize[leaf];
    }

    int maxFeatureIndex() {
        int max = -1;
        for (int node = 0; node < feature.length; node++) {
            if (left[node] >= 0) max = Math.max(max, feature[node]);
        }
        return max;
    }

    boolean hasValues() {
        return value != null;
    }

    boolean hasNodeSizes() {
        return nodeSize != null;
    }

    @JsonProperty("feature")
    public int[] getFeature() {
        return feature.clone();
    }

    @JsonProperty("threshold")
    public double[] getThreshold() {
        return threshold.clone();
    }

    @JsonProperty("left")
    public int[] getLeft() {
        return left.clone();
    }

    @JsonProperty("right")
    public int[] getRight() {
        return right.clone();
    }

    @JsonProperty("value")
    public double[] getValue() {
        return value != null ? value.clone() : null;
    }

    @JsonProperty("nodeSize")
    public int[] getNodeSize() {
        return nodeSize != null ? nodeSize.clone() : null;
    }
}
