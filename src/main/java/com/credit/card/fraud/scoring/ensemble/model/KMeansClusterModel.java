package com.credit.card.fraud.scoring.ensemble.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 가장 가까운 중심점의 인덱스. 거리가 같으면 작은 인덱스.
 */
public final class KMeansClusterModel implements ClusterModel {

    private final double[][] centroids;

    @JsonCreator
    public KMeansClusterModel(@JsonProperty("centroids") double[][] centroids) {
        if (centroids == null || centroids.length == 0 || centroids[0].length == 0) {
            throw new IllegalArgumentException("K-means model has no centroids");
        }
        int d = centroids[0].length;
        this.centroids = new double[centroids.length][];
        for (int k = 0; k < centroids.length; k++) {
            if (centroids[k].length != d) {
                throw new IllegalArgumentException("Centroid " + k + " has dimension " + centroids[k].length);
            }
            this.centroids[k] = centroids[k].clone();
        }
    }

    @Override
    public int assign(double[] x) {
        if (x.length != inputDimension()) {
            throw new IllegalArgumentException("Expected " + inputDimension() + " features, got " + x.length);
        }
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int k = 0; k < centroids.length; k++) {
            double distance = 0.0;
            for (int j = 0; j < x.length; j++) {
                double d = x[j] - centroids[k][j];
                distance += d * d;
            }
            if (distance < bestDistance) {
                bestDistance = distance;
                best = k;
            }
        }
        return best;
    }

    @Override
    public int inputDimension() {
        return centroids[0].length;
    }

    @JsonProperty("centroids")
    public double[][] getCentroids() {
        double[][] copy = new double[centroids.length][];
        for (int k = 0; k < centroids.length; k++) copy[k] = centroids[k].clone();
        return copy;
    }
}
