package com.credit.card.fraud.scoring.ensemble.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * 완전연결 층. weights는 [출력][입력]
 */
public final class DenseLayer {

    public enum Activation {
        IDENTITY, RELU, SIGMOID, TANH
    }

    private final RealMatrix weights;
    private final double[] bias;
    private final Activation activation;

    @JsonCreator
    public DenseLayer(@JsonProperty("weights") double[][] weights,
                      @JsonProperty("bias") double[] bias,
                      @JsonProperty("activation") Activation activation) {
        if (weights == null || weights.length == 0 || bias == null || bias.length != weights.length) {
            throw new IllegalArgumentException("Dense layer requires weights[out][in] and bias[out]");
        }
        this.weights = new Array2DRowRealMatrix(weights, true);
        this.bias = bias.clone();
        this.activation = activation != null ? activation : Activation.IDENTITY;
    }

    public double[] forward(double[] x) {
        double[] z = weights.operate(x);
        for (int i = 0; i < z.length; i++) {
            z[i] = activate(z[i] + bias[i]);
        }
        return z;
    }

    private double activate(double v) {
        switch (activation) {
            case RELU:
                return Math.max(0.0, v);
            case SIGMOID:
                return 1.0 / (1.0 + Math.exp(-v));
            case TANH:
                return Math.tanh(v);
            default:
                return v;
        }
    }

    public int inputSize() {
        return weights.getColumnDimension();
    }

    public int outputSize() {
        return weights.getRowDimension();
    }

    @JsonProperty("weights")
    public double[][] getWeights() {
        return weights.getData();
    }

    @JsonProperty("bias")
    public double[] getBias() {
        return bias.clone();
    }

    @JsonProperty("activation")
    public Activation getActivation() {
        return activation;
    }
}
