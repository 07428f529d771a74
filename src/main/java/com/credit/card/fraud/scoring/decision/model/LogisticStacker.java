package com.credit.card.fraud.scoring.decision.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 메타 벡터 위의 로지스틱 회귀 + Platt 보정.
 * z = intercept + w·x, p = sigmoid(plattA * z + plattB)
 */
public final class LogisticStacker {

    private final List<String> features;
    private final double[] coefficients;
    private final double intercept;
    private final double plattA;
    private final double plattB;

    @JsonCreator
    public LogisticStacker(@JsonProperty("features") List<String> features,
                           @JsonProperty("coefficients") double[] coefficients,
                           @JsonProperty("intercept") double intercept,
                           @JsonProperty("plattA") Double plattA,
                           @JsonProperty("plattB") Double plattB) {
        if (features == null || features.isEmpty() || coefficients == null
                || coefficients.length != features.size()) {
            throw new IllegalArgumentException("Stacker needs one coefficient per meta feature");
        }
        this.features = List.copyOf(features);
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.plattA = plattA != null ? plattA : 1.0;
        this.plattB = plattB != null ? plattB : 0.0;
    }

    public double decisionValue(double[] x) {
        if (x.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length + " meta features, got " + x.length);
        }
        double z = intercept;
        for (int i = 0; i < x.length; i++) {
            z += coefficients[i] * x[i];
        }
        return z;
    }

    public double predictProbability(double[] x) {
        return sigmoid(plattA * decisionValue(x) + plattB);
    }

    private static double sigmoid(double v) {
        return 1.0 / (1.0 + Math.exp(-v));
    }

    @JsonProperty("features")
    public List<String> features() {
        return features;
    }

    @JsonProperty("coefficients")
    public double[] getCoefficients() {
        return coefficients.clone();
    }

    @JsonProperty("intercept")
    public double getIntercept() {
        return intercept;
    }

    @JsonProperty("plattA")
    public double getPlattA() {
        return plattA;
    }

    @JsonProperty("plattB")
    public double getPlattB() {
        return plattB;
    }
}
