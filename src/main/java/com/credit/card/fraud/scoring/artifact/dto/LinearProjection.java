package com.credit.card.fraud.scoring.artifact.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.List;

/**
 * 학습 시점에 적합된 주성분 투영 (평균 중심화 후 components 행렬 곱)
 */
public final class LinearProjection {

    private final List<String> inputColumns;
    private final double[] means;
    private final double[][] components;
    private final RealMatrix componentMatrix;

    @JsonCreator
    public LinearProjection(@JsonProperty("inputColumns") List<String> inputColumns,
                            @JsonProperty("means") double[] means,
                            @JsonProperty("components") double[][] components) {
        if (inputColumns == null || means == null || components == null) {
            throw new IllegalArgumentException("Projection requires inputColumns, means and components");
        }
        if (means.length != inputColumns.size()) {
            throw new IllegalArgumentException("Projection means length " + means.length
                    + " != input columns " + inputColumns.size());
        }
        for (double[] component : components) {
            if (component.length != inputColumns.size()) {
                throw new IllegalArgumentException("Projection component length " + component.length
                        + " != input columns " + inputColumns.size());
            }
        }
        this.inputColumns = List.copyOf(inputColumns);
        this.means = means.clone();
        this.components = new double[components.length][];
        for (int i = 0; i < components.length; i++) {
            this.components[i] = components[i].clone();
        }
        this.componentMatrix = new Array2DRowRealMatrix(this.components, true);
    }

    public double[] project(double[] x) {
        if (x.length != means.length) {
            throw new IllegalArgumentException("Projection input length " + x.length + " != " + means.length);
        }
        ArrayRealVector centered = new ArrayRealVector(x, true);
        centered = centered.subtract(new ArrayRealVector(means, false));
        return componentMatrix.operate(centered).toArray();
    }

    @JsonProperty("inputColumns")
    public List<String> getInputColumns() {
        return inputColumns;
    }

    @JsonProperty("means")
    public double[] getMeans() {
        return means.clone();
    }

    @JsonProperty("components")
    public double[][] getComponents() {
        double[][] copy = new double[components.length][];
        for (int i = 0; i < components.length; i++) {
            copy[i] = components[i].clone();
        }
        return copy;
    }

    public int dimensions() {
        return components.length;
    }
}
