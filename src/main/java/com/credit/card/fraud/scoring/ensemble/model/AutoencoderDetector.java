package com.credit.card.fraud.scoring.ensemble.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 오토인코더 복원 오차. 앞의 encoderLayers 개 층이 인코더이고 그 출력이 latent다.
 */
public final class AutoencoderDetector implements ReconstructionModel {

    private final List<DenseLayer> layers;
    private final int encoderLayers;

    @JsonCreator
    public AutoencoderDetector(@JsonProperty("layers") List<DenseLayer> layers,
                               @JsonProperty("encoderLayers") int encoderLayers) {
        if (layers == null || layers.size() < 2) {
            throw new IllegalArgumentException("Autoencoder needs at least an encoder and a decoder layer");
        }
        if (encoderLayers < 1 || encoderLayers >= layers.size()) {
            throw new IllegalArgumentException("encoderLayers must be in [1, " + (layers.size() - 1) + "]");
        }
        for (int i = 1; i < layers.size(); i++) {
            if (layers.get(i).inputSize() != layers.get(i - 1).outputSize()) {
                throw new IllegalArgumentException("Layer " + i + " input size does not match previous output");
            }
        }
        if (layers.get(layers.size() - 1).outputSize() != layers.get(0).inputSize()) {
            throw new IllegalArgumentException("Autoencoder output size must equal input size");
        }
        this.layers = List.copyOf(layers);
        this.encoderLayers = encoderLayers;
    }

    public double[] reconstruct(double[] x) {
        return forward(x, layers.size());
    }

    @Override
    public double reconstructionError(double[] x) {
        double[] reconstruction = reconstruct(x);
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            double d = reconstruction[i] - x[i];
            sum += d * d;
        }
        return sum / x.length;
    }

    @Override
    public double[] latent(double[] x) {
        return forward(x, encoderLayers);
    }

    @Override
    public int latentDimension() {
        return layers.get(encoderLayers - 1).outputSize();
    }

    private double[] forward(double[] x, int depth) {
        if (x.length != inputDimension()) {
            throw new IllegalArgumentException("Expected " + inputDimension() + " features, got " + x.length);
        }
        double[] h = x;
        for (int i = 0; i < depth; i++) {
            h = layers.get(i).forward(h);
        }
        return h;
    }

    @Override
    public int inputDimension() {
        return layers.get(0).inputSize();
    }

    @JsonProperty("layers")
    public List<DenseLayer> getLayers() {
        return layers;
    }

    @JsonProperty("encoderLayers")
    public int getEncoderLayers() {
        return encoderLayers;
    }
}
