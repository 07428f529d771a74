package com.credit.card.fraud.scoring.artifact.service;

/**
 * 버전 디렉터리 안의 아티팩트 파일 이름
 */
public final class ArtifactKeys {

    public static final String FEATURE_ARTIFACTS = "feature-artifacts.json";
    public static final String MODEL_CONTRACTS = "model-contracts.json";
    public static final String CLASSIFIER = "classifier.json";
    public static final String ISOLATION_FOREST = "isolation-forest.json";
    public static final String AUTOENCODER = "autoencoder.json";
    public static final String CLUSTERING = "clustering.json";
    public static final String STACKER = "stacker.json";

    private ArtifactKeys() {
    }
}
