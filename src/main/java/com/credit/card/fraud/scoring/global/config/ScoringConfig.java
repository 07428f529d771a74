package com.credit.card.fraud.scoring.global.config;

import com.credit.card.fraud.scoring.artifact.service.ArtifactBundleLoader;
import com.credit.card.fraud.scoring.artifact.service.ArtifactStore;
import com.credit.card.fraud.scoring.artifact.service.CsvRawRecordReader;
import com.credit.card.fraud.scoring.artifact.service.FeatureFreezeService;
import com.credit.card.fraud.scoring.artifact.service.FileSystemArtifactStore;
import com.credit.card.fraud.scoring.artifact.service.LoadedModelBundle;
import com.credit.card.fraud.scoring.attribution.service.ShapleyAttributionEngine;
import com.credit.card.fraud.scoring.decision.service.CostWeightedThresholdSelector;
import com.credit.card.fraud.scoring.features.service.FeatureTransformationPipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * 아티팩트 묶음은 시작 시 한 번 로드한다. 실패하면 컨텍스트가 뜨지 않는다.
 */
@Slf4j
@Configuration
public class ScoringConfig {

    @Bean
    public ArtifactStore artifactStore(FraudScoringProperties properties) {
        log.info("Artifact store root: {}", properties.getArtifactRoot());
        return new FileSystemArtifactStore(Paths.get(properties.getArtifactRoot()));
    }

    @Bean
    public ArtifactBundleLoader artifactBundleLoader(ArtifactStore artifactStore, ObjectMapper objectMapper) {
        return new ArtifactBundleLoader(artifactStore, objectMapper);
    }

    @Bean
    public LoadedModelBundle loadedModelBundle(ArtifactBundleLoader loader, FraudScoringProperties properties) {
        return loader.loadOrFail(properties.getModelVersion());
    }

    @Bean
    public FeatureTransformationPipeline featureTransformationPipeline(FraudScoringProperties properties) {
        return new FeatureTransformationPipeline(properties.getSyntheticSeed());
    }

    @Bean
    public ShapleyAttributionEngine shapleyAttributionEngine(FraudScoringProperties properties) {
        FraudScoringProperties.Explain explain = properties.getExplain();
        return new ShapleyAttributionEngine(explain.getPermutations(), explain.getSeed(),
                explain.getExactFeatureLimit());
    }

    @Bean
    public FeatureFreezeService featureFreezeService(FeatureTransformationPipeline pipeline,
                                                     ArtifactStore artifactStore,
                                                     ObjectMapper objectMapper) {
        return new FeatureFreezeService(pipeline, artifactStore, objectMapper);
    }

    @Bean
    public CsvRawRecordReader csvRawRecordReader(FraudScoringProperties properties) {
        return new CsvRawRecordReader(properties.getLabelField());
    }

    @Bean
    public CostWeightedThresholdSelector costWeightedThresholdSelector() {
        return new CostWeightedThresholdSelector();
    }
}
