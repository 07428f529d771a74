package com.credit.card.fraud.scoring.artifact.dto;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactLoadException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 모델별 입력 피처 목록, 스태커 메타 피처 순서, 결정 임계값
 */
@Value
@Builder
@Jacksonized
public class ModelFeatureContracts {

    public static final String CLASSIFIER = "classifier";
    public static final String ISOLATION_FOREST = "isolation_forest";
    public static final String AUTOENCODER = "autoencoder";
    public static final String CLUSTERING = "clustering";

    public static final List<String> MEMBERS = List.of(CLASSIFIER, ISOLATION_FOREST, AUTOENCODER, CLUSTERING);

    Map<String, List<String>> memberFeatures;

    /** 스태커가 학습된 메타 피처의 위치 순서 */
    List<String> metaFeatures;

    /** 메타 벡터에 들어가는 엔지니어링 피처 (학습 측에서 선언한 순서) */
    List<String> metaEngineeredFeatures;

    /** 비용 가중 스윕으로 선택된 임계값. 기본값 없음 */
    Double decisionThreshold;

    public List<String> featuresOf(String member) {
        List<String> features = memberFeatures != null ? memberFeatures.get(member) : null;
        if (features == null || features.isEmpty()) {
            throw new ArtifactLoadException("Feature list missing for model '" + member + "'");
        }
        return features;
    }
}
