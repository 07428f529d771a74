package com.credit.card.fraud.scoring.global.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "fraud.scoring")
public class FraudScoringProperties {

    /**
     * 아티팩트 저장소 루트 디렉터리
     */
    private String artifactRoot = "./artifacts";

    /**
     * 서빙할 모델 버전 (루트 아래 디렉터리 이름)
     */
    private String modelVersion = "v1";

    /**
     * 학습 라벨 컬럼. 피처에서 제외된다.
     */
    private String labelField = "Class";

    /**
     * FIT 모드에서 합성 컨텍스트 시드. 아티팩트에 기록되어 APPLY에서 재사용된다.
     */
    private long syntheticSeed = 42L;

    private Explain explain = new Explain();

    @Data
    public static class Explain {
        /**
         * 반환할 기여도 개수 기본값
         */
        private int topK = 5;

        /**
         * 순열 샘플링 횟수 (정/역 쌍으로 반올림)
         */
        private int permutations = 256;

        private long seed = 42L;

        /**
         * 이 개수 이하의 피처는 모든 부분집합을 열거한다
         */
        private int exactFeatureLimit = 10;
    }
}
