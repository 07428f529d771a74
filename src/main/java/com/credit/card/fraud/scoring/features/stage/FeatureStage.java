package com.credit.card.fraud.scoring.features.stage;

/**
 * 파이프라인 단계. 이전 단계들이 만든 컬럼을 읽고 새 컬럼을 추가한다.
 */
public interface FeatureStage {

    String name();

    void apply(FeatureFrame frame, StageContext context);
}
