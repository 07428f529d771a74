package com.credit.card.fraud.scoring.features.model;

public enum PipelineMode {
    /** 학습 데이터로 아티팩트를 새로 적합 */
    FIT,
    /** 고정된 아티팩트를 그대로 재사용 (재적합 금지) */
    APPLY
}
