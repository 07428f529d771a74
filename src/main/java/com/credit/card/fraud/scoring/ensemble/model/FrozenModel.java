package com.credit.card.fraud.scoring.ensemble.model;

/**
 * 학습이 끝나 파라미터가 고정된 모델. 평가만 한다.
 */
public interface FrozenModel {

    int inputDimension();
}
