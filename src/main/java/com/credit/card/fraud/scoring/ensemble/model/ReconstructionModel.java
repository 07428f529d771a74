package com.credit.card.fraud.scoring.ensemble.model;

public interface ReconstructionModel extends FrozenModel {

    /** 입력과 복원값의 평균 제곱 오차 */
    double reconstructionError(double[] x);

    /** 병목 층 임베딩 */
    double[] latent(double[] x);

    int latentDimension();
}
