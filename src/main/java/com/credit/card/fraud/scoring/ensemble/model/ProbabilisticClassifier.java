package com.credit.card.fraud.scoring.ensemble.model;

public interface ProbabilisticClassifier extends FrozenModel {

    /** 사기 클래스 확률 [0, 1] */
    double predictProbability(double[] x);

    /** 기여도 계산의 기준점이 되는 참조 입력 (학습 데이터 평균) */
    double[] background();
}
