package com.credit.card.fraud.scoring.ensemble.model;

public interface AnomalyDetector extends FrozenModel {

    /** 클수록 이상 */
    double anomalyScore(double[] x);
}
