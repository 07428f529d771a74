package com.credit.card.fraud.scoring.ensemble.model;

public interface ClusterModel extends FrozenModel {

    /** 순서 의미가 없는 그룹 ID */
    int assign(double[] x);
}
