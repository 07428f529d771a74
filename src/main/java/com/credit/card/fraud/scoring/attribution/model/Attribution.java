package com.credit.card.fraud.scoring.attribution.model;

import lombok.Value;

/**
 * 피처 하나의 기여도와 관측값
 */
@Value
public class Attribution {

    String feature;
    double contribution;
    double value;
}
