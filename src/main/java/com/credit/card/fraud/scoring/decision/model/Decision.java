package com.credit.card.fraud.scoring.decision.model;

import lombok.Value;

@Value
public class Decision {

    /** 보정된 사기 확률 [0, 1] */
    double probability;
    FraudLabel label;
}
