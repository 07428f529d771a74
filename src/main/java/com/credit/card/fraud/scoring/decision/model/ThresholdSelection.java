package com.credit.card.fraud.scoring.decision.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ThresholdSelection {

    double threshold;
    double expectedCost;
    int falseNegatives;
    int falsePositives;
}
