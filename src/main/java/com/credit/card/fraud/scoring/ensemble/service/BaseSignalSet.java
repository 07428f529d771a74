package com.credit.card.fraud.scoring.ensemble.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 한 건에 대한 베이스 모델 신호
 */
@Value
@Builder
public class BaseSignalSet {

    double supervisedProbability;
    double anomalyScore;
    double reconstructionError;
    int clusterId;
    @Builder.Default
    List<Double> latent = List.of();
}
