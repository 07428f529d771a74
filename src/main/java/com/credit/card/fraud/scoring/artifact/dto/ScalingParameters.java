package com.credit.card.fraud.scoring.artifact.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 중앙값/IQR 기반 로버스트 스케일링 파라미터
 */
@Value
@Builder
@Jacksonized
public class ScalingParameters {

    double center;
    double scale;

    public double apply(double value) {
        return (value - center) / scale;
    }
}
