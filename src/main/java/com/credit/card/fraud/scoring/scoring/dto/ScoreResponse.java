package com.credit.card.fraud.scoring.scoring.dto;

import com.credit.card.fraud.scoring.decision.model.FraudLabel;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "사기 판정 응답")
public class ScoreResponse {

    @Schema(description = "보정된 사기 확률", example = "0.8312")
    private double probability;

    @Schema(description = "판정 라벨 (fraud / legit)", example = "fraud")
    private FraudLabel label;

    @Schema(description = "서빙 중인 모델 버전", example = "v1")
    private String modelVersion;
}
