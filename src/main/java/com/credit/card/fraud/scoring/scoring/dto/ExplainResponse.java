package com.credit.card.fraud.scoring.scoring.dto;

import com.credit.card.fraud.scoring.attribution.model.Attribution;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "감독 분류기 기여도 설명")
public class ExplainResponse {

    @Schema(description = "서빙 중인 모델 버전", example = "v1")
    private String modelVersion;

    @Schema(description = "참조 입력에서의 분류기 확률", example = "0.0121")
    private double baseline;

    @Schema(description = "이 거래에 대한 분류기 확률", example = "0.7433")
    private double prediction;

    @Schema(description = "|기여도| 내림차순 상위 피처")
    private List<Attribution> attributions;
}
