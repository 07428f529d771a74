package com.credit.card.fraud.scoring.scoring.controller;

import com.credit.card.fraud.scoring.scoring.dto.ExplainResponse;
import com.credit.card.fraud.scoring.scoring.dto.ScoreResponse;
import com.credit.card.fraud.scoring.scoring.service.FraudScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/scoring")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "사기 스코어링", description = "단건 거래 사기 판정 및 기여도 설명 API")
public class ScoringController {

    private final FraudScoringService scoringService;

    @PostMapping("/predict")
    @Operation(summary = "거래 사기 판정", description = "원본 거래 필드로 사기 확률과 라벨을 계산합니다")
    @ApiResponse(responseCode = "200", description = "판정 성공",
        content = @Content(mediaType = "application/json",
            examples = @ExampleObject(value = """
                {
                  "probability": 0.8312,
                  "label": "fraud",
                  "modelVersion": "v1"
                }""")))
    @ApiResponse(responseCode = "400", description = "필수 필드(Time, Amount) 누락 또는 타입 오류")
    @ApiResponse(responseCode = "500", description = "피처 계약 위반, 파이프라인 또는 모델 실패")
    public ResponseEntity<ScoreResponse> predict(@RequestBody Map<String, Object> payload) {
        return ResponseEntity.ok(scoringService.predict(payload));
    }

    @PostMapping("/explain")
    @Operation(summary = "판정 기여도 설명", description = "감독 분류기 확률에 대한 상위 k개 피처 기여도를 계산합니다")
    @ApiResponse(responseCode = "200", description = "설명 성공",
        content = @Content(mediaType = "application/json",
            examples = @ExampleObject(value = """
                {
                  "modelVersion": "v1",
                  "baseline": 0.0121,
                  "prediction": 0.7433,
                  "attributions": [
                    { "feature": "amount_scaled", "contribution": 0.4120, "value": 3.82 },
                    { "feature": "last_5_mean_amount", "contribution": 0.1893, "value": 212.4 }
                  ]
                }""")))
    @ApiResponse(responseCode = "400", description = "필수 필드 누락 또는 잘못된 k")
    public ResponseEntity<ExplainResponse> explain(
            @RequestBody Map<String, Object> payload,
            @Parameter(description = "반환할 피처 수 (기본값은 설정값)") @RequestParam(required = false) Integer k) {
        return ResponseEntity.ok(scoringService.explain(payload, k));
    }
}
