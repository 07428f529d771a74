package com.credit.card.fraud.scoring.global.exception;

import com.credit.card.fraud.scoring.contract.exceptions.FeatureContractViolationException;
import com.credit.card.fraud.scoring.ensemble.exceptions.ModelScoringException;
import com.credit.card.fraud.scoring.features.exceptions.InvalidRawRecordException;
import com.credit.card.fraud.scoring.features.exceptions.PipelineStageException;
import com.credit.card.fraud.scoring.meta.exceptions.MetaFeatureContractViolationException;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 잘못된 원본 레코드 (필수 필드 누락, 타입 오류)
     */
    @ExceptionHandler(InvalidRawRecordException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRawRecord(InvalidRawRecordException ex) {
        log.warn("Invalid raw record: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), Map.of("field", ex.getField()));
    }

    /**
     * 요청 본문을 JSON으로 읽을 수 없음
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Request body is not a valid JSON object", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request argument: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), null);
    }

    @ExceptionHandler(FeatureContractViolationException.class)
    public ResponseEntity<ErrorResponse> handleFeatureContractViolation(FeatureContractViolationException ex) {
        log.error("Feature contract violation: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "CONTRACT_VIOLATION", ex.getMessage(), Map.of(
                "missing", ex.getViolation().getMissing(),
                "extra", ex.getViolation().getExtra()));
    }

    @ExceptionHandler(MetaFeatureContractViolationException.class)
    public ResponseEntity<ErrorResponse> handleMetaContractViolation(MetaFeatureContractViolationException ex) {
        log.error("Meta feature contract violation: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "CONTRACT_VIOLATION", ex.getMessage(), Map.of(
                "expected", ex.getExpected(),
                "actual", ex.getActual()));
    }

    @ExceptionHandler(PipelineStageException.class)
    public ResponseEntity<ErrorResponse> handlePipelineFailure(PipelineStageException ex) {
        log.error("Feature pipeline failure: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "PIPELINE_FAILURE", ex.getMessage(),
                Map.of("stage", ex.getStage()));
    }

    @ExceptionHandler(ModelScoringException.class)
    public ResponseEntity<ErrorResponse> handleModelFailure(ModelScoringException ex) {
        log.error("Model scoring failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "MODEL_FAILURE", ex.getMessage(),
                Map.of("member", ex.getMember()));
    }

    /**
     * 분류되지 않은 스코어링 예외 (아티팩트 등)
     */
    @ExceptionHandler(FraudScoringException.class)
    public ResponseEntity<ErrorResponse> handleScoringException(FraudScoringException ex) {
        log.error("Scoring failure [{}]", ex.getCategory(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCategory().name(), ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception ex) {
        log.error("Unexpected server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "서버 내부 오류가 발생했습니다.", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Object details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(body);
    }

    /**
     * 에러 응답 DTO
     */
    @Getter
    @Builder
    public static class ErrorResponse {
        private LocalDateTime timestamp;
        private int status;
        private String error;
        private String message;
        private Object details;
    }
}
