package com.credit.card.fraud.scoring.features.exceptions;

import com.credit.card.fraud.scoring.global.exception.ErrorCategory;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;

/**
 * 비어 있거나 손상된 중간 테이블에서 스테이지가 실행된 경우
 */
public class PipelineStageException extends FraudScoringException {

    private final String stage;

    public PipelineStageException(String stage, String message) {
        super(ErrorCategory.PIPELINE_FAILURE, "[" + stage + "] " + message);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
