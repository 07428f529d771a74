package com.credit.card.fraud.scoring.global.exception;

/**
 * 스코어링 코어 예외의 공통 부모
 */
public class FraudScoringException extends RuntimeException {

    private final ErrorCategory category;

    public FraudScoringException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public FraudScoringException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
