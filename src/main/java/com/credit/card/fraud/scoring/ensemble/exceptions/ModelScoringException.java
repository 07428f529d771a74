package com.credit.card.fraud.scoring.ensemble.exceptions;

import com.credit.card.fraud.scoring.global.exception.ErrorCategory;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;

public class ModelScoringException extends FraudScoringException {

    private final String member;

    public ModelScoringException(String member, String message, Throwable cause) {
        super(ErrorCategory.MODEL_FAILURE, "Model '" + member + "' failed: " + message, cause);
        this.member = member;
    }

    public String getMember() {
        return member;
    }
}
