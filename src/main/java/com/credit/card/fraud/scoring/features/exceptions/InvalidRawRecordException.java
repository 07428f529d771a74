package com.credit.card.fraud.scoring.features.exceptions;

import com.credit.card.fraud.scoring.global.exception.ErrorCategory;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;

public class InvalidRawRecordException extends FraudScoringException {

    private final String field;

    public InvalidRawRecordException(String field, String message) {
        super(ErrorCategory.INPUT, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
