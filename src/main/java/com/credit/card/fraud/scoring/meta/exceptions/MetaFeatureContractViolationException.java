package com.credit.card.fraud.scoring.meta.exceptions;

import com.credit.card.fraud.scoring.global.exception.ErrorCategory;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;

import java.util.List;

public class MetaFeatureContractViolationException extends FraudScoringException {

    private final List<String> expected;
    private final List<String> actual;

    public MetaFeatureContractViolationException(String message, List<String> expected, List<String> actual) {
        super(ErrorCategory.CONTRACT_VIOLATION, message + " expected=" + expected + " actual=" + actual);
        this.expected = List.copyOf(expected);
        this.actual = List.copyOf(actual);
    }

    public List<String> getExpected() {
        return expected;
    }

    public List<String> getActual() {
        return actual;
    }
}
