package com.credit.card.fraud.scoring.contract.exceptions;

import com.credit.card.fraud.scoring.contract.service.ContractViolation;
import com.credit.card.fraud.scoring.global.exception.ErrorCategory;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;

public class FeatureContractViolationException extends FraudScoringException {

    private final ContractViolation violation;

    public FeatureContractViolationException(ContractViolation violation) {
        super(ErrorCategory.CONTRACT_VIOLATION,
                "Feature contract mismatch. Missing: " + violation.getMissing()
                        + " | Extra: " + violation.getExtra());
        this.violation = violation;
    }

    public ContractViolation getViolation() {
        return violation;
    }
}
