package com.credit.card.fraud.scoring.artifact.exceptions;

import com.credit.card.fraud.scoring.global.exception.ErrorCategory;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;

public class ArtifactStoreException extends FraudScoringException {

    public ArtifactStoreException(String message) {
        super(ErrorCategory.ARTIFACT, message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(ErrorCategory.ARTIFACT, message, cause);
    }
}
