package com.credit.card.fraud.scoring.artifact.exceptions;

import com.credit.card.fraud.scoring.global.exception.ErrorCategory;
import com.credit.card.fraud.scoring.global.exception.FraudScoringException;

public class ArtifactLoadException extends FraudScoringException {

    public ArtifactLoadException(String message) {
        super(ErrorCategory.ARTIFACT, message);
    }

    public ArtifactLoadException(String message, Throwable cause) {
        super(ErrorCategory.ARTIFACT, message, cause);
    }
}
