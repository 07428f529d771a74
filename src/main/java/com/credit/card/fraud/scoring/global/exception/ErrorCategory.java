package com.credit.card.fraud.scoring.global.exception;

public enum ErrorCategory {
    INPUT,
    CONTRACT_VIOLATION,
    PIPELINE_FAILURE,
    ARTIFACT,
    MODEL_FAILURE
}
