package com.credit.card.fraud.scoring.decision.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FraudLabel {
    FRAUD("fraud"),
    LEGIT("legit");

    private final String value;

    FraudLabel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
