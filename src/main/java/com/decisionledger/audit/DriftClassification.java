package com.decisionledger.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DriftClassification {
    IDENTICAL("identical"),
    REGRESSION("regression"),
    IMPROVEMENT("improvement"),
    NEUTRAL("neutral"),
    VIOLATION("violation");

    private final String value;

    DriftClassification(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DriftClassification fromValue(String value) {
        for (DriftClassification classification : values()) {
            if (classification.value.equalsIgnoreCase(value)) {
                return classification;
            }
        }
        throw new IllegalArgumentException("Unknown drift classification: " + value);
    }
}
