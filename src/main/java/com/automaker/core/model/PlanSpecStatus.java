package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a generated plan: pending, generating, generated, then approved or rejected.
 */
public enum PlanSpecStatus {
    PENDING,
    GENERATING,
    GENERATED,
    APPROVED,
    REJECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PlanSpecStatus fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
