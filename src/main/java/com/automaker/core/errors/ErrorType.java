package com.automaker.core.errors;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a failed feature execution.
 */
public enum ErrorType {
    ABORT("abort"),
    CANCELLATION("cancellation"),
    AUTHENTICATION("authentication"),
    QUOTA_EXHAUSTED("quota_exhausted"),
    RATE_LIMIT("rate_limit"),
    EXECUTION("execution"),
    UNKNOWN("unknown");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Errors that indicate the backend will keep failing until the user intervenes. */
    public boolean isUsageLimit() {
        return this == QUOTA_EXHAUSTED || this == RATE_LIMIT;
    }
}
