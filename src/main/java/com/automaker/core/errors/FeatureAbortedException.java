package com.automaker.core.errors;

/**
 * Thrown when a feature execution observes a user-initiated stop.
 */
public class FeatureAbortedException extends RuntimeException {

    public FeatureAbortedException(String message) {
        super(message);
    }
}
