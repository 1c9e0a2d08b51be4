package com.automaker.core.errors;

/**
 * Result of classifying a failure.
 *
 * @param type    the classified type
 * @param message human-readable message
 */
public record ErrorInfo(ErrorType type, String message) {

    public boolean isAbort() {
        return type == ErrorType.ABORT || type == ErrorType.CANCELLATION;
    }
}
