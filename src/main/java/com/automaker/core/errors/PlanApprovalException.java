package com.automaker.core.errors;

/**
 * Thrown when a plan approval ends without an approval: timeout, cancellation or an
 * outright rejection.
 */
public class PlanApprovalException extends RuntimeException {

    public PlanApprovalException(String message) {
        super(message);
    }

    public PlanApprovalException(String message, Throwable cause) {
        super(message, cause);
    }
}
