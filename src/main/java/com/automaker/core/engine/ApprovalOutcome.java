package com.automaker.core.engine;

/**
 * Result of {@link FeatureExecutionController#resolvePlanApproval}.
 */
public record ApprovalOutcome(boolean success, String error) {

    public static ApprovalOutcome ok() {
        return new ApprovalOutcome(true, null);
    }

    public static ApprovalOutcome failure(String error) {
        return new ApprovalOutcome(false, error);
    }
}
