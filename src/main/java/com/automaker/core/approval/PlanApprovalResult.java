package com.automaker.core.approval;

/**
 * A reviewer's decision on a generated plan.
 *
 * @param approved   whether the plan was approved
 * @param editedPlan plan text edited by the reviewer, may be null
 * @param feedback   free-form feedback, may be null
 */
public record PlanApprovalResult(boolean approved, String editedPlan, String feedback) {

    public boolean hasEdits() {
        return editedPlan != null && !editedPlan.isBlank();
    }

    public boolean hasFeedback() {
        return feedback != null && !feedback.isBlank();
    }
}
