package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much up-front planning the agent performs before implementing a feature.
 */
public enum PlanningMode {
    SKIP("skip"),
    LITE("lite"),
    LITE_WITH_APPROVAL("lite_with_approval"),
    SPEC("spec"),
    FULL("full");

    private final String value;

    PlanningMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PlanningMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SKIP;
        }
        for (PlanningMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown planning mode: " + value);
    }

    /**
     * Whether this mode produces a plan that may be held for human review.
     * Lite mode only does so when the feature asks for approval.
     */
    public boolean producesReviewablePlan(boolean requirePlanApproval) {
        return switch (this) {
            case SPEC, FULL, LITE_WITH_APPROVAL -> true;
            case LITE -> requirePlanApproval;
            case SKIP -> false;
        };
    }

    /** Whether the run must block on a human approval once the plan is generated. */
    public boolean requiresApproval(boolean requirePlanApproval) {
        return producesReviewablePlan(requirePlanApproval) && requirePlanApproval;
    }
}
