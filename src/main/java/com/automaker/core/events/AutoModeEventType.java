package com.automaker.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every event the orchestrator publishes. The wire name is what SSE clients see.
 */
public enum AutoModeEventType {
    // loop lifecycle
    AUTO_MODE_STARTED("auto_mode_started"),
    AUTO_MODE_STOPPED("auto_mode_stopped"),
    AUTO_MODE_IDLE("auto_mode_idle"),
    AUTO_MODE_PAUSED_FAILURES("auto_mode_paused_failures"),
    AUTO_MODE_RESUMING_FEATURES("auto_mode_resuming_features"),

    // feature lifecycle
    AUTO_MODE_FEATURE_START("auto_mode_feature_start"),
    AUTO_MODE_PROGRESS("auto_mode_progress"),
    AUTO_MODE_TOOL("auto_mode_tool"),
    AUTO_MODE_FEATURE_COMPLETE("auto_mode_feature_complete"),
    AUTO_MODE_ERROR("auto_mode_error"),

    // planning
    PLANNING_STARTED("planning_started"),
    PLAN_APPROVAL_REQUIRED("plan_approval_required"),
    PLAN_APPROVED("plan_approved"),
    PLAN_REJECTED("plan_rejected"),
    PLAN_AUTO_APPROVED("plan_auto_approved"),
    PLAN_REVISION_REQUESTED("plan_revision_requested"),

    // tasks
    AUTO_MODE_TASK_STARTED("auto_mode_task_started"),
    AUTO_MODE_TASK_COMPLETE("auto_mode_task_complete"),
    AUTO_MODE_PHASE_COMPLETE("auto_mode_phase_complete"),

    // pipeline
    PIPELINE_STEP_STARTED("pipeline_step_started"),
    PIPELINE_STEP_COMPLETE("pipeline_step_complete");

    private final String wireName;

    AutoModeEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
