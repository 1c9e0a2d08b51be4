package com.automaker.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for approving or rejecting a generated plan.
 * {@code projectPath} is needed only when the server restarted while the plan was pending.
 */
public record ApprovePlanRequest(
    @JsonProperty("featureId") String featureId,
    @JsonProperty("approved") Boolean approved,
    @JsonProperty("editedPlan") String editedPlan,
    @JsonProperty("feedback") String feedback,
    @JsonProperty("projectPath") String projectPath
) {}
