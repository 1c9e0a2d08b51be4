package com.automaker.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the single-feature endpoints (run, resume, verify, commit, stop).
 * Fields an endpoint does not use are ignored.
 */
public record FeatureRequest(
    @JsonProperty("projectPath") String projectPath,
    @JsonProperty("featureId") String featureId,
    @JsonProperty("useWorktrees") Boolean useWorktrees,
    @JsonProperty("worktreePath") String worktreePath
) {

    boolean worktreesOrDefault(boolean defaultValue) {
        return useWorktrees != null ? useWorktrees : defaultValue;
    }
}
