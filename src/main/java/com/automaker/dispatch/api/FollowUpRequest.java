package com.automaker.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FollowUpRequest(
    @JsonProperty("projectPath") String projectPath,
    @JsonProperty("featureId") String featureId,
    @JsonProperty("prompt") String prompt,
    @JsonProperty("imagePaths") List<String> imagePaths,
    @JsonProperty("useWorktrees") Boolean useWorktrees
) {}
