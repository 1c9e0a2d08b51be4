package com.automaker.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for starting the auto loop.
 */
public record StartAutoModeRequest(
    @JsonProperty("projectPath") String projectPath,
    @JsonProperty("maxConcurrency") Integer maxConcurrency
) {}
