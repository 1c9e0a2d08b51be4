package com.automaker.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProjectRequest(
    @JsonProperty("projectPath") String projectPath
) {}
