package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * A post-implementation step configured for a project.
 *
 * @param id           step identifier, used in the {@code pipeline_<id>} status
 * @param name         human-readable name
 * @param order        sort key, lower runs first
 * @param instructions prompt instructions for the agent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineStep(
    String id,
    String name,
    int order,
    String instructions
) implements Serializable {
}
