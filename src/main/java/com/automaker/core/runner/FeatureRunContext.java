package com.automaker.core.runner;

import com.automaker.core.agent.AgentProvider;
import com.automaker.core.agent.CancellationToken;
import com.automaker.core.model.PlanningMode;

import java.nio.file.Path;

/**
 * The resolved environment of one feature execution, shared by every agent call it makes.
 */
public record FeatureRunContext(
    String projectPath,
    String featureId,
    Path workDir,
    AgentProvider provider,
    String model,
    String systemPrompt,
    CancellationToken cancellation
) {

    public AgentRunRequest request(String prompt, PlanningMode planningMode, boolean requirePlanApproval,
                                   String previousContent) {
        return new AgentRunRequest(projectPath, featureId, workDir, prompt, provider, model, systemPrompt,
                cancellation, planningMode, requirePlanApproval, previousContent);
    }
}
