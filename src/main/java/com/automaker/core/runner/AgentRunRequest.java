package com.automaker.core.runner;

import com.automaker.core.agent.AgentProvider;
import com.automaker.core.agent.CancellationToken;
import com.automaker.core.model.PlanningMode;

import java.nio.file.Path;

/**
 * Inputs for one {@link AgentRunner#runAgent} call.
 *
 * @param projectPath         project the feature belongs to
 * @param featureId           feature being executed
 * @param workDir             directory the agent works in
 * @param prompt              initial prompt
 * @param provider            resolved agent backend
 * @param model               resolved model
 * @param systemPrompt        project context and memory
 * @param cancellation        the feature's cancellation token
 * @param planningMode        planning mode for this call, {@code SKIP} for pipeline steps and follow-ups
 * @param requirePlanApproval whether a generated plan must be approved by a human
 * @param previousContent     earlier transcript to carry forward, may be null
 */
public record AgentRunRequest(
    String projectPath,
    String featureId,
    Path workDir,
    String prompt,
    AgentProvider provider,
    String model,
    String systemPrompt,
    CancellationToken cancellation,
    PlanningMode planningMode,
    boolean requirePlanApproval,
    String previousContent
) {
}
