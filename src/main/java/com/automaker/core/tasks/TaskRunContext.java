package com.automaker.core.tasks;

import com.automaker.core.agent.AgentInvocation;
import com.automaker.core.agent.AgentProvider;
import com.automaker.core.agent.AgentQuery;
import com.automaker.core.agent.CancellationToken;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to issue agent calls on behalf of one running feature.
 */
public record TaskRunContext(
    String projectPath,
    String featureId,
    AgentProvider provider,
    String model,
    Path workDir,
    String systemPrompt,
    CancellationToken cancellation,
    AgentInvocation.Listener listener
) {

    public AgentQuery query(String prompt) {
        return new AgentQuery(prompt, model, workDir, systemPrompt, List.of(), cancellation);
    }
}
