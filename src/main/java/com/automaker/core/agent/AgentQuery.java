package com.automaker.core.agent;

import java.nio.file.Path;
import java.util.List;

/**
 * Options for a single agent invocation.
 *
 * @param prompt       user prompt
 * @param model        resolved model identifier
 * @param workDir      working directory the agent operates in
 * @param systemPrompt optional system prompt (project context and memory)
 * @param allowedTools tools the agent may use, empty for provider defaults
 * @param cancellation cancellation signal checked while streaming
 */
public record AgentQuery(
    String prompt,
    String model,
    Path workDir,
    String systemPrompt,
    List<String> allowedTools,
    CancellationToken cancellation
) {
}
