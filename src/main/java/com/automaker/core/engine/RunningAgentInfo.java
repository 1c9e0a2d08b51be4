package com.automaker.core.engine;

import java.time.Instant;

/**
 * A running feature as reported to clients.
 */
public record RunningAgentInfo(
    String featureId,
    String projectPath,
    String projectName,
    boolean isAutoMode,
    String title,
    String description,
    String branchName,
    String worktreePath,
    String model,
    String provider,
    Instant startTime
) {
}
