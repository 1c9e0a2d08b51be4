package com.automaker.core.model;

/**
 * Configuration of one project's scheduler loop.
 */
public record AutoLoopConfig(
    String projectPath,
    int maxConcurrency,
    boolean useWorktrees
) {
}
