package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a project's in-flight work, written to {@code .automaker/execution-state.json}
 * and read only at startup for crash recovery.
 *
 * @param version            schema version, currently 1
 * @param autoLoopWasRunning whether the scheduler loop was running when the snapshot was taken
 * @param maxConcurrency     concurrency ceiling of the loop
 * @param projectPath        the project the snapshot belongs to
 * @param runningFeatureIds  features believed to be in flight
 * @param savedAt            when the snapshot was written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionState(
    int version,
    boolean autoLoopWasRunning,
    int maxConcurrency,
    String projectPath,
    List<String> runningFeatureIds,
    Instant savedAt
) implements Serializable {

    public static final int CURRENT_VERSION = 1;
    public static final int DEFAULT_MAX_CONCURRENCY = 3;

    public static ExecutionState empty() {
        return new ExecutionState(CURRENT_VERSION, false, DEFAULT_MAX_CONCURRENCY, "", List.of(), null);
    }
}
