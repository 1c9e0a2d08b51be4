package com.automaker.core.persistence;

import com.automaker.core.errors.StorageException;
import com.automaker.core.model.ExecutionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Persists the per-project {@link ExecutionState} snapshot to {@code .automaker/execution-state.json}.
 * Save failures are logged and swallowed so they never affect a running feature.
 */
@Service
public class ExecutionStateStore {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStateStore.class);

    static final String STATE_FILE = "execution-state.json";

    private final AtomicJsonFiles files;

    public ExecutionStateStore(ObjectMapper objectMapper) {
        this.files = new AtomicJsonFiles(objectMapper, 0);
    }

    private static Path statePath(String projectPath) {
        return FeatureStore.automakerDir(projectPath).resolve(STATE_FILE);
    }

    public void save(String projectPath, boolean loopRunning, int maxConcurrency, List<String> runningFeatureIds) {
        ExecutionState state = new ExecutionState(
                ExecutionState.CURRENT_VERSION,
                loopRunning,
                maxConcurrency,
                projectPath,
                List.copyOf(runningFeatureIds),
                Instant.now());
        try {
            files.write(statePath(projectPath), state, false);
            log.debug("Saved execution state for {}: {} running", projectPath, runningFeatureIds.size());
        } catch (StorageException e) {
            log.error("Failed to save execution state for {}", projectPath, e);
        }
    }

    public ExecutionState load(String projectPath) {
        return files.readWithRecovery(statePath(projectPath), ExecutionState.class, ExecutionState.empty()).data();
    }

    public void clear(String projectPath) {
        try {
            if (Files.deleteIfExists(statePath(projectPath))) {
                log.info("Cleared execution state for {}", projectPath);
            }
        } catch (IOException e) {
            log.error("Failed to clear execution state for {}", projectPath, e);
        }
    }
}
