package com.automaker.core.state;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.persistence.ExecutionStateStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Writes the execution-state snapshot of a project from the current in-memory state.
 * Called on loop start and on every feature start and finish.
 * <p>
 * The file only exists while the project has a registered loop or features in flight; once
 * neither is true a save deletes it, so a feature finishing after a stop does not recreate it.
 */
@Service
public class ExecutionSnapshots {

    private final ExecutionStateStore store;
    private final RunningFeatureRegistry runningFeatures;
    private final AutoLoopStates loops;
    private final int defaultMaxConcurrency;

    public ExecutionSnapshots(ExecutionStateStore store, RunningFeatureRegistry runningFeatures,
                              AutoLoopStates loops, AutomakerProperties properties) {
        this.store = store;
        this.runningFeatures = runningFeatures;
        this.loops = loops;
        this.defaultMaxConcurrency = properties.getAutoLoop().getMaxConcurrency();
    }

    public void save(String projectPath) {
        Optional<ProjectAutoLoopState> loop = loops.get(projectPath);
        List<String> running = runningFeatures.idsForProject(projectPath);
        if (loop.isEmpty() && running.isEmpty()) {
            store.clear(projectPath);
            return;
        }
        int maxConcurrency = loop.map(s -> s.getConfig().maxConcurrency()).orElse(defaultMaxConcurrency);
        store.save(projectPath, loop.map(ProjectAutoLoopState::isRunning).orElse(false), maxConcurrency, running);
    }

    public void clear(String projectPath) {
        store.clear(projectPath);
    }
}
