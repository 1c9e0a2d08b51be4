package com.automaker.core.state;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-project scheduler loop states keyed by project path.
 */
@Component
public class AutoLoopStates {

    private final ConcurrentHashMap<String, ProjectAutoLoopState> states = new ConcurrentHashMap<>();

    /**
     * Installs {@code state} unless a running loop already exists for the project.
     *
     * @return true when installed
     */
    public boolean putIfNotRunning(String projectPath, ProjectAutoLoopState state) {
        boolean[] installed = {false};
        states.compute(projectPath, (k, existing) -> {
            if (existing != null && existing.isRunning()) {
                return existing;
            }
            installed[0] = true;
            return state;
        });
        return installed[0];
    }

    public Optional<ProjectAutoLoopState> get(String projectPath) {
        return Optional.ofNullable(states.get(projectPath));
    }

    public boolean remove(String projectPath, ProjectAutoLoopState state) {
        return states.remove(projectPath, state);
    }

    public boolean isRunning(String projectPath) {
        ProjectAutoLoopState state = states.get(projectPath);
        return state != null && state.isRunning();
    }

    public List<String> activeProjects() {
        return states.entrySet().stream()
                .filter(e -> e.getValue().isRunning())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
