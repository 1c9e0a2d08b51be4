package com.automaker.core.state;

import com.automaker.core.errors.FeatureAlreadyRunningException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of features with an active execution, at most one entry per feature id.
 * <p>
 * {@link #register} is a single {@code putIfAbsent}, so two concurrent attempts for the same
 * feature cannot both be admitted.
 */
@Component
public class RunningFeatureRegistry {

    private final ConcurrentHashMap<String, RunningFeature> running = new ConcurrentHashMap<>();

    /**
     * Admits a new execution attempt.
     *
     * @throws FeatureAlreadyRunningException if the feature already has one
     */
    public RunningFeature register(String featureId, String projectPath, boolean autoMode) {
        RunningFeature entry = new RunningFeature(featureId, projectPath, autoMode);
        if (running.putIfAbsent(featureId, entry) != null) {
            throw new FeatureAlreadyRunningException(featureId);
        }
        return entry;
    }

    /** Removes the entry only if it is still {@code entry}, so a newer attempt is left alone. */
    public boolean release(RunningFeature entry) {
        return running.remove(entry.getFeatureId(), entry);
    }

    public Optional<RunningFeature> get(String featureId) {
        return Optional.ofNullable(running.get(featureId));
    }

    public boolean isRunning(String featureId) {
        return running.containsKey(featureId);
    }

    public int countForProject(String projectPath) {
        return (int) running.values().stream()
                .filter(f -> f.getProjectPath().equals(projectPath))
                .count();
    }

    public List<String> idsForProject(String projectPath) {
        return running.values().stream()
                .filter(f -> f.getProjectPath().equals(projectPath))
                .map(RunningFeature::getFeatureId)
                .sorted()
                .toList();
    }

    public Collection<RunningFeature> all() {
        return List.copyOf(running.values());
    }
}
