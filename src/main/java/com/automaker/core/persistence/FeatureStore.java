package com.automaker.core.persistence;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.errors.StorageException;
import com.automaker.core.model.Feature;
import com.automaker.core.model.PlanSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * File-backed feature records under {@code <project>/.automaker/features/<featureId>/}.
 * <p>
 * Each feature directory holds {@code feature.json}, the rolling {@code agent-output.md}
 * transcript and the optional {@code raw-output.jsonl} debug log. Read-modify-write updates
 * are serialized per feature file.
 */
@Service
public class FeatureStore {

    private static final Logger log = LoggerFactory.getLogger(FeatureStore.class);

    static final String AUTOMAKER_DIR = ".automaker";
    static final String FEATURES_DIR = "features";
    static final String FEATURE_FILE = "feature.json";
    static final String AGENT_OUTPUT_FILE = "agent-output.md";
    static final String RAW_OUTPUT_FILE = "raw-output.jsonl";

    private final AtomicJsonFiles files;
    private final Clock clock;
    private final ConcurrentHashMap<Path, Object> locks = new ConcurrentHashMap<>();

    @Autowired
    public FeatureStore(ObjectMapper objectMapper, AutomakerProperties properties) {
        this(new AtomicJsonFiles(objectMapper, properties.getStorage().getBackupCount()), Clock.systemUTC());
    }

    FeatureStore(AtomicJsonFiles files, Clock clock) {
        this.files = files;
        this.clock = clock;
    }

    public static Path automakerDir(String projectPath) {
        return Path.of(projectPath, AUTOMAKER_DIR);
    }

    public static Path featureDir(String projectPath, String featureId) {
        return automakerDir(projectPath).resolve(FEATURES_DIR).resolve(featureId);
    }

    public Path agentOutputPath(String projectPath, String featureId) {
        return featureDir(projectPath, featureId).resolve(AGENT_OUTPUT_FILE);
    }

    public Path rawOutputPath(String projectPath, String featureId) {
        return featureDir(projectPath, featureId).resolve(RAW_OUTPUT_FILE);
    }

    private Path featureFile(String projectPath, String featureId) {
        return featureDir(projectPath, featureId).resolve(FEATURE_FILE);
    }

    public Optional<Feature> load(String projectPath, String featureId) {
        Path path = featureFile(projectPath, featureId);
        RecoveredJson<Feature> result = files.readWithRecovery(path, Feature.class, null);
        if (result.recovered()) {
            log.warn("Feature {} recovered from {} ({})", featureId, result.source(), result.error());
        }
        return Optional.ofNullable(result.data());
    }

    /** All readable features of a project; unreadable records are skipped with a warning. */
    public List<Feature> list(String projectPath) {
        Path featuresDir = automakerDir(projectPath).resolve(FEATURES_DIR);
        if (!Files.isDirectory(featuresDir)) {
            return List.of();
        }
        List<Feature> features = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(featuresDir)) {
            for (Path dir : dirs.filter(Files::isDirectory).sorted().toList()) {
                String featureId = dir.getFileName().toString();
                Optional<Feature> feature = load(projectPath, featureId);
                if (feature.isPresent()) {
                    features.add(feature.get());
                } else {
                    log.warn("Skipping unreadable feature {} in {}", featureId, projectPath);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list features in " + featuresDir, e);
        }
        return features;
    }

    public void save(String projectPath, Feature feature) {
        Path path = featureFile(projectPath, feature.getId());
        synchronized (lockFor(path)) {
            files.write(path, feature, true);
        }
    }

    /**
     * Applies {@code mutation} to the stored feature and writes it back, refreshing {@code updatedAt}.
     *
     * @return the updated feature, or empty when it does not exist
     */
    public Optional<Feature> update(String projectPath, String featureId, Consumer<Feature> mutation) {
        Path path = featureFile(projectPath, featureId);
        synchronized (lockFor(path)) {
            Optional<Feature> loaded = load(projectPath, featureId);
            if (loaded.isEmpty()) {
                log.warn("Feature {} not found or could not be recovered", featureId);
                return Optional.empty();
            }
            Feature feature = loaded.get();
            mutation.accept(feature);
            feature.setUpdatedAt(Instant.now(clock));
            files.write(path, feature, true);
            return Optional.of(feature);
        }
    }

    /**
     * Sets the feature's status. {@code justFinishedAt} is stamped on entering
     * {@code waiting_approval} and cleared on every other status.
     */
    public Optional<Feature> updateStatus(String projectPath, String featureId, String status) {
        return update(projectPath, featureId, feature -> {
            feature.setStatus(status);
            if ("waiting_approval".equals(status)) {
                feature.setJustFinishedAt(Instant.now(clock));
            } else {
                feature.setJustFinishedAt(null);
            }
        });
    }

    /** Applies {@code mutation} to the feature's plan spec, creating a pending v1 spec if none exists. */
    public Optional<Feature> updatePlanSpec(String projectPath, String featureId, Consumer<PlanSpec> mutation) {
        return update(projectPath, featureId, feature -> {
            if (feature.getPlanSpec() == null) {
                PlanSpec initial = PlanSpec.initial();
                initial.setReviewedByUser(false);
                feature.setPlanSpec(initial);
            }
            mutation.accept(feature.getPlanSpec());
        });
    }

    // -- agent output ---

    public boolean hasAgentOutput(String projectPath, String featureId) {
        return Files.isRegularFile(agentOutputPath(projectPath, featureId));
    }

    public Optional<String> readAgentOutput(String projectPath, String featureId) {
        Path path = agentOutputPath(projectPath, featureId);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read agent output for {}: {}", featureId, e.getMessage());
            return Optional.empty();
        }
    }

    public void writeAgentOutput(String projectPath, String featureId, String content) {
        Path path = agentOutputPath(projectPath, featureId);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to write agent output for " + featureId, e);
        }
    }

    public void appendRawOutput(String projectPath, String featureId, String jsonLine) {
        Path path = rawOutputPath(projectPath, featureId);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, jsonLine + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.debug("Failed to append raw output for {}: {}", featureId, e.getMessage());
        }
    }

    private Object lockFor(Path path) {
        return locks.computeIfAbsent(path, k -> new Object());
    }
}
