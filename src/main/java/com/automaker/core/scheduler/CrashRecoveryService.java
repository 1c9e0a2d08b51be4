package com.automaker.core.scheduler;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.engine.FeatureExecutionController;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.model.ExecutionState;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.persistence.ExecutionStateStore;
import com.automaker.core.persistence.FeatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks up work that was in flight when the process last stopped.
 * <p>
 * Features left {@code in_progress} or at a {@code pipeline_*} status with recorded agent
 * output are resumed; the controller decides whether that means a pipeline step or a
 * continuation of the transcript. Interrupted features without output are left for the
 * scheduler loop, and a loop that was running at shutdown is started again.
 */
@Service
public class CrashRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(CrashRecoveryService.class);

    private final FeatureStore featureStore;
    private final ExecutionStateStore executionStateStore;
    private final FeatureExecutionController controller;
    private final AutoLoopScheduler scheduler;
    private final EventBus eventBus;
    private final AutomakerProperties.Recovery recovery;

    public CrashRecoveryService(FeatureStore featureStore, ExecutionStateStore executionStateStore,
                                FeatureExecutionController controller, AutoLoopScheduler scheduler,
                                EventBus eventBus, AutomakerProperties properties) {
        this.featureStore = featureStore;
        this.executionStateStore = executionStateStore;
        this.controller = controller;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.recovery = properties.getRecovery();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!recovery.isResumeOnStartup()) {
            log.info("Startup recovery disabled");
            return;
        }
        for (String projectPath : recovery.getProjectPaths()) {
            try {
                recoverProject(projectPath);
            } catch (RuntimeException e) {
                log.error("Recovery failed for project {}", projectPath, e);
            }
        }
    }

    /**
     * Resumes the project's interrupted features and restarts its loop if the snapshot says it was running.
     *
     * @return the ids of the features being resumed
     */
    public List<String> recoverProject(String projectPath) {
        // Read before resuming: every admission rewrites the snapshot.
        ExecutionState state = executionStateStore.load(projectPath);
        List<String> resumed = resumeInterruptedFeatures(projectPath);

        if (state.autoLoopWasRunning() && !scheduler.isRunning(projectPath)) {
            log.info("Auto loop was running for {} before restart, starting it again", projectPath);
            scheduler.start(projectPath, state.maxConcurrency());
        }
        return resumed;
    }

    public List<String> resumeInterruptedFeatures(String projectPath) {
        log.info("Checking {} for interrupted features", projectPath);
        List<Feature> interrupted = featureStore.list(projectPath).stream()
                .filter(f -> FeatureStatus.IN_PROGRESS.equals(f.getStatus()) || FeatureStatus.isPipeline(f.getStatus()))
                .filter(f -> {
                    boolean hasOutput = featureStore.hasAgentOutput(projectPath, f.getId());
                    if (!hasOutput) {
                        log.info("Interrupted feature {} has no output, leaving it for a fresh start", f.getId());
                    }
                    return hasOutput;
                })
                .toList();

        if (interrupted.isEmpty()) {
            log.info("No interrupted features found in {}", projectPath);
            return List.of();
        }

        List<String> ids = interrupted.stream().map(Feature::getId).toList();
        List<Map<String, Object>> summaries = interrupted.stream().map(f -> {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("id", f.getId());
            summary.put("title", f.displayTitle());
            summary.put("status", f.getStatus());
            return summary;
        }).toList();
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_RESUMING_FEATURES, projectPath,
                Map.of("message", "Resuming " + ids.size() + " interrupted feature(s) after server restart",
                        "featureIds", ids,
                        "features", summaries)));

        for (Feature feature : interrupted) {
            try {
                log.info("Resuming feature {} ({})", feature.getId(), feature.getStatus());
                controller.resumeFeatureAsync(projectPath, feature.getId(), true);
            } catch (RuntimeException e) {
                log.error("Failed to resume feature {}", feature.getId(), e);
            }
        }
        return ids;
    }
}
