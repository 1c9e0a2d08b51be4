package com.automaker.core.scheduler;

import com.automaker.core.circuit.FailureCircuitBreaker;
import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.engine.FeatureExecutionController;
import com.automaker.core.errors.FeatureAlreadyRunningException;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.logging.MdcContext;
import com.automaker.core.model.AutoLoopConfig;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.state.AutoLoopStates;
import com.automaker.core.state.ExecutionSnapshots;
import com.automaker.core.state.ProjectAutoLoopState;
import com.automaker.core.state.RunningFeatureRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one polling loop per project that keeps up to {@code maxConcurrency} features executing.
 * <p>
 * Each iteration checks capacity, loads the schedulable features whose dependencies are
 * satisfied, and dispatches the first one that is not already running. Admission into the
 * running registry happens synchronously inside the dispatch call, so the next iteration
 * always sees it. Iteration errors are logged and absorbed by a backoff.
 */
@Service
public class AutoLoopScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutoLoopScheduler.class);

    /** Sleep durations of the polling loop, in milliseconds. */
    record Backoffs(long capacityMs, long idleMs, long dispatchMs, long errorMs) {}

    private final AutoLoopStates loops;
    private final RunningFeatureRegistry runningFeatures;
    private final FeatureStore featureStore;
    private final DependencyResolver dependencyResolver;
    private final FeatureExecutionController controller;
    private final FailureCircuitBreaker circuitBreaker;
    private final ExecutionSnapshots snapshots;
    private final EventBus eventBus;
    private final Backoffs backoffs;
    private final int defaultMaxConcurrency;
    private final boolean useWorktrees;
    private final boolean skipVerification;

    @Autowired
    public AutoLoopScheduler(AutoLoopStates loops, RunningFeatureRegistry runningFeatures, FeatureStore featureStore,
                             DependencyResolver dependencyResolver, FeatureExecutionController controller,
                             FailureCircuitBreaker circuitBreaker, ExecutionSnapshots snapshots, EventBus eventBus,
                             AutomakerProperties properties) {
        this(loops, runningFeatures, featureStore, dependencyResolver, controller, circuitBreaker, snapshots, eventBus,
                new Backoffs(properties.getAutoLoop().getCapacityBackoffMs(),
                        properties.getAutoLoop().getIdleBackoffMs(),
                        properties.getAutoLoop().getDispatchIntervalMs(),
                        properties.getAutoLoop().getErrorBackoffMs()),
                properties.getAutoLoop().getMaxConcurrency(),
                properties.getAutoLoop().isUseWorktrees(),
                properties.getAutoLoop().isSkipVerification());
    }

    AutoLoopScheduler(AutoLoopStates loops, RunningFeatureRegistry runningFeatures, FeatureStore featureStore,
                      DependencyResolver dependencyResolver, FeatureExecutionController controller,
                      FailureCircuitBreaker circuitBreaker, ExecutionSnapshots snapshots, EventBus eventBus,
                      Backoffs backoffs, int defaultMaxConcurrency, boolean useWorktrees, boolean skipVerification) {
        this.loops = loops;
        this.runningFeatures = runningFeatures;
        this.featureStore = featureStore;
        this.dependencyResolver = dependencyResolver;
        this.controller = controller;
        this.circuitBreaker = circuitBreaker;
        this.snapshots = snapshots;
        this.eventBus = eventBus;
        this.backoffs = backoffs;
        this.defaultMaxConcurrency = defaultMaxConcurrency;
        this.useWorktrees = useWorktrees;
        this.skipVerification = skipVerification;
        circuitBreaker.onPause(this::pauseForFailures);
    }

    // -- lifecycle ---

    /**
     * Starts the loop for a project. Restarting also clears the project's failure window and paused flag.
     *
     * @param maxConcurrency ceiling for this project, or null for the configured default
     * @return the ceiling in effect
     * @throws IllegalStateException if a loop is already running for the project
     */
    public int start(String projectPath, Integer maxConcurrency) {
        int ceiling = maxConcurrency != null && maxConcurrency > 0 ? maxConcurrency : defaultMaxConcurrency;
        ProjectAutoLoopState state = new ProjectAutoLoopState(new AutoLoopConfig(projectPath, ceiling, useWorktrees));
        if (!loops.putIfNotRunning(projectPath, state)) {
            throw new IllegalStateException("Auto mode is already running for project: " + projectPath);
        }
        circuitBreaker.reset(projectPath);
        log.info("Starting auto loop for project {} with maxConcurrency {}", projectPath, ceiling);

        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_STARTED, projectPath,
                Map.of("message", "Auto mode started with max " + ceiling + " concurrent features",
                        "maxConcurrency", ceiling)));
        snapshots.save(projectPath);

        Path name = Path.of(projectPath).getFileName();
        Thread thread = new Thread(() -> runLoop(state), "auto-loop-" + (name != null ? name : projectPath));
        thread.setDaemon(true);
        state.setThread(thread);
        thread.start();
        return ceiling;
    }

    /**
     * Stops the project's loop. Features already running continue to completion.
     *
     * @return the number of features still running for the project
     */
    public int stop(String projectPath) {
        Optional<ProjectAutoLoopState> existing = loops.get(projectPath);
        if (existing.isEmpty()) {
            log.warn("No auto loop running for project {}", projectPath);
            return 0;
        }
        ProjectAutoLoopState state = existing.get();
        boolean wasRunning = state.isRunning();
        state.stop();
        // Unregister before clearing so a concurrent feature save cannot rewrite the snapshot
        loops.remove(projectPath, state);
        snapshots.clear(projectPath);
        if (wasRunning) {
            eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_STOPPED, projectPath,
                    Map.of("message", "Auto mode stopped")));
        }
        return runningFeatures.countForProject(projectPath);
    }

    private void pauseForFailures(String projectPath) {
        if (loops.isRunning(projectPath)) {
            log.warn("Pausing auto mode for project {} after repeated failures", projectPath);
            stop(projectPath);
        }
    }

    @PreDestroy
    void shutdown() {
        for (String projectPath : loops.activeProjects()) {
            loops.get(projectPath).ifPresent(ProjectAutoLoopState::stop);
        }
    }

    // -- loop ---

    private void runLoop(ProjectAutoLoopState state) {
        AutoLoopConfig config = state.getConfig();
        String projectPath = config.projectPath();
        MdcContext.setProject(projectPath);
        log.info("Auto loop started for {}, maxConcurrency {}", projectPath, config.maxConcurrency());
        long iterations = 0;
        try {
            while (state.isRunning() && !state.getCancellation().isCancelled()) {
                iterations++;
                try {
                    int runningCount = runningFeatures.countForProject(projectPath);
                    if (runningCount >= config.maxConcurrency()) {
                        log.debug("At capacity ({}/{}), waiting", runningCount, config.maxConcurrency());
                        sleep(backoffs.capacityMs());
                        continue;
                    }

                    List<Feature> eligible = loadEligibleFeatures(projectPath);
                    log.debug("Iteration {}: {} eligible features, {} running", iterations, eligible.size(), runningCount);

                    if (eligible.isEmpty()) {
                        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_IDLE, projectPath,
                                Map.of("message", "No pending features - auto mode idle")));
                        sleep(backoffs.idleMs());
                        continue;
                    }

                    Optional<Feature> next = eligible.stream()
                            .filter(f -> !runningFeatures.isRunning(f.getId()))
                            .findFirst();
                    if (next.isPresent()) {
                        dispatch(projectPath, next.get(), config.useWorktrees());
                    } else {
                        log.debug("All eligible features are already running");
                    }
                    sleep(backoffs.dispatchMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("Auto loop iteration error for {}", projectPath, e);
                    try {
                        sleep(backoffs.errorMs());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            state.stop();
            log.info("Auto loop stopped for {} after {} iterations", projectPath, iterations);
            MdcContext.clear();
        }
    }

    private void dispatch(String projectPath, Feature feature, boolean worktrees) {
        log.info("Starting feature {}: {}", feature.getId(), feature.displayTitle());
        try {
            controller.executeFeatureAsync(projectPath, feature.getId(), worktrees, true, null);
        } catch (FeatureAlreadyRunningException e) {
            log.debug("Feature {} was admitted concurrently, skipping", feature.getId());
        }
    }

    /**
     * Schedulable features of the project in dependency order, filtered to those whose
     * dependencies are finished.
     */
    List<Feature> loadEligibleFeatures(String projectPath) {
        List<Feature> all = featureStore.list(projectPath);
        List<Feature> pending = all.stream().filter(f -> FeatureStatus.isSchedulable(f.getStatus())).toList();
        return dependencyResolver.order(pending).stream()
                .filter(f -> dependencyResolver.isSatisfied(f, all, skipVerification))
                .toList();
    }

    private static void sleep(long ms) throws InterruptedException {
        Thread.sleep(ms);
    }

    // -- queries ---

    public boolean isRunning(String projectPath) {
        return loops.isRunning(projectPath);
    }

    public Map<String, Object> getStatusForProject(String projectPath) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("isAutoLoopRunning", loops.isRunning(projectPath));
        status.put("runningFeatures", runningFeatures.idsForProject(projectPath));
        status.put("runningCount", runningFeatures.countForProject(projectPath));
        status.put("maxConcurrency", loops.get(projectPath)
                .map(s -> s.getConfig().maxConcurrency())
                .orElse(defaultMaxConcurrency));
        status.put("paused", circuitBreaker.isPaused(projectPath));
        return status;
    }

    public List<String> getActiveAutoLoopProjects() {
        return loops.activeProjects();
    }
}
