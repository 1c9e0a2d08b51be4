package com.automaker.core.engine;

import com.automaker.core.agent.AgentProvider;
import com.automaker.core.agent.AgentProviderRegistry;
import com.automaker.core.approval.PlanApprovalGate;
import com.automaker.core.approval.PlanApprovalResult;
import com.automaker.core.circuit.FailureCircuitBreaker;
import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.errors.ErrorClassifier;
import com.automaker.core.errors.ErrorInfo;
import com.automaker.core.errors.FeatureAlreadyRunningException;
import com.automaker.core.errors.FeatureNotFoundException;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.logging.MdcContext;
import com.automaker.core.memory.LearningExtractor;
import com.automaker.core.memory.ProjectContext;
import com.automaker.core.memory.ProjectMemoryService;
import com.automaker.core.metrics.AutoModeMetrics;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.model.PipelineConfig;
import com.automaker.core.model.PipelineStep;
import com.automaker.core.model.PlanSpec;
import com.automaker.core.model.PlanSpecStatus;
import com.automaker.core.model.PlanningMode;
import com.automaker.core.notification.NotificationService;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.pipeline.PipelineConfigService;
import com.automaker.core.pipeline.PipelineStatusDetector;
import com.automaker.core.pipeline.PipelineStatusInfo;
import com.automaker.core.pipeline.PipelineStepRunner;
import com.automaker.core.prompt.PromptBuilder;
import com.automaker.core.runner.AgentRunner;
import com.automaker.core.runner.FeatureRunContext;
import com.automaker.core.state.ExecutionSnapshots;
import com.automaker.core.state.RunningFeature;
import com.automaker.core.state.RunningFeatureRegistry;
import com.automaker.core.workspace.WorkspaceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Per-feature state machine.
 * <p>
 * A run moves the feature to {@code in_progress}, invokes the agent (with the planning,
 * approval and task sub-flows handled by {@link AgentRunner}), runs the configured pipeline
 * steps, and ends in {@code verified} or {@code waiting_approval}. Failures send the feature
 * back to {@code backlog} and feed the circuit breaker; a user stop leaves the status as it is.
 * <p>
 * Admission into {@link RunningFeatureRegistry} happens on the caller's thread before any
 * I/O, and the entry is always released when the attempt ends.
 */
@Service
public class FeatureExecutionController {

    private static final Logger log = LoggerFactory.getLogger(FeatureExecutionController.class);

    private final FeatureStore featureStore;
    private final RunningFeatureRegistry runningFeatures;
    private final ExecutionSnapshots snapshots;
    private final WorkspaceResolver workspaceResolver;
    private final ProjectMemoryService memoryService;
    private final LearningExtractor learningExtractor;
    private final PromptBuilder promptBuilder;
    private final AgentProviderRegistry providers;
    private final AgentRunner agentRunner;
    private final PipelineConfigService pipelineConfigService;
    private final PipelineStatusDetector pipelineStatusDetector;
    private final PipelineStepRunner pipelineStepRunner;
    private final PlanApprovalGate approvalGate;
    private final FailureCircuitBreaker circuitBreaker;
    private final NotificationService notifications;
    private final EventBus eventBus;
    private final AutoModeMetrics metrics;
    private final ExecutorService featureExecutor;
    private final String defaultModel;

    public FeatureExecutionController(FeatureStore featureStore,
                                      RunningFeatureRegistry runningFeatures,
                                      ExecutionSnapshots snapshots,
                                      WorkspaceResolver workspaceResolver,
                                      ProjectMemoryService memoryService,
                                      LearningExtractor learningExtractor,
                                      PromptBuilder promptBuilder,
                                      AgentProviderRegistry providers,
                                      AgentRunner agentRunner,
                                      PipelineConfigService pipelineConfigService,
                                      PipelineStatusDetector pipelineStatusDetector,
                                      PipelineStepRunner pipelineStepRunner,
                                      PlanApprovalGate approvalGate,
                                      FailureCircuitBreaker circuitBreaker,
                                      NotificationService notifications,
                                      EventBus eventBus,
                                      AutoModeMetrics metrics,
                                      @Qualifier("featureExecutor") ExecutorService featureExecutor,
                                      AutomakerProperties properties) {
        this.featureStore = featureStore;
        this.runningFeatures = runningFeatures;
        this.snapshots = snapshots;
        this.workspaceResolver = workspaceResolver;
        this.memoryService = memoryService;
        this.learningExtractor = learningExtractor;
        this.promptBuilder = promptBuilder;
        this.providers = providers;
        this.agentRunner = agentRunner;
        this.pipelineConfigService = pipelineConfigService;
        this.pipelineStatusDetector = pipelineStatusDetector;
        this.pipelineStepRunner = pipelineStepRunner;
        this.approvalGate = approvalGate;
        this.circuitBreaker = circuitBreaker;
        this.notifications = notifications;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.featureExecutor = featureExecutor;
        this.defaultModel = properties.getAgent().getDefaultModel();
    }

    private record PreparedRun(FeatureRunContext ctx, List<String> memoryFiles) {}

    // -- execution ---

    /**
     * Admits the feature synchronously, then runs it on the feature executor.
     *
     * @throws FeatureAlreadyRunningException if the feature already has an active attempt
     */
    public CompletableFuture<Void> executeFeatureAsync(String projectPath, String featureId, boolean useWorktrees,
                                                       boolean isAutoMode, String continuationPrompt) {
        RunningFeature entry = admit(projectPath, featureId, isAutoMode);
        try {
            return CompletableFuture.runAsync(
                    () -> runExecution(entry, useWorktrees, continuationPrompt, true), featureExecutor)
                    .whenComplete((v, error) -> {
                        if (error != null) {
                            log.error("Feature {} execution ended with an unhandled error", featureId, error);
                        }
                    });
        } catch (RejectedExecutionException e) {
            releaseEntry(entry);
            throw e;
        }
    }

    /**
     * Runs the feature on the calling thread.
     *
     * @throws FeatureAlreadyRunningException if the feature already has an active attempt
     */
    public void executeFeature(String projectPath, String featureId, boolean useWorktrees,
                               boolean isAutoMode, String continuationPrompt) {
        RunningFeature entry = admit(projectPath, featureId, isAutoMode);
        runExecution(entry, useWorktrees, continuationPrompt, true);
    }

    private RunningFeature admit(String projectPath, String featureId, boolean isAutoMode) {
        RunningFeature entry = runningFeatures.register(featureId, projectPath, isAutoMode);
        snapshots.save(projectPath);
        return entry;
    }

    private void releaseEntry(RunningFeature entry) {
        runningFeatures.release(entry);
        snapshots.save(entry.getProjectPath());
    }

    /**
     * Runs an admitted attempt. With {@code resumeExisting} set and no continuation prompt, a
     * feature that already has agent output is handed to the resume path under the same entry.
     */
    private void runExecution(RunningFeature entry, boolean useWorktrees, String continuationPrompt,
                              boolean resumeExisting) {
        String projectPath = entry.getProjectPath();
        String featureId = entry.getFeatureId();
        MdcContext.setFeature(projectPath, featureId);
        long start = System.currentTimeMillis();
        boolean delegatedToResume = false;
        try {
            if (resumeExisting && continuationPrompt == null && featureStore.hasAgentOutput(projectPath, featureId)) {
                log.info("Feature {} has existing context, resuming instead of starting fresh", featureId);
                delegatedToResume = true;
                resumeAdmitted(entry, useWorktrees);
                return;
            }

            Feature feature = featureStore.load(projectPath, featureId)
                    .orElseThrow(() -> new FeatureNotFoundException(featureId));
            PreparedRun run = prepareRun(entry, feature, useWorktrees);
            FeatureRunContext ctx = run.ctx();

            publishFeatureStart(ctx, feature, null);
            updateFeatureStatus(projectPath, featureId, FeatureStatus.IN_PROGRESS);

            PlanningMode planningMode;
            String prompt;
            if (continuationPrompt != null) {
                log.info("Using continuation prompt for feature {}", featureId);
                prompt = continuationPrompt;
                planningMode = PlanningMode.SKIP;
            } else {
                prompt = promptBuilder.initialPrompt(feature);
                planningMode = feature.effectivePlanningMode();
                if (planningMode != PlanningMode.SKIP) {
                    eventBus.publish(AutoModeEvent.of(AutoModeEventType.PLANNING_STARTED, projectPath, featureId,
                            Map.of("mode", planningMode.value(),
                                    "message", "Starting " + planningMode.value() + " planning phase")));
                }
            }

            String output = agentRunner.runAgent(
                    ctx.request(prompt, planningMode, feature.requiresPlanApproval(), null));

            List<PipelineStep> steps = pipelineConfigService.getConfig(projectPath).sortedSteps();
            if (!steps.isEmpty()) {
                pipelineStepRunner.executeSteps(ctx, feature, steps);
            }

            ctx.cancellation().throwIfCancelled();
            String finalStatus = FeatureStatus.finalStatus(feature.skipsTests());
            updateFeatureStatus(projectPath, featureId, finalStatus);
            circuitBreaker.recordSuccess(projectPath);
            recordLearnings(projectPath, feature, output, run);

            long seconds = Math.round((System.currentTimeMillis() - start) / 1000.0);
            publishComplete(projectPath, featureId, true, "Feature completed in " + seconds + "s"
                    + (FeatureStatus.VERIFIED.equals(finalStatus) ? " - auto-verified" : ""));
            metrics.recordFeatureResult("success");
        } catch (Exception e) {
            handleExecutionFailure(entry, e);
        } finally {
            if (!delegatedToResume) {
                releaseEntry(entry);
                metrics.recordFeatureDuration(System.currentTimeMillis() - start);
                MdcContext.clear();
            }
        }
    }

    // -- resume ---

    /**
     * Resumes a feature that has prior output: from its pipeline step when it crashed inside the
     * pipeline, otherwise by continuing from the previous transcript, or fresh when there is none.
     *
     * @throws FeatureAlreadyRunningException if the feature already has an active attempt
     */
    public void resumeFeature(String projectPath, String featureId, boolean useWorktrees) {
        RunningFeature entry = admit(projectPath, featureId, false);
        resumeAdmitted(entry, useWorktrees);
    }

    /** Admits the feature synchronously, then resumes it on the feature executor. */
    public CompletableFuture<Void> resumeFeatureAsync(String projectPath, String featureId, boolean useWorktrees) {
        RunningFeature entry = admit(projectPath, featureId, false);
        try {
            return CompletableFuture.runAsync(() -> resumeAdmitted(entry, useWorktrees), featureExecutor)
                    .whenComplete((v, error) -> {
                        if (error != null) {
                            log.error("Failed to resume feature {}", featureId, error);
                        }
                    });
        } catch (RejectedExecutionException e) {
            releaseEntry(entry);
            throw e;
        }
    }

    /**
     * Resumes under an entry the caller already holds. Every path releases the entry when the
     * attempt ends.
     */
    private void resumeAdmitted(RunningFeature entry, boolean useWorktrees) {
        String projectPath = entry.getProjectPath();
        String featureId = entry.getFeatureId();
        Feature feature;
        PipelineStatusInfo pipelineInfo;
        try {
            feature = featureStore.load(projectPath, featureId)
                    .orElseThrow(() -> new FeatureNotFoundException(featureId));
            pipelineInfo = pipelineStatusDetector.detect(projectPath, feature.getStatus());
        } catch (RuntimeException e) {
            releaseEntry(entry);
            throw e;
        }

        if (pipelineInfo.isPipeline()) {
            log.info("Feature {} is at pipeline status {}, resuming pipeline", featureId, feature.getStatus());
            resumePipelineFeature(entry, feature, useWorktrees, pipelineInfo);
            return;
        }

        String resumePrompt = featureStore.readAgentOutput(projectPath, featureId)
                .filter(c -> !c.isBlank())
                .map(c -> promptBuilder.resumePrompt(feature, c))
                .orElse(null);
        runExecution(entry, useWorktrees, resumePrompt, false);
    }

    private void resumePipelineFeature(RunningFeature entry, Feature feature, boolean useWorktrees,
                                       PipelineStatusInfo pipelineInfo) {
        String projectPath = entry.getProjectPath();
        String featureId = feature.getId();
        if (!featureStore.hasAgentOutput(projectPath, featureId)) {
            log.warn("No agent output for pipeline feature {}, restarting from scratch", featureId);
            runExecution(entry, useWorktrees, null, false);
            return;
        }

        if (pipelineInfo.stepMissing()) {
            log.warn("Pipeline step {} of feature {} no longer exists, completing feature",
                    pipelineInfo.stepId(), featureId);
            try {
                updateFeatureStatus(projectPath, featureId, FeatureStatus.finalStatus(feature.skipsTests()));
                publishComplete(projectPath, featureId, true,
                        "Pipeline step no longer exists - feature completed without remaining pipeline steps");
            } finally {
                releaseEntry(entry);
            }
            return;
        }

        runPipelineFrom(entry, feature, useWorktrees, pipelineInfo.stepIndex(), pipelineInfo.config());
    }

    /**
     * Re-executes the step at {@code stepIndex} from scratch, then every later step in order.
     */
    void resumeFromPipelineStep(String projectPath, Feature feature, boolean useWorktrees,
                                int stepIndex, PipelineConfig config) {
        int stepCount = config.sortedSteps().size();
        if (stepIndex < 0 || stepIndex >= stepCount) {
            throw new IllegalArgumentException("Invalid step index " + stepIndex + " for " + stepCount + " steps");
        }
        RunningFeature entry = admit(projectPath, feature.getId(), false);
        runPipelineFrom(entry, feature, useWorktrees, stepIndex, config);
    }

    private void runPipelineFrom(RunningFeature entry, Feature feature, boolean useWorktrees,
                                 int stepIndex, PipelineConfig config) {
        String projectPath = entry.getProjectPath();
        String featureId = feature.getId();
        List<PipelineStep> steps = config.sortedSteps();
        List<PipelineStep> remaining = steps.subList(stepIndex, steps.size());

        MdcContext.setFeature(projectPath, featureId);
        long start = System.currentTimeMillis();
        try {
            PreparedRun run = prepareRun(entry, feature, useWorktrees);
            String resumeMessage = "Resuming from pipeline step " + (stepIndex + 1) + "/" + steps.size();
            publishFeatureStart(run.ctx(), feature, resumeMessage);
            eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_PROGRESS, projectPath, featureId,
                    Map.of("content", resumeMessage)));

            pipelineStepRunner.executeSteps(run.ctx(), feature, remaining);

            run.ctx().cancellation().throwIfCancelled();
            updateFeatureStatus(projectPath, featureId, FeatureStatus.finalStatus(feature.skipsTests()));
            circuitBreaker.recordSuccess(projectPath);
            publishComplete(projectPath, featureId, true, "Pipeline resumed and completed successfully");
            metrics.recordFeatureResult("success");
        } catch (Exception e) {
            handleExecutionFailure(entry, e);
        } finally {
            releaseEntry(entry);
            metrics.recordFeatureDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    // -- follow-up ---

    /**
     * Runs one more agent session on a feature with planning skipped, carrying the previous
     * transcript forward.
     */
    public void followUpFeature(String projectPath, String featureId, String instructions,
                                List<String> imagePaths, boolean useWorktrees) {
        RunningFeature entry = admit(projectPath, featureId, false);
        MdcContext.setFeature(projectPath, featureId);
        long start = System.currentTimeMillis();
        try {
            Feature feature = featureStore.load(projectPath, featureId)
                    .orElseThrow(() -> new FeatureNotFoundException(featureId));
            if (imagePaths != null && !imagePaths.isEmpty()) {
                feature = featureStore.update(projectPath, featureId, f -> {
                    List<String> merged = new ArrayList<>(f.getImagePaths());
                    imagePaths.stream().filter(p -> !merged.contains(p)).forEach(merged::add);
                    f.setImagePaths(merged);
                }).orElse(feature);
            }
            PreparedRun run = prepareRun(entry, feature, useWorktrees);
            String previousContext = featureStore.readAgentOutput(projectPath, featureId).orElse("");
            String prompt = promptBuilder.followUpPrompt(feature, previousContext, instructions);

            updateFeatureStatus(projectPath, featureId, FeatureStatus.IN_PROGRESS);
            publishFeatureStart(run.ctx(), feature, "Follow-up started");

            agentRunner.runAgent(run.ctx().request(prompt, PlanningMode.SKIP, false,
                    previousContext.isEmpty() ? null : previousContext));

            run.ctx().cancellation().throwIfCancelled();
            updateFeatureStatus(projectPath, featureId, FeatureStatus.finalStatus(feature.skipsTests()));
            circuitBreaker.recordSuccess(projectPath);
            publishComplete(projectPath, featureId, true, "Follow-up completed successfully");
            metrics.recordFeatureResult("success");
        } catch (Exception e) {
            handleExecutionFailure(entry, e);
        } finally {
            releaseEntry(entry);
            metrics.recordFeatureDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /** Admits a follow-up synchronously and runs it on the feature executor. */
    public CompletableFuture<Void> followUpFeatureAsync(String projectPath, String featureId, String instructions,
                                                        List<String> imagePaths, boolean useWorktrees) {
        if (runningFeatures.isRunning(featureId)) {
            throw new FeatureAlreadyRunningException(featureId);
        }
        return CompletableFuture.runAsync(
                () -> followUpFeature(projectPath, featureId, instructions, imagePaths, useWorktrees),
                featureExecutor);
    }

    // -- stop ---

    /**
     * Signals a running feature to stop and cancels any approval it is waiting on. The running
     * entry is released by the execution itself once it observes the signal.
     *
     * @return true when the feature was running
     */
    public boolean stopFeature(String featureId) {
        Optional<RunningFeature> entry = runningFeatures.get(featureId);
        // Token first, so a run woken by the cancelled approval sees a user stop
        entry.ifPresent(e -> e.getCancellation().cancel());
        approvalGate.cancel(featureId);
        if (entry.isEmpty()) {
            return false;
        }
        log.info("Stopping feature {}", featureId);
        return true;
    }

    // -- plan approval ---

    public boolean hasPendingApproval(String featureId) {
        return approvalGate.hasPending(featureId);
    }

    public boolean cancelPlanApproval(String featureId) {
        return approvalGate.cancel(featureId);
    }

    /**
     * Applies a reviewer's decision. With no pending approval in memory (after a restart, for
     * example) a feature whose persisted plan is still {@code generated} is approved or rejected
     * directly, using the client-supplied project path.
     */
    public ApprovalOutcome resolvePlanApproval(String featureId, boolean approved, String editedPlan,
                                               String feedback, String projectPathFromClient) {
        Optional<String> pendingProject = approvalGate.pendingProjectPath(featureId);
        if (pendingProject.isEmpty()) {
            if (projectPathFromClient != null && !projectPathFromClient.isBlank()) {
                Optional<ApprovalOutcome> recovered =
                        recoverPlanApproval(projectPathFromClient, featureId, approved, editedPlan, feedback);
                if (recovered.isPresent()) {
                    return recovered.get();
                }
            }
            return ApprovalOutcome.failure("No pending approval for feature " + featureId);
        }

        String projectPath = pendingProject.get();
        featureStore.updatePlanSpec(projectPath, featureId, spec -> {
            spec.setStatus(approved ? PlanSpecStatus.APPROVED : PlanSpecStatus.REJECTED);
            spec.setReviewedByUser(true);
            if (approved) {
                spec.setApprovedAt(Instant.now());
            }
            if (editedPlan != null && !editedPlan.isBlank()) {
                spec.setContent(editedPlan);
            }
        });

        if (!approved && feedback != null && !feedback.isBlank()) {
            eventBus.publish(AutoModeEvent.of(AutoModeEventType.PLAN_REJECTED, projectPath, featureId,
                    Map.of("feedback", feedback)));
        }

        if (!approvalGate.resolve(featureId, new PlanApprovalResult(approved, editedPlan, feedback))) {
            return ApprovalOutcome.failure("No pending approval for feature " + featureId);
        }
        return ApprovalOutcome.ok();
    }

    private Optional<ApprovalOutcome> recoverPlanApproval(String projectPath, String featureId, boolean approved,
                                                          String editedPlan, String feedback) {
        Optional<Feature> feature = featureStore.load(projectPath, featureId);
        PlanSpec spec = feature.map(Feature::getPlanSpec).orElse(null);
        if (spec == null || spec.getStatus() != PlanSpecStatus.GENERATED) {
            return Optional.empty();
        }
        log.info("Recovering plan approval for feature {} from persisted plan", featureId);

        if (approved) {
            String planContent = editedPlan != null && !editedPlan.isBlank() ? editedPlan : spec.getContent();
            featureStore.updatePlanSpec(projectPath, featureId, s -> {
                s.setStatus(PlanSpecStatus.APPROVED);
                s.setApprovedAt(Instant.now());
                s.setReviewedByUser(true);
                s.setContent(planContent);
            });
            String continuation = promptBuilder.continuationAfterApproval(planContent, feedback);
            try {
                executeFeatureAsync(projectPath, featureId, true, false, continuation);
            } catch (FeatureAlreadyRunningException e) {
                return Optional.of(ApprovalOutcome.failure(e.getMessage()));
            }
        } else {
            featureStore.updatePlanSpec(projectPath, featureId, s -> {
                s.setStatus(PlanSpecStatus.REJECTED);
                s.setReviewedByUser(true);
            });
            updateFeatureStatus(projectPath, featureId, FeatureStatus.BACKLOG);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("feedback", feedback);
            eventBus.publish(AutoModeEvent.of(AutoModeEventType.PLAN_REJECTED, projectPath, featureId, payload));
        }
        return Optional.of(ApprovalOutcome.ok());
    }

    // -- queries ---

    public boolean isRunning(String featureId) {
        return runningFeatures.isRunning(featureId);
    }

    public boolean contextExists(String projectPath, String featureId) {
        return featureStore.hasAgentOutput(projectPath, featureId);
    }

    public List<RunningAgentInfo> getRunningAgents() {
        List<RunningAgentInfo> agents = new ArrayList<>();
        for (RunningFeature rf : runningFeatures.all()) {
            Optional<Feature> feature = Optional.empty();
            try {
                feature = featureStore.load(rf.getProjectPath(), rf.getFeatureId());
            } catch (RuntimeException e) {
                log.debug("Could not load feature {} for running agent listing: {}", rf.getFeatureId(), e.getMessage());
            }
            Path projectName = Path.of(rf.getProjectPath()).getFileName();
            agents.add(new RunningAgentInfo(
                    rf.getFeatureId(),
                    rf.getProjectPath(),
                    projectName != null ? projectName.toString() : rf.getProjectPath(),
                    rf.isAutoMode(),
                    feature.map(Feature::displayTitle).orElse(null),
                    feature.map(Feature::getDescription).orElse(null),
                    rf.getBranchName(),
                    rf.getWorktreePath() != null ? rf.getWorktreePath().toString() : null,
                    rf.getModel(),
                    rf.getProvider(),
                    rf.getStartTime()));
        }
        return agents;
    }

    // -- helpers ---

    /**
     * Sets a feature's status and raises the review or verified notification for terminal statuses.
     */
    void updateFeatureStatus(String projectPath, String featureId, String status) {
        Optional<Feature> updated = featureStore.updateStatus(projectPath, featureId, status);
        if (updated.isEmpty()) {
            return;
        }
        String title = updated.get().displayTitle();
        if (FeatureStatus.WAITING_APPROVAL.equals(status)) {
            notifications.create("feature_waiting_approval", "Feature Ready for Review",
                    "\"" + title + "\" is ready for your review and approval.", featureId, projectPath);
        } else if (FeatureStatus.VERIFIED.equals(status)) {
            notifications.create("feature_verified", "Feature Verified",
                    "\"" + title + "\" has been verified and is complete.", featureId, projectPath);
        }
    }

    private PreparedRun prepareRun(RunningFeature entry, Feature feature, boolean useWorktrees) {
        String projectPath = entry.getProjectPath();
        Path workDir = Path.of(projectPath);
        if (useWorktrees && feature.getBranchName() != null && !feature.getBranchName().isBlank()) {
            Optional<Path> worktree = workspaceResolver.findWorkspaceForBranch(projectPath, feature.getBranchName());
            if (worktree.isPresent()) {
                workDir = worktree.get();
                entry.setWorktreePath(workDir);
                log.info("Using worktree for branch {}: {}", feature.getBranchName(), workDir);
            } else {
                log.warn("Worktree for branch {} not found, using project path", feature.getBranchName());
            }
        }
        entry.setBranchName(feature.getBranchName());

        ProjectContext context = memoryService.loadContext(projectPath,
                feature.getTitle() != null ? feature.getTitle() : "",
                feature.getDescription() != null ? feature.getDescription() : "");

        String model = feature.getModel() != null && !feature.getModel().isBlank() ? feature.getModel() : defaultModel;
        AgentProvider provider = providers.providerFor(model);
        entry.setModel(model);
        entry.setProvider(provider.name());
        log.info("Executing feature {} with model {} via {} in {}", feature.getId(), model, provider.name(), workDir);

        return new PreparedRun(new FeatureRunContext(projectPath, feature.getId(), workDir, provider, model,
                context.formattedPrompt(), entry.getCancellation()), context.memoryFiles());
    }

    private void recordLearnings(String projectPath, Feature feature, String output, PreparedRun run) {
        try {
            String transcript = featureStore.readAgentOutput(projectPath, feature.getId()).orElse(output);
            learningExtractor.extractAndRecord(projectPath, feature, transcript, run.ctx().provider(), run.ctx().model());
            memoryService.recordMemoryUsage(projectPath, run.memoryFiles());
        } catch (RuntimeException e) {
            log.warn("Failed to record learnings for feature {}: {}", feature.getId(), e.getMessage());
        }
    }

    private void handleExecutionFailure(RunningFeature entry, Exception error) {
        String projectPath = entry.getProjectPath();
        String featureId = entry.getFeatureId();
        ErrorInfo info = ErrorClassifier.classify(error);

        if (info.isAbort() || entry.getCancellation().isCancelled()) {
            log.info("Feature {} stopped by user", featureId);
            publishComplete(projectPath, featureId, false, "Feature stopped by user");
            metrics.recordFeatureResult("stopped");
            return;
        }

        log.error("Feature {} failed ({}): {}", featureId, info.type().value(), info.message(), error);
        try {
            updateFeatureStatus(projectPath, featureId, FeatureStatus.BACKLOG);
        } catch (RuntimeException statusError) {
            log.error("Could not move feature {} back to backlog", featureId, statusError);
        }
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_ERROR, projectPath, featureId,
                Map.of("error", info.message(), "errorType", info.type().value())));
        metrics.recordFeatureResult("failed");
        circuitBreaker.recordFailure(projectPath, info);
    }

    private void publishFeatureStart(FeatureRunContext ctx, Feature feature, String message) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", feature.getId());
        summary.put("title", feature.displayTitle());
        summary.put("description", feature.getDescription());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("branchName", feature.getBranchName());
        payload.put("feature", summary);
        payload.put("message", message);
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_FEATURE_START,
                ctx.projectPath(), ctx.featureId(), payload));
    }

    private void publishComplete(String projectPath, String featureId, boolean passes, String message) {
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_FEATURE_COMPLETE, projectPath, featureId,
                Map.of("passes", passes, "message", message)));
    }
}
