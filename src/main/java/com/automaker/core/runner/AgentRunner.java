package com.automaker.core.runner;

import com.automaker.core.agent.AgentInvocation;
import com.automaker.core.approval.PlanApprovalGate;
import com.automaker.core.approval.PlanApprovalResult;
import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.errors.FeatureAbortedException;
import com.automaker.core.errors.PlanApprovalException;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.metrics.AutoModeMetrics;
import com.automaker.core.model.ParsedTask;
import com.automaker.core.model.PlanSpecStatus;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.prompt.PromptBuilder;
import com.automaker.core.tasks.PlanTaskParser;
import com.automaker.core.tasks.TaskExecutionLoop;
import com.automaker.core.tasks.TaskRunContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runs the agent for one feature and drives the planning sub-flow.
 * <p>
 * When the planning mode produces a reviewable plan, the stream is watched for the
 * plan-complete marker. The plan is then persisted, optionally held at the
 * {@link PlanApprovalGate} (with a revision loop on rejection with feedback), and finally
 * executed task by task through the {@link TaskExecutionLoop}, or with a single continuation
 * call when no tasks were parsed.
 */
@Service
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final FeatureStore featureStore;
    private final PlanApprovalGate approvalGate;
    private final TaskExecutionLoop taskLoop;
    private final PromptBuilder promptBuilder;
    private final EventBus eventBus;
    private final AutoModeMetrics metrics;
    private final ObjectMapper objectMapper;
    private final long debounceMs;
    private final boolean rawOutputEnabled;

    private final ScheduledExecutorService outputScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "agent-output-writer");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public AgentRunner(FeatureStore featureStore, PlanApprovalGate approvalGate, TaskExecutionLoop taskLoop,
                       PromptBuilder promptBuilder, EventBus eventBus, AutoModeMetrics metrics,
                       ObjectMapper objectMapper, AutomakerProperties properties) {
        this(featureStore, approvalGate, taskLoop, promptBuilder, eventBus, metrics, objectMapper,
                properties.getOutput().getDebounceMs(), properties.getOutput().isRawOutputEnabled());
    }

    AgentRunner(FeatureStore featureStore, PlanApprovalGate approvalGate, TaskExecutionLoop taskLoop,
                PromptBuilder promptBuilder, EventBus eventBus, AutoModeMetrics metrics,
                ObjectMapper objectMapper, long debounceMs, boolean rawOutputEnabled) {
        this.featureStore = featureStore;
        this.approvalGate = approvalGate;
        this.taskLoop = taskLoop;
        this.promptBuilder = promptBuilder;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.debounceMs = debounceMs;
        this.rawOutputEnabled = rawOutputEnabled;
    }

    /**
     * Runs the agent to completion.
     *
     * @return the full transcript written to {@code agent-output.md}
     */
    public String runAgent(AgentRunRequest request) {
        boolean reviewablePlan = request.planningMode().producesReviewablePlan(request.requirePlanApproval());
        boolean requiresApproval = request.planningMode().requiresApproval(request.requirePlanApproval());

        AgentOutputRecorder recorder = new AgentOutputRecorder(request.projectPath(), request.featureId(),
                featureStore, eventBus, outputScheduler, debounceMs, objectMapper, rawOutputEnabled,
                request.previousContent());
        TaskRunContext ctx = new TaskRunContext(request.projectPath(), request.featureId(), request.provider(),
                request.model(), request.workDir(), request.systemPrompt(), request.cancellation(), recorder);

        log.info("Running agent for feature {} (model={}, planning={}, approval={})", request.featureId(),
                request.model(), request.planningMode().value(), requiresApproval);
        try {
            String initialOutput = AgentInvocation.stream(request.provider(), ctx.query(request.prompt()), recorder,
                    reviewablePlan ? PlanTaskParser::hasPlanMarker : null);

            if (reviewablePlan && PlanTaskParser.hasPlanMarker(initialOutput)) {
                runPlanFlow(request, ctx, recorder, initialOutput, requiresApproval);
            }
            return recorder.transcript();
        } finally {
            recorder.flush();
        }
    }

    private void runPlanFlow(AgentRunRequest request, TaskRunContext ctx, AgentOutputRecorder recorder,
                             String generatedText, boolean requiresApproval) {
        String projectPath = request.projectPath();
        String featureId = request.featureId();

        String planContent = PlanTaskParser.extractPlan(generatedText);
        List<ParsedTask> tasks = PlanTaskParser.parseTasks(planContent);
        int planVersion = 1;
        persistGeneratedPlan(projectPath, featureId, planContent, planVersion, tasks);
        log.info("Plan generated for feature {} with {} tasks", featureId, tasks.size());

        String approvedPlan;
        String userFeedback = null;

        if (requiresApproval) {
            while (true) {
                PlanApprovalResult result = awaitApproval(request, planContent, planVersion);
                if (result.approved()) {
                    metrics.recordPlanApproval("approved");
                    userFeedback = result.feedback();
                    approvedPlan = result.hasEdits() ? result.editedPlan() : planContent;
                    if (result.hasEdits()) {
                        tasks = PlanTaskParser.parseTasks(result.editedPlan());
                    }
                    eventBus.publish(AutoModeEvent.of(AutoModeEventType.PLAN_APPROVED, projectPath, featureId,
                            Map.of("hasEdits", result.hasEdits(), "planVersion", planVersion)));
                    break;
                }

                if (!result.hasFeedback() && !result.hasEdits()) {
                    metrics.recordPlanApproval("cancelled");
                    throw new PlanApprovalException("Plan cancelled by user");
                }

                metrics.recordPlanApproval("revision");
                planVersion++;
                Map<String, Object> revision = new LinkedHashMap<>();
                revision.put("feedback", result.feedback());
                revision.put("hasEdits", result.hasEdits());
                revision.put("planVersion", planVersion);
                eventBus.publish(AutoModeEvent.of(AutoModeEventType.PLAN_REVISION_REQUESTED,
                        projectPath, featureId, revision));

                int revisingVersion = planVersion;
                featureStore.updatePlanSpec(projectPath, featureId, spec -> {
                    spec.setStatus(PlanSpecStatus.GENERATING);
                    spec.setVersion(revisingVersion);
                });

                String basePlan = result.hasEdits() ? result.editedPlan() : planContent;
                String revisionPrompt = promptBuilder.planRevision(basePlan, planVersion - 1, result.feedback());
                recorder.appendSection("\n\n---\n\n## Plan Revision (v" + planVersion + ")\n\n");
                String revisedText = AgentInvocation.stream(request.provider(), ctx.query(revisionPrompt), recorder,
                        PlanTaskParser::hasPlanMarker);

                planContent = PlanTaskParser.extractPlan(revisedText);
                tasks = PlanTaskParser.parseTasks(planContent);
                persistGeneratedPlan(projectPath, featureId, planContent, planVersion, tasks);
                log.info("Plan revised to v{} for feature {} with {} tasks", planVersion, featureId, tasks.size());
            }
        } else {
            approvedPlan = planContent;
            metrics.recordPlanApproval("auto");
            eventBus.publish(AutoModeEvent.of(AutoModeEventType.PLAN_AUTO_APPROVED, projectPath, featureId,
                    Map.of("planContent", planContent, "planningMode", request.planningMode().value())));
        }

        List<ParsedTask> approvedTasks = tasks;
        String finalPlan = approvedPlan;
        featureStore.updatePlanSpec(projectPath, featureId, spec -> {
            spec.setStatus(PlanSpecStatus.APPROVED);
            spec.setApprovedAt(Instant.now());
            spec.setReviewedByUser(requiresApproval);
            spec.setContent(finalPlan);
            spec.setTasks(approvedTasks);
            spec.setTasksTotal(approvedTasks.size());
        });

        request.cancellation().throwIfCancelled();
        if (!approvedTasks.isEmpty()) {
            recorder.appendSection("\n\n---\n\n## Implementation\n\n");
            taskLoop.runTasks(ctx, approvedTasks, approvedPlan, userFeedback);
        } else {
            log.info("No tasks parsed for feature {}, implementing plan in a single call", featureId);
            recorder.appendSection("\n\n---\n\n## Implementation\n\n");
            String continuation = promptBuilder.continuationAfterApproval(approvedPlan, userFeedback);
            AgentInvocation.stream(request.provider(), ctx.query(continuation), recorder);
        }
    }

    /**
     * Registers with the approval gate, announces the plan, and blocks for the decision.
     * Registration precedes the announcement so a fast reviewer always finds the entry.
     */
    private PlanApprovalResult awaitApproval(AgentRunRequest request, String planContent, int planVersion) {
        CompletableFuture<PlanApprovalResult> decision =
                approvalGate.waitForApproval(request.featureId(), request.projectPath());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("planContent", planContent);
        payload.put("planningMode", request.planningMode().value());
        payload.put("planVersion", planVersion);
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.PLAN_APPROVAL_REQUIRED,
                request.projectPath(), request.featureId(), payload));
        log.info("Waiting for plan approval on feature {} (v{})", request.featureId(), planVersion);

        try {
            return decision.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            approvalGate.cancel(request.featureId());
            throw new FeatureAbortedException("Feature execution aborted while awaiting plan approval");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PlanApprovalException approvalError) {
                throw approvalError;
            }
            String message = cause != null ? cause.getMessage() : e.getMessage();
            throw new PlanApprovalException("Plan approval failed: " + message, cause);
        }
    }

    private void persistGeneratedPlan(String projectPath, String featureId, String content, int version,
                                      List<ParsedTask> tasks) {
        featureStore.updatePlanSpec(projectPath, featureId, spec -> {
            spec.setStatus(PlanSpecStatus.GENERATED);
            spec.setContent(content);
            spec.setVersion(version);
            spec.setGeneratedAt(Instant.now());
            spec.setTasks(tasks);
            spec.setTasksTotal(tasks.size());
            spec.setTasksCompleted(0);
        });
    }

    @PreDestroy
    void shutdown() {
        outputScheduler.shutdown();
    }
}
