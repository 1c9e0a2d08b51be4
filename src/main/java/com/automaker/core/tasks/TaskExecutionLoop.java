package com.automaker.core.tasks;

import com.automaker.core.agent.AgentInvocation;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.metrics.AutoModeMetrics;
import com.automaker.core.model.ParsedTask;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.prompt.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs an approved plan one task at a time, each as its own narrowly-scoped agent call.
 * Progress ({@code currentTaskId}, {@code tasksCompleted}) is persisted around every task.
 */
@Service
public class TaskExecutionLoop {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionLoop.class);

    private final PromptBuilder promptBuilder;
    private final FeatureStore featureStore;
    private final EventBus eventBus;
    private final AutoModeMetrics metrics;

    public TaskExecutionLoop(PromptBuilder promptBuilder, FeatureStore featureStore,
                             EventBus eventBus, AutoModeMetrics metrics) {
        this.promptBuilder = promptBuilder;
        this.featureStore = featureStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Executes {@code tasks} in order.
     *
     * @return the text produced across all task invocations
     */
    public String runTasks(TaskRunContext ctx, List<ParsedTask> tasks, String planContent, String userFeedback) {
        StringBuilder output = new StringBuilder();
        int total = tasks.size();
        log.info("Executing {} tasks for feature {}", total, ctx.featureId());

        for (int i = 0; i < total; i++) {
            ParsedTask task = tasks.get(i);
            ctx.cancellation().throwIfCancelled();

            Map<String, Object> started = new LinkedHashMap<>();
            started.put("taskId", task.id());
            started.put("taskDescription", task.description());
            started.put("taskIndex", i);
            started.put("tasksTotal", total);
            eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_TASK_STARTED,
                    ctx.projectPath(), ctx.featureId(), started));
            featureStore.updatePlanSpec(ctx.projectPath(), ctx.featureId(),
                    spec -> spec.setCurrentTaskId(task.id()));

            String prompt = promptBuilder.taskPrompt(task, tasks, i, planContent, userFeedback);
            log.debug("Starting task {} ({}/{}) for feature {}", task.id(), i + 1, total, ctx.featureId());
            String taskOutput = AgentInvocation.stream(ctx.provider(), ctx.query(prompt), ctx.listener());
            output.append(taskOutput);

            int completed = i + 1;
            eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_TASK_COMPLETE,
                    ctx.projectPath(), ctx.featureId(),
                    Map.of("taskId", task.id(), "tasksCompleted", completed, "tasksTotal", total)));
            featureStore.updatePlanSpec(ctx.projectPath(), ctx.featureId(), spec -> {
                spec.setTasksCompleted(completed);
                if (completed == total) {
                    spec.setCurrentTaskId(null);
                }
            });
            metrics.incrementTasksCompleted();

            ParsedTask next = completed < total ? tasks.get(completed) : null;
            if (task.phase() != null && (next == null || !Objects.equals(next.phase(), task.phase()))) {
                Optional<Integer> phaseNumber = PlanTaskParser.phaseNumber(task.phase());
                phaseNumber.ifPresent(n -> eventBus.publish(AutoModeEvent.of(
                        AutoModeEventType.AUTO_MODE_PHASE_COMPLETE, ctx.projectPath(), ctx.featureId(),
                        Map.of("phaseNumber", n))));
            }
        }

        log.info("All {} tasks completed for feature {}", total, ctx.featureId());
        return output.toString();
    }
}
