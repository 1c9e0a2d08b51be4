package com.automaker.core.prompt;

import com.automaker.core.model.Feature;
import com.automaker.core.model.ParsedTask;
import com.automaker.core.model.PipelineStep;
import com.automaker.core.model.PlanningMode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds every prompt sent to the agent from {@link PromptTemplates}.
 */
@Component
public class PromptBuilder {

    static final int LOOKAHEAD_TASKS = 3;

    /**
     * Planning instructions placed before the feature prompt, or an empty string when the
     * feature skips planning.
     */
    public String planningPrefix(Feature feature) {
        PlanningMode mode = feature.effectivePlanningMode();
        String planning = switch (mode) {
            case SKIP -> null;
            case LITE -> feature.requiresPlanApproval()
                    ? PromptTemplates.PLANNING_LITE_WITH_APPROVAL
                    : PromptTemplates.PLANNING_LITE;
            case LITE_WITH_APPROVAL -> PromptTemplates.PLANNING_LITE_WITH_APPROVAL;
            case SPEC -> PromptTemplates.PLANNING_SPEC;
            case FULL -> PromptTemplates.PLANNING_FULL;
        };
        return planning == null ? "" : planning + PromptTemplates.FEATURE_REQUEST_SEPARATOR;
    }

    public String featurePrompt(Feature feature) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("## Feature Implementation Task\n\n");
        prompt.append("**Feature ID:** ").append(feature.getId()).append('\n');
        prompt.append("**Title:** ").append(feature.displayTitle()).append('\n');
        prompt.append("**Description:** ").append(nullToEmpty(feature.getDescription())).append('\n');

        if (feature.getSpec() != null && !feature.getSpec().isBlank()) {
            prompt.append("\n**Specification:**\n").append(feature.getSpec()).append('\n');
        }

        List<String> images = feature.getImagePaths();
        if (images != null && !images.isEmpty()) {
            prompt.append("\n**Context Images Attached:**\n");
            prompt.append("The user attached ").append(images.size())
                    .append(" image(s) for context. Review them before implementing:\n");
            for (int i = 0; i < images.size(); i++) {
                prompt.append(i + 1).append(". ").append(images.get(i)).append('\n');
            }
        }

        prompt.append('\n').append(PromptTemplates.IMPLEMENTATION_INSTRUCTIONS);
        if (!feature.skipsTests()) {
            prompt.append("\n\n").append(PromptTemplates.VERIFICATION_INSTRUCTIONS);
        }
        return prompt.toString();
    }

    /** Full prompt for a fresh run: planning prefix followed by the feature prompt. */
    public String initialPrompt(Feature feature) {
        return planningPrefix(feature) + featurePrompt(feature);
    }

    public String resumePrompt(Feature feature, String previousContext) {
        return PromptTemplates.render(PromptTemplates.RESUME_FEATURE, Map.of(
                "featurePrompt", featurePrompt(feature),
                "previousContext", nullToEmpty(previousContext)));
    }

    public String continuationAfterApproval(String approvedPlan, String userFeedback) {
        String feedback = userFeedback != null && !userFeedback.isBlank()
                ? "\n## User Feedback\n" + userFeedback + "\n"
                : "";
        return PromptTemplates.render(PromptTemplates.CONTINUATION_AFTER_APPROVAL, Map.of(
                "userFeedback", feedback,
                "approvedPlan", nullToEmpty(approvedPlan)));
    }

    public String planRevision(String previousPlan, int planVersion, String userFeedback) {
        return PromptTemplates.render(PromptTemplates.PLAN_REVISION, Map.of(
                "planVersion", String.valueOf(planVersion),
                "previousPlan", nullToEmpty(previousPlan),
                "userFeedback", userFeedback != null && !userFeedback.isBlank()
                        ? userFeedback
                        : "Please revise the plan based on the edits above."));
    }

    public String followUpPrompt(Feature feature, String previousContext, String instructions) {
        return PromptTemplates.render(PromptTemplates.FOLLOW_UP, Map.of(
                "featurePrompt", feature != null ? featurePrompt(feature) : "",
                "previousContext", previousContext != null && !previousContext.isBlank()
                        ? previousContext
                        : "No previous context available - this is a fresh follow-up.",
                "followUpInstructions", nullToEmpty(instructions)));
    }

    public String pipelineStepPrompt(PipelineStep step, Feature feature, String previousContext) {
        return PromptTemplates.render(PromptTemplates.PIPELINE_STEP, Map.of(
                "stepName", step.name(),
                "featurePrompt", featurePrompt(feature),
                "previousContext", previousContext != null && !previousContext.isBlank()
                        ? previousContext
                        : "No previous work recorded.",
                "stepInstructions", nullToEmpty(step.instructions())));
    }

    /**
     * Prompt for one task of an approved plan, listing the tasks already done and a short
     * look-ahead of the ones remaining.
     */
    public String taskPrompt(ParsedTask task, List<ParsedTask> allTasks, int taskIndex,
                             String planContent, String userFeedback) {
        List<ParsedTask> completed = allTasks.subList(0, taskIndex);
        List<ParsedTask> remaining = allTasks.subList(taskIndex + 1, allTasks.size());

        String completedStr = completed.isEmpty() ? "" :
                "### Already Completed (" + completed.size() + " tasks)\n"
                        + completed.stream()
                                .map(t -> "- [x] " + t.id() + ": " + t.description())
                                .collect(Collectors.joining("\n"))
                        + "\n";

        String remainingStr = "";
        if (!remaining.isEmpty()) {
            remainingStr = "### Coming Up Next (" + remaining.size() + " tasks remaining)\n"
                    + remaining.stream()
                            .limit(LOOKAHEAD_TASKS)
                            .map(t -> "- [ ] " + t.id() + ": " + t.description())
                            .collect(Collectors.joining("\n"))
                    + (remaining.size() > LOOKAHEAD_TASKS
                            ? "\n... and " + (remaining.size() - LOOKAHEAD_TASKS) + " more tasks"
                            : "")
                    + "\n";
        }

        String feedbackStr = userFeedback != null && !userFeedback.isBlank()
                ? "### User Feedback\n" + userFeedback + "\n"
                : "";

        return PromptTemplates.render(PromptTemplates.TASK_PROMPT, Map.of(
                "taskId", task.id(),
                "taskDescription", task.description(),
                "taskFilePath", nullToEmpty(task.filePath()),
                "taskPhase", nullToEmpty(task.phase()),
                "completedTasks", completedStr,
                "remainingTasks", remainingStr,
                "userFeedback", feedbackStr,
                "planContent", nullToEmpty(planContent)));
    }

    public String learningExtractionPrompt(String featureTitle, String implementationLog) {
        return PromptTemplates.render(PromptTemplates.LEARNING_EXTRACTION_USER, Map.of(
                "featureTitle", nullToEmpty(featureTitle),
                "implementationLog", nullToEmpty(implementationLog)));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
