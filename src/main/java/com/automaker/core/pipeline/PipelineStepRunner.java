package com.automaker.core.pipeline;

import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.logging.MdcContext;
import com.automaker.core.metrics.AutoModeMetrics;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.model.PipelineStep;
import com.automaker.core.model.PlanningMode;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.prompt.PromptBuilder;
import com.automaker.core.runner.AgentRunner;
import com.automaker.core.runner.FeatureRunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs post-implementation pipeline steps sequentially against a feature.
 * <p>
 * Before each step the feature's status becomes {@code pipeline_<stepId>}, so a crash leaves
 * a record of the step that was in progress. Each step's prompt carries the transcript of all
 * earlier work, and the step's own output is carried into the next one.
 */
@Service
public class PipelineStepRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineStepRunner.class);

    private final FeatureStore featureStore;
    private final AgentRunner agentRunner;
    private final PromptBuilder promptBuilder;
    private final EventBus eventBus;
    private final AutoModeMetrics metrics;

    public PipelineStepRunner(FeatureStore featureStore, AgentRunner agentRunner, PromptBuilder promptBuilder,
                              EventBus eventBus, AutoModeMetrics metrics) {
        this.featureStore = featureStore;
        this.agentRunner = agentRunner;
        this.promptBuilder = promptBuilder;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public void executeSteps(FeatureRunContext ctx, Feature feature, List<PipelineStep> steps) {
        String projectPath = ctx.projectPath();
        String featureId = ctx.featureId();
        log.info("Executing {} pipeline step(s) for feature {}", steps.size(), featureId);

        String previousContext = featureStore.readAgentOutput(projectPath, featureId).orElse("");

        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            ctx.cancellation().throwIfCancelled();
            MdcContext.setStep(step.id());
            long start = System.currentTimeMillis();
            try {
                featureStore.updateStatus(projectPath, featureId, FeatureStatus.pipeline(step.id()));

                eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_PROGRESS, projectPath, featureId,
                        Map.of("content", "Starting pipeline step " + (i + 1) + "/" + steps.size() + ": " + step.name())));
                eventBus.publish(AutoModeEvent.of(AutoModeEventType.PIPELINE_STEP_STARTED, projectPath, featureId,
                        stepPayload(step, i, steps.size())));

                String prompt = promptBuilder.pipelineStepPrompt(step, feature, previousContext);
                String transcript = agentRunner.runAgent(ctx.request(prompt, PlanningMode.SKIP, false, previousContext));

                previousContext = featureStore.readAgentOutput(projectPath, featureId).orElse(transcript);

                eventBus.publish(AutoModeEvent.of(AutoModeEventType.PIPELINE_STEP_COMPLETE, projectPath, featureId,
                        stepPayload(step, i, steps.size())));
                log.info("Pipeline step {} ({}) completed for feature {}", i + 1, step.name(), featureId);
            } finally {
                metrics.recordPipelineStep(step.id(), System.currentTimeMillis() - start);
                MdcContext.clearStep();
            }
        }
    }

    private static Map<String, Object> stepPayload(PipelineStep step, int index, int total) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stepId", step.id());
        payload.put("stepName", step.name());
        payload.put("stepIndex", index);
        payload.put("totalSteps", total);
        return payload;
    }
}
