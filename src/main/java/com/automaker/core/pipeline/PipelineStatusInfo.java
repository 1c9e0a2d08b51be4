package com.automaker.core.pipeline;

import com.automaker.core.model.PipelineConfig;
import com.automaker.core.model.PipelineStep;

/**
 * A persisted feature status resolved against the current pipeline configuration.
 *
 * @param isPipeline whether the status has the {@code pipeline_} form
 * @param stepId     the step id from the status, null when not a pipeline status or malformed
 * @param stepIndex  index of the step among the sorted steps, -1 when it no longer exists
 * @param totalSteps number of configured steps
 * @param step       the matching step, null when not found
 * @param config     the configuration used, null when none was loaded
 */
public record PipelineStatusInfo(
    boolean isPipeline,
    String stepId,
    int stepIndex,
    int totalSteps,
    PipelineStep step,
    PipelineConfig config
) {

    static PipelineStatusInfo notPipeline() {
        return new PipelineStatusInfo(false, null, -1, 0, null, null);
    }

    /** True when the step the feature was on has been removed from the configuration. */
    public boolean stepMissing() {
        return isPipeline && stepIndex < 0;
    }
}
