package com.automaker.core.pipeline;

import com.automaker.core.model.FeatureStatus;
import com.automaker.core.model.PipelineConfig;
import com.automaker.core.model.PipelineStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides where a crashed feature stands in its pipeline.
 */
@Service
public class PipelineStatusDetector {

    private static final Logger log = LoggerFactory.getLogger(PipelineStatusDetector.class);

    private final PipelineConfigService configService;

    public PipelineStatusDetector(PipelineConfigService configService) {
        this.configService = configService;
    }

    public PipelineStatusInfo detect(String projectPath, String status) {
        if (!FeatureStatus.isPipeline(status)) {
            return PipelineStatusInfo.notPipeline();
        }

        String stepId = FeatureStatus.stepIdOf(status);
        if (stepId == null) {
            log.warn("Invalid pipeline status format: {}", status);
            return new PipelineStatusInfo(true, null, -1, 0, null, null);
        }

        PipelineConfig config = configService.getConfig(projectPath);
        List<PipelineStep> steps = config.sortedSteps();
        if (steps.isEmpty()) {
            log.warn("No pipeline config found while feature is at {}", status);
            return new PipelineStatusInfo(true, stepId, -1, 0, null, null);
        }

        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) {
                return new PipelineStatusInfo(true, stepId, i, steps.size(), steps.get(i), config);
            }
        }

        log.warn("Pipeline step {} no longer exists in config", stepId);
        return new PipelineStatusInfo(true, stepId, -1, steps.size(), null, config);
    }
}
