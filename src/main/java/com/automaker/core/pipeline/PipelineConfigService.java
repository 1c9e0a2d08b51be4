package com.automaker.core.pipeline;

import com.automaker.core.model.PipelineConfig;
import com.automaker.core.persistence.AtomicJsonFiles;
import com.automaker.core.persistence.FeatureStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Reads a project's pipeline steps from {@code .automaker/pipeline.json}.
 * A missing or unreadable file yields an empty pipeline.
 */
@Service
public class PipelineConfigService {

    static final String PIPELINE_FILE = "pipeline.json";

    private final AtomicJsonFiles files;

    public PipelineConfigService(ObjectMapper objectMapper) {
        this.files = new AtomicJsonFiles(objectMapper, 0);
    }

    public PipelineConfig getConfig(String projectPath) {
        Path path = FeatureStore.automakerDir(projectPath).resolve(PIPELINE_FILE);
        PipelineConfig config = files.readWithRecovery(path, PipelineConfig.class, PipelineConfig.empty()).data();
        return config != null ? config : PipelineConfig.empty();
    }

    public void saveConfig(String projectPath, PipelineConfig config) {
        files.write(FeatureStore.automakerDir(projectPath).resolve(PIPELINE_FILE), config, false);
    }
}
