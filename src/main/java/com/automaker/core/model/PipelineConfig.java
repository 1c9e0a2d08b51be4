package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;

/**
 * Pipeline configuration loaded from {@code .automaker/pipeline.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    int version,
    List<PipelineStep> steps
) implements Serializable {

    public static PipelineConfig empty() {
        return new PipelineConfig(1, List.of());
    }

    /** Steps sorted by their {@code order} field. */
    public List<PipelineStep> sortedSteps() {
        if (steps == null) {
            return List.of();
        }
        return steps.stream()
                .sorted(Comparator.comparingInt(PipelineStep::order))
                .toList();
    }
}
