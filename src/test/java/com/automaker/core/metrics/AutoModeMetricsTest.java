package com.automaker.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AutoModeMetricsTest {

    private SimpleMeterRegistry registry;
    private AutoModeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AutoModeMetrics(registry);
    }

    @Test
    @DisplayName("recordFeatureResult counts per result tag")
    void featureResults() {
        metrics.recordFeatureResult("success");
        metrics.recordFeatureResult("success");
        metrics.recordFeatureResult("failed");

        assertEquals(2.0, registry.find("automaker.features.total").tag("result", "success").counter().count());
        assertEquals(1.0, registry.find("automaker.features.total").tag("result", "failed").counter().count());
    }

    @Test
    @DisplayName("recordPipelineStep times each step separately")
    void pipelineSteps() {
        metrics.recordPipelineStep("review", 200);
        metrics.recordPipelineStep("docs", 100);

        var review = registry.find("automaker.pipeline.step.duration").tag("step", "review").timer();
        assertNotNull(review);
        assertEquals(1, review.count());
        assertNotNull(registry.find("automaker.pipeline.step.duration").tag("step", "docs").timer());
    }

    @Test
    @DisplayName("recordPause counts per reason")
    void pauses() {
        metrics.recordPause("quota_exhausted");

        var counter = registry.find("automaker.circuit.pauses").tag("reason", "quota_exhausted").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordFeatureDuration creates a timer")
    void featureDuration() {
        metrics.recordFeatureDuration(1500);

        assertEquals(1, registry.find("automaker.feature.duration").timer().count());
    }
}
