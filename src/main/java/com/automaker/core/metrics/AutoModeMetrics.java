package com.automaker.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for auto-mode execution.
 */
@Service
public class AutoModeMetrics {

    private final MeterRegistry registry;

    public AutoModeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordFeatureResult(String result) {
        Counter.builder("automaker.features.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordFeatureDuration(long ms) {
        Timer.builder("automaker.feature.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPipelineStep(String stepId, long ms) {
        Timer.builder("automaker.pipeline.step.duration")
                .tag("step", stepId)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementTasksCompleted() {
        Counter.builder("automaker.tasks.completed")
                .register(registry)
                .increment();
    }

    public void recordPause(String reason) {
        Counter.builder("automaker.circuit.pauses")
                .description("Auto loops paused by the failure circuit breaker")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPlanApproval(String outcome) {
        Counter.builder("automaker.plan.approvals")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
