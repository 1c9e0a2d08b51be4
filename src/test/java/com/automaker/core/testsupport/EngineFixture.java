package com.automaker.core.testsupport;

import com.automaker.core.agent.AgentProviderRegistry;
import com.automaker.core.agent.ScriptedAgentProvider;
import com.automaker.core.approval.PlanApprovalGate;
import com.automaker.core.circuit.FailureCircuitBreaker;
import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.engine.FeatureExecutionController;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.memory.LearningExtractor;
import com.automaker.core.memory.ProjectMemoryService;
import com.automaker.core.metrics.AutoModeMetrics;
import com.automaker.core.model.Feature;
import com.automaker.core.model.PipelineConfig;
import com.automaker.core.model.PipelineStep;
import com.automaker.core.notification.NotificationService;
import com.automaker.core.persistence.ExecutionStateStore;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.pipeline.PipelineConfigService;
import com.automaker.core.pipeline.PipelineStatusDetector;
import com.automaker.core.pipeline.PipelineStepRunner;
import com.automaker.core.prompt.PromptBuilder;
import com.automaker.core.runner.AgentRunner;
import com.automaker.core.state.AutoLoopStates;
import com.automaker.core.state.ExecutionSnapshots;
import com.automaker.core.state.RunningFeatureRegistry;
import com.automaker.core.tasks.TaskExecutionLoop;
import com.automaker.core.workspace.ProcessRunner;
import com.automaker.core.workspace.WorkspaceResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * The feature engine wired from real components around one temporary project directory,
 * with a {@link ScriptedAgentProvider} standing in for the agent backend.
 */
public class EngineFixture implements AutoCloseable {

    public final String projectPath;
    public final AutomakerProperties properties = new AutomakerProperties();
    public final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    public final List<AutoModeEvent> events = new CopyOnWriteArrayList<>();
    public final ScriptedAgentProvider provider = new ScriptedAgentProvider();

    public final FeatureStore featureStore;
    public final RunningFeatureRegistry runningFeatures = new RunningFeatureRegistry();
    public final AutoLoopStates loops = new AutoLoopStates();
    public final ExecutionStateStore stateStore;
    public final ExecutionSnapshots snapshots;
    public final EventBus eventBus = new EventBus();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final AutoModeMetrics metrics = new AutoModeMetrics(meterRegistry);
    public final PromptBuilder prompts = new PromptBuilder();
    public final PlanApprovalGate approvalGate;
    public final PipelineConfigService pipelineConfig;
    public final FailureCircuitBreaker circuitBreaker;
    public final NotificationService notifications = new NotificationService();
    public final ExecutorService executor = Executors.newCachedThreadPool();
    public final FeatureExecutionController controller;

    public EngineFixture(Path projectDir) {
        this(projectDir, null);
    }

    /**
     * @param approvalGate gate to use instead of a real one, for example a mock; null for a real gate
     */
    public EngineFixture(Path projectDir, PlanApprovalGate approvalGate) {
        this(projectDir, approvalGate, PipelineStatusDetector::new);
    }

    /**
     * @param detectorFactory builds the pipeline status detector from the fixture's config service
     */
    public EngineFixture(Path projectDir, PlanApprovalGate approvalGate,
                         Function<PipelineConfigService, PipelineStatusDetector> detectorFactory) {
        this.projectPath = projectDir.toString();
        properties.getOutput().setDebounceMs(10);
        eventBus.subscribeAll(events::add);

        featureStore = new FeatureStore(mapper, properties);
        stateStore = new ExecutionStateStore(mapper);
        snapshots = new ExecutionSnapshots(stateStore, runningFeatures, loops, properties);
        this.approvalGate = approvalGate != null ? approvalGate : new PlanApprovalGate(properties);
        pipelineConfig = new PipelineConfigService(mapper);
        circuitBreaker = new FailureCircuitBreaker(eventBus, metrics, properties);

        ProjectMemoryService memory = new ProjectMemoryService(mapper);
        AgentRunner agentRunner = new AgentRunner(featureStore, this.approvalGate,
                new TaskExecutionLoop(prompts, featureStore, eventBus, metrics), prompts, eventBus, metrics,
                mapper, properties);
        controller = new FeatureExecutionController(
                featureStore,
                runningFeatures,
                snapshots,
                new WorkspaceResolver(new ProcessRunner()),
                memory,
                new LearningExtractor(prompts, memory, mapper),
                prompts,
                new AgentProviderRegistry(List.of(provider)),
                agentRunner,
                pipelineConfig,
                detectorFactory.apply(pipelineConfig),
                new PipelineStepRunner(featureStore, agentRunner, prompts, eventBus, metrics),
                this.approvalGate,
                circuitBreaker,
                notifications,
                eventBus,
                metrics,
                executor,
                properties);
    }

    public Feature saveFeature(String id, String description, String status) {
        Feature feature = new Feature(id, description, status);
        featureStore.save(projectPath, feature);
        return feature;
    }

    public Feature saveFeature(Feature feature) {
        featureStore.save(projectPath, feature);
        return feature;
    }

    public Feature load(String featureId) {
        return featureStore.load(projectPath, featureId).orElseThrow();
    }

    public String status(String featureId) {
        return load(featureId).getStatus();
    }

    public void configurePipeline(PipelineStep... steps) {
        pipelineConfig.saveConfig(projectPath, new PipelineConfig(1, List.of(steps)));
    }

    public List<AutoModeEvent> events(AutoModeEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    public List<AutoModeEvent> events(AutoModeEventType type, String featureId) {
        return events.stream().filter(e -> e.type() == type && featureId.equals(e.featureId())).toList();
    }

    public void awaitEvent(AutoModeEventType type, String featureId) {
        Waits.until(() -> !events(type, featureId).isEmpty(), type.wireName() + " for " + featureId);
    }

    public void awaitIdle() {
        Waits.until(() -> runningFeatures.all().isEmpty(), "all features to finish");
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
