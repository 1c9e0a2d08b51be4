package com.automaker.core.runner;

import com.automaker.core.agent.AgentMessage;
import com.automaker.core.agent.CancellationToken;
import com.automaker.core.agent.ScriptedAgentProvider;
import com.automaker.core.approval.PlanApprovalGate;
import com.automaker.core.approval.PlanApprovalResult;
import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.errors.PlanApprovalException;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.metrics.AutoModeMetrics;
import com.automaker.core.model.Feature;
import com.automaker.core.model.PlanSpec;
import com.automaker.core.model.PlanSpecStatus;
import com.automaker.core.model.PlanningMode;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.prompt.PromptBuilder;
import com.automaker.core.tasks.TaskExecutionLoop;
import com.automaker.core.testsupport.Waits;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentRunnerTest {

    private static final String PLAN = """
            ## Overview
            Add a settings toggle.

            ```tasks
            ## Phase 1: UI
            - [ ] T001: Add toggle | File: Settings.tsx
            - [ ] T002: Persist choice
            ```
            """;

    @TempDir
    Path projectDir;

    private final List<AutoModeEvent> events = new CopyOnWriteArrayList<>();
    private final ScriptedAgentProvider provider = new ScriptedAgentProvider();
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private FeatureStore store;
    private PlanApprovalGate gate;
    private AgentRunner runner;
    private String projectPath;

    @BeforeEach
    void setUp() {
        projectPath = projectDir.toString();
        store = new FeatureStore(mapper, new AutomakerProperties());
        store.save(projectPath, new Feature("F1", "Add dark mode", "in_progress"));
        EventBus eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        AutoModeMetrics metrics = new AutoModeMetrics(new SimpleMeterRegistry());
        PromptBuilder prompts = new PromptBuilder();
        gate = new PlanApprovalGate(60_000L, "Plan approval timed out after 30 minutes - feature execution cancelled");
        runner = new AgentRunner(store, gate, new TaskExecutionLoop(prompts, store, eventBus, metrics), prompts,
                eventBus, metrics, mapper, 10L, true);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
        gate.shutdown();
    }

    private AgentRunRequest request(PlanningMode mode, boolean requireApproval) {
        return new AgentRunRequest(projectPath, "F1", projectDir, "implement", provider, "gpt-4o", null,
                new CancellationToken(), mode, requireApproval, null);
    }

    private void scriptPlan() {
        provider.replyText(PLAN, "\n[SPEC_GENERATED] Please review the specification above.", " trailing");
    }

    private boolean hasEvent(AutoModeEventType type) {
        return events.stream().anyMatch(e -> e.type() == type);
    }

    private PlanSpec planSpec() {
        return store.load(projectPath, "F1").orElseThrow().getPlanSpec();
    }

    // -- no planning ---

    @Nested
    @DisplayName("without planning")
    class SkipTests {

        @Test
        @DisplayName("single call whose transcript is written to agent-output.md")
        void singleCall() {
            provider.reply(AgentMessage.text("Implemented "), AgentMessage.toolUse("Write", null),
                    AgentMessage.text("it"), AgentMessage.result("ok"));

            String transcript = runner.runAgent(request(PlanningMode.SKIP, false));

            assertEquals(1, provider.queries().size());
            assertTrue(transcript.startsWith("Implemented "));
            assertTrue(transcript.contains("Tool: Write"));
            assertEquals(transcript, store.readAgentOutput(projectPath, "F1").orElseThrow());
            assertTrue(hasEvent(AutoModeEventType.AUTO_MODE_TOOL));
            assertNull(planSpec());
        }

        @Test
        @DisplayName("previous content is kept under a follow-up heading")
        void keepsPreviousContent() {
            provider.replyText("more work");
            AgentRunRequest base = request(PlanningMode.SKIP, false);
            AgentRunRequest withHistory = new AgentRunRequest(base.projectPath(), base.featureId(), base.workDir(),
                    base.prompt(), base.provider(), base.model(), base.systemPrompt(), base.cancellation(),
                    base.planningMode(), false, "earlier work");

            String transcript = runner.runAgent(withHistory);

            assertEquals("earlier work" + AgentOutputRecorder.FOLLOW_UP_SEPARATOR + "more work", transcript);
        }

        @Test
        @DisplayName("raw events are appended when enabled")
        void rawOutput() {
            provider.replyText("hello");

            runner.runAgent(request(PlanningMode.SKIP, false));

            assertTrue(store.rawOutputPath(projectPath, "F1").toFile().exists());
        }
    }

    // -- auto-approved plans ---

    @Nested
    @DisplayName("auto-approved plan")
    class AutoApprovedTests {

        @Test
        @DisplayName("stops at the marker, approves and runs each task")
        void runsTasks() {
            scriptPlan();
            provider.replyText("task one done").replyText("task two done");

            String transcript = runner.runAgent(request(PlanningMode.SPEC, false));

            assertEquals(3, provider.queries().size());
            assertFalse(transcript.contains(" trailing"));
            assertTrue(transcript.contains("## Implementation"));
            assertTrue(hasEvent(AutoModeEventType.PLAN_AUTO_APPROVED));
            assertFalse(hasEvent(AutoModeEventType.PLAN_APPROVAL_REQUIRED));

            PlanSpec spec = planSpec();
            assertEquals(PlanSpecStatus.APPROVED, spec.getStatus());
            assertEquals(Boolean.FALSE, spec.getReviewedByUser());
            assertEquals(2, spec.getTasksTotal());
            assertEquals(2, spec.getTasksCompleted());
        }

        @Test
        @DisplayName("a plan without tasks is implemented in one continuation call")
        void noTasks() {
            provider.replyText("Just do it.\n[SPEC_GENERATED]").replyText("implemented");

            runner.runAgent(request(PlanningMode.FULL, false));

            assertEquals(2, provider.queries().size());
            assertTrue(provider.prompts().get(1).startsWith("The plan/specification has been approved."));
        }
    }

    // -- approval gate ---

    @Nested
    @DisplayName("plan approval")
    class ApprovalTests {

        private CompletableFuture<String> runAsync(PlanningMode mode) {
            CompletableFuture<String> run = CompletableFuture.supplyAsync(() -> runner.runAgent(request(mode, true)));
            Waits.until(() -> gate.hasPending("F1"), "pending approval");
            return run;
        }

        @Test
        @DisplayName("waits for approval then executes the tasks")
        void approved() throws Exception {
            scriptPlan();
            provider.replyText("one").replyText("two");

            CompletableFuture<String> run = runAsync(PlanningMode.LITE_WITH_APPROVAL);
            assertEquals(PlanSpecStatus.GENERATED, planSpec().getStatus());
            assertTrue(hasEvent(AutoModeEventType.PLAN_APPROVAL_REQUIRED));

            gate.resolve("F1", new PlanApprovalResult(true, null, null));
            run.get(5, TimeUnit.SECONDS);

            assertTrue(hasEvent(AutoModeEventType.PLAN_APPROVED));
            assertEquals(PlanSpecStatus.APPROVED, planSpec().getStatus());
            assertEquals(Boolean.TRUE, planSpec().getReviewedByUser());
            assertEquals(3, provider.queries().size());
        }

        @Test
        @DisplayName("edited plan replaces the generated tasks")
        void approvedWithEdits() throws Exception {
            scriptPlan();
            provider.replyText("only task");

            CompletableFuture<String> run = runAsync(PlanningMode.SPEC);
            gate.resolve("F1", new PlanApprovalResult(true, "```tasks\n- [ ] T001: Single edited task\n```", null));
            run.get(5, TimeUnit.SECONDS);

            assertEquals(2, provider.queries().size());
            assertEquals(1, planSpec().getTasksTotal());
            assertTrue(planSpec().getContent().contains("Single edited task"));
        }

        @Test
        @DisplayName("rejection without feedback cancels the run")
        void rejectedWithoutFeedback() {
            scriptPlan();

            CompletableFuture<String> run = runAsync(PlanningMode.SPEC);
            gate.resolve("F1", new PlanApprovalResult(false, null, null));

            ExecutionException error = assertThrows(ExecutionException.class, () -> run.get(5, TimeUnit.SECONDS));
            assertInstanceOf(PlanApprovalException.class, error.getCause());
            assertEquals("Plan cancelled by user", error.getCause().getMessage());
            assertEquals(1, provider.queries().size());
        }

        @Test
        @DisplayName("rejection with feedback regenerates the plan as the next version")
        void revision() throws Exception {
            scriptPlan();
            provider.replyText("```tasks\n- [ ] T001: Revised task\n```\n[SPEC_GENERATED]")
                    .replyText("revised task done");

            CompletableFuture<String> run = runAsync(PlanningMode.SPEC);
            gate.resolve("F1", new PlanApprovalResult(false, null, "smaller please"));

            Waits.until(() -> provider.queries().size() >= 2 && gate.hasPending("F1"), "revised plan approval");
            assertTrue(hasEvent(AutoModeEventType.PLAN_REVISION_REQUESTED));
            assertTrue(provider.prompts().get(1).contains("smaller please"));
            assertEquals(2, planSpec().getVersion());

            gate.resolve("F1", new PlanApprovalResult(true, null, null));
            String transcript = run.get(5, TimeUnit.SECONDS);

            assertTrue(transcript.contains("## Plan Revision (v2)"));
            assertEquals(1, planSpec().getTasksTotal());
            assertEquals(3, provider.queries().size());
        }

        @Test
        @DisplayName("an unanswered plan times out")
        void timesOut() {
            runner.shutdown();
            gate.shutdown();
            gate = new PlanApprovalGate(50L, "Plan approval timed out after 30 minutes - feature execution cancelled");
            EventBus eventBus = new EventBus();
            AutoModeMetrics metrics = new AutoModeMetrics(new SimpleMeterRegistry());
            PromptBuilder prompts = new PromptBuilder();
            runner = new AgentRunner(store, gate, new TaskExecutionLoop(prompts, store, eventBus, metrics), prompts,
                    eventBus, metrics, mapper, 10L, false);
            scriptPlan();

            PlanApprovalException error = assertThrows(PlanApprovalException.class,
                    () -> runner.runAgent(request(PlanningMode.SPEC, true)));

            assertTrue(error.getMessage().startsWith("Plan approval timed out"));
            assertFalse(gate.hasPending("F1"));
        }
    }
}
