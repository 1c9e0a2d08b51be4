package com.automaker.core.scheduler;

import com.automaker.core.agent.AgentMessage;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.model.ExecutionState;
import com.automaker.core.model.Feature;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.testsupport.EngineFixture;
import com.automaker.core.testsupport.Waits;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AutoLoopSchedulerTest {

    @TempDir
    Path projectDir;

    private EngineFixture fx;
    private AutoLoopScheduler scheduler;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture(projectDir);
        scheduler = new AutoLoopScheduler(fx.loops, fx.runningFeatures, fx.featureStore, new DependencyResolver(),
                fx.controller, fx.circuitBreaker, fx.snapshots, fx.eventBus,
                new AutoLoopScheduler.Backoffs(20, 20, 20, 20), 3, false, false);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
        fx.close();
    }

    // -- lifecycle tests ---

    @Nested
    @DisplayName("start and stop")
    class LifecycleTests {

        @Test
        @DisplayName("start announces the ceiling and records a running snapshot")
        void startAnnounces() {
            int ceiling = scheduler.start(fx.projectPath, 2);

            assertEquals(2, ceiling);
            assertTrue(scheduler.isRunning(fx.projectPath));
            AutoModeEvent started = fx.events(AutoModeEventType.AUTO_MODE_STARTED).get(0);
            assertEquals(2, started.payload().get("maxConcurrency"));
            ExecutionState snapshot = fx.stateStore.load(fx.projectPath);
            assertTrue(snapshot.autoLoopWasRunning());
            assertEquals(2, snapshot.maxConcurrency());
            assertEquals(List.of(fx.projectPath), scheduler.getActiveAutoLoopProjects());
        }

        @Test
        @DisplayName("a missing or non-positive ceiling falls back to the default")
        void defaultCeiling() {
            assertEquals(3, scheduler.start(fx.projectPath, null));
            scheduler.stop(fx.projectPath);
            assertEquals(3, scheduler.start(fx.projectPath, 0));
        }

        @Test
        @DisplayName("a second start for the same project is rejected")
        void doubleStart() {
            scheduler.start(fx.projectPath, 1);

            assertThrows(IllegalStateException.class, () -> scheduler.start(fx.projectPath, 1));
        }

        @Test
        @DisplayName("stop clears the snapshot and announces once")
        void stopClears() {
            scheduler.start(fx.projectPath, 1);

            assertEquals(0, scheduler.stop(fx.projectPath));
            assertEquals(0, scheduler.stop(fx.projectPath));

            assertFalse(scheduler.isRunning(fx.projectPath));
            assertFalse(fx.stateStore.load(fx.projectPath).autoLoopWasRunning());
            assertEquals(1, fx.events(AutoModeEventType.AUTO_MODE_STOPPED).size());
        }

        @Test
        @DisplayName("a feature finishing after stop leaves no snapshot behind")
        void finishAfterStopKeepsSnapshotCleared() throws Exception {
            fx.saveFeature("F1", "One", "backlog");
            CountDownLatch release = new CountDownLatch(1);
            fx.provider.replyWith(q -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(AgentMessage.text("ok"), AgentMessage.result("ok"));
            });
            Path snapshotFile = FeatureStore.automakerDir(fx.projectPath).resolve("execution-state.json");

            scheduler.start(fx.projectPath, 1);
            Waits.until(() -> fx.runningFeatures.isRunning("F1"), "F1 to start");
            assertEquals(1, scheduler.stop(fx.projectPath));
            assertFalse(Files.exists(snapshotFile));

            release.countDown();
            Waits.until(() -> {
                Timer timer = fx.meterRegistry.find("automaker.feature.duration").timer();
                return timer != null && timer.count() == 1;
            }, "F1 to finish");

            assertFalse(Files.exists(snapshotFile));
        }

        @Test
        @DisplayName("an empty project reports idle")
        void idle() {
            scheduler.start(fx.projectPath, 1);

            Waits.until(() -> !fx.events(AutoModeEventType.AUTO_MODE_IDLE).isEmpty(), "idle event");
        }
    }

    // -- dispatch tests ---

    @Nested
    @DisplayName("dispatch")
    class DispatchTests {

        @Test
        @DisplayName("runs dependencies before their dependents")
        void dependencyOrder() {
            Feature b = new Feature("B", "Build B", "backlog");
            b.setDependencies(List.of("A"));
            fx.saveFeature(b);
            fx.saveFeature("A", "Build A", "backlog");
            fx.provider.replyText("ok");

            scheduler.start(fx.projectPath, 3);
            Waits.until(() -> "verified".equals(fx.status("B")), "B to be verified");

            List<String> prompts = fx.provider.prompts();
            assertTrue(prompts.get(0).contains("Build A"));
            assertTrue(prompts.get(1).contains("Build B"));
            assertEquals("verified", fx.status("A"));
        }

        @Test
        @DisplayName("never runs more features than the ceiling")
        void respectsCeiling() {
            fx.saveFeature("F1", "One", "backlog");
            fx.saveFeature("F2", "Two", "backlog");
            fx.saveFeature("F3", "Three", "backlog");
            AtomicInteger peak = new AtomicInteger();
            fx.provider.replyWith(q -> {
                peak.accumulateAndGet(fx.runningFeatures.countForProject(fx.projectPath), Math::max);
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(AgentMessage.text("ok"), AgentMessage.result("ok"));
            });

            scheduler.start(fx.projectPath, 1);
            Waits.until(() -> List.of("F1", "F2", "F3").stream().allMatch(id -> "verified".equals(fx.status(id))),
                    "all features verified");

            assertEquals(1, peak.get());
        }

        @Test
        @DisplayName("a quota error pauses the project and stops the loop")
        void quotaPauses() {
            fx.saveFeature("F1", "One", "backlog");
            fx.provider.reply(AgentMessage.error("You exceeded your current quota"));

            scheduler.start(fx.projectPath, 1);
            Waits.until(() -> !fx.events(AutoModeEventType.AUTO_MODE_STOPPED).isEmpty(), "loop to stop");

            assertEquals(1, fx.events(AutoModeEventType.AUTO_MODE_PAUSED_FAILURES).size());
            assertFalse(scheduler.isRunning(fx.projectPath));
            assertEquals(true, scheduler.getStatusForProject(fx.projectPath).get("paused"));
            fx.awaitIdle();
            assertEquals("backlog", fx.status("F1"));
        }

        @Test
        @DisplayName("restarting after a pause clears it")
        void restartClearsPause() {
            fx.saveFeature("F1", "One", "backlog");
            fx.provider.reply(AgentMessage.error("You exceeded your current quota"));
            scheduler.start(fx.projectPath, 1);
            Waits.until(() -> !scheduler.isRunning(fx.projectPath), "loop to stop");
            fx.awaitIdle();

            fx.provider.replyText("ok");
            scheduler.start(fx.projectPath, 1);

            assertFalse(fx.circuitBreaker.isPaused(fx.projectPath));
            Waits.until(() -> "verified".equals(fx.status("F1")), "F1 to be verified");
        }
    }

    @Test
    @DisplayName("status reports the loop and its running features")
    void status() {
        fx.runningFeatures.register("F1", fx.projectPath, true);
        scheduler.start(fx.projectPath, 2);

        Map<String, Object> status = scheduler.getStatusForProject(fx.projectPath);

        assertEquals(true, status.get("isAutoLoopRunning"));
        assertEquals(List.of("F1"), status.get("runningFeatures"));
        assertEquals(1, status.get("runningCount"));
        assertEquals(2, status.get("maxConcurrency"));
        assertEquals(false, status.get("paused"));
    }
}
