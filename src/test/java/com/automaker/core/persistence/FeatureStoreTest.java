package com.automaker.core.persistence;

import com.automaker.core.model.Feature;
import com.automaker.core.model.PlanSpecStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FeatureStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path projectDir;

    private FeatureStore store;
    private String projectPath;

    @BeforeEach
    void setUp() {
        store = new FeatureStore(new AtomicJsonFiles(new ObjectMapper().findAndRegisterModules(), 3),
                Clock.fixed(NOW, ZoneOffset.UTC));
        projectPath = projectDir.toString();
    }

    // -- record tests ---

    @Nested
    @DisplayName("feature records")
    class RecordTests {

        @Test
        @DisplayName("save then load returns the feature")
        void saveAndLoad() {
            store.save(projectPath, new Feature("F1", "Add login", "backlog"));

            Optional<Feature> loaded = store.load(projectPath, "F1");

            assertTrue(loaded.isPresent());
            assertEquals("backlog", loaded.get().getStatus());
            assertTrue(Files.exists(FeatureStore.featureDir(projectPath, "F1").resolve("feature.json")));
        }

        @Test
        @DisplayName("load of a missing feature is empty")
        void loadMissing() {
            assertTrue(store.load(projectPath, "nope").isEmpty());
        }

        @Test
        @DisplayName("list returns features sorted by id and skips unreadable ones")
        void listSkipsUnreadable() throws Exception {
            store.save(projectPath, new Feature("F2", "b", "pending"));
            store.save(projectPath, new Feature("F1", "a", "pending"));
            Path broken = FeatureStore.featureDir(projectPath, "F3");
            Files.createDirectories(broken);
            Files.writeString(broken.resolve("feature.json"), "garbage");

            List<Feature> features = store.list(projectPath);

            assertEquals(List.of("F1", "F2"), features.stream().map(Feature::getId).toList());
        }

        @Test
        @DisplayName("list of a project without features is empty")
        void listEmpty() {
            assertTrue(store.list(projectPath).isEmpty());
        }
    }

    // -- update tests ---

    @Nested
    @DisplayName("updates")
    class UpdateTests {

        @Test
        @DisplayName("update stamps updatedAt")
        void updateStampsTime() {
            store.save(projectPath, new Feature("F1", "a", "pending"));

            Feature updated = store.update(projectPath, "F1", f -> f.setModel("gpt-4o")).orElseThrow();

            assertEquals("gpt-4o", updated.getModel());
            assertEquals(NOW, updated.getUpdatedAt());
        }

        @Test
        @DisplayName("update of a missing feature is empty")
        void updateMissing() {
            assertTrue(store.update(projectPath, "F9", f -> f.setModel("x")).isEmpty());
        }

        @Test
        @DisplayName("waiting_approval stamps justFinishedAt and other statuses clear it")
        void justFinishedAt() {
            store.save(projectPath, new Feature("F1", "a", "in_progress"));

            Feature waiting = store.updateStatus(projectPath, "F1", "waiting_approval").orElseThrow();
            assertEquals(NOW, waiting.getJustFinishedAt());

            Feature verified = store.updateStatus(projectPath, "F1", "verified").orElseThrow();
            assertNull(verified.getJustFinishedAt());
            assertNull(store.load(projectPath, "F1").orElseThrow().getJustFinishedAt());
        }

        @Test
        @DisplayName("updatePlanSpec creates a pending spec when none exists")
        void updatePlanSpecCreatesSpec() {
            store.save(projectPath, new Feature("F1", "a", "in_progress"));

            Feature updated = store.updatePlanSpec(projectPath, "F1", spec -> spec.setContent("## Plan"))
                    .orElseThrow();

            assertEquals(PlanSpecStatus.PENDING, updated.getPlanSpec().getStatus());
            assertEquals(1, updated.getPlanSpec().getVersion());
            assertEquals("## Plan", updated.getPlanSpec().getContent());
            assertEquals(Boolean.FALSE, updated.getPlanSpec().getReviewedByUser());
        }
    }

    // -- agent output tests ---

    @Nested
    @DisplayName("agent output")
    class AgentOutputTests {

        @Test
        @DisplayName("write then read agent output")
        void writeAndRead() {
            assertFalse(store.hasAgentOutput(projectPath, "F1"));

            store.writeAgentOutput(projectPath, "F1", "# Output\nDone");

            assertTrue(store.hasAgentOutput(projectPath, "F1"));
            assertEquals("# Output\nDone", store.readAgentOutput(projectPath, "F1").orElseThrow());
        }

        @Test
        @DisplayName("raw output is appended line by line")
        void appendsRawOutput() throws Exception {
            store.appendRawOutput(projectPath, "F1", "{\"a\":1}");
            store.appendRawOutput(projectPath, "F1", "{\"a\":2}");

            List<String> lines = Files.readAllLines(store.rawOutputPath(projectPath, "F1"));
            assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), lines);
        }
    }
}
