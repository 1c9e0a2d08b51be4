package com.automaker.core.engine;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.EventBus;
import com.automaker.core.model.Feature;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.workspace.ProcessRunner;
import com.automaker.core.workspace.WorkspaceResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class FeatureVerificationServiceTest {

    @TempDir
    Path projectDir;

    private final ProcessRunner processRunner = mock(ProcessRunner.class);
    private final WorkspaceResolver workspaceResolver = mock(WorkspaceResolver.class);
    private final List<AutoModeEvent> events = new CopyOnWriteArrayList<>();
    private FeatureStore featureStore;
    private FeatureVerificationService service;
    private String projectPath;

    @BeforeEach
    void setUp() {
        projectPath = projectDir.toString();
        AutomakerProperties properties = new AutomakerProperties();
        properties.getVerification().setCommands(List.of("npm run lint", "npm test"));
        featureStore = new FeatureStore(new ObjectMapper().findAndRegisterModules(), properties);
        EventBus eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        service = new FeatureVerificationService(featureStore, workspaceResolver, processRunner, eventBus, properties);
        featureStore.save(projectPath, new Feature("F1", "Add a dark mode toggle", "verified"));
    }

    private static ProcessRunner.Result ok(String output) {
        return new ProcessRunner.Result(0, output);
    }

    // -- verification tests ---

    @Nested
    @DisplayName("verifyFeature")
    class VerifyTests {

        @Test
        @DisplayName("passes when every command succeeds")
        void allPass() {
            when(processRunner.runShell(any(), anyLong(), any())).thenReturn(ok(""));

            assertTrue(service.verifyFeature(projectPath, "F1"));

            verify(processRunner).runShell(projectDir, 120, "npm run lint");
            verify(processRunner).runShell(projectDir, 120, "npm test");
            assertEquals("All verification checks passed", events.get(0).payload().get("message"));
        }

        @Test
        @DisplayName("stops at the first failing command")
        void stopsAtFailure() {
            when(processRunner.runShell(any(), anyLong(), eq("npm run lint")))
                    .thenReturn(new ProcessRunner.Result(1, "lint errors"));

            assertFalse(service.verifyFeature(projectPath, "F1"));

            verify(processRunner, never()).runShell(any(), anyLong(), eq("npm test"));
            assertEquals(false, events.get(0).payload().get("passes"));
            assertEquals("Verification failed: npm run lint", events.get(0).payload().get("message"));
        }
    }

    // -- commit tests ---

    @Nested
    @DisplayName("commitFeature")
    class CommitTests {

        @Test
        @DisplayName("commits all changes with a message built from the feature")
        void commits() {
            when(processRunner.run(any(), anyLong(), eq(List.of("git", "status", "--porcelain"))))
                    .thenReturn(ok(" M src/App.tsx\n"));
            when(processRunner.run(any(), anyLong(), eq(List.of("git", "add", "-A")))).thenReturn(ok(""));
            when(processRunner.run(any(), anyLong(), argThat(c -> c != null && c.size() > 1 && c.get(1).equals("commit"))))
                    .thenReturn(ok(""));
            when(processRunner.run(any(), anyLong(), eq(List.of("git", "rev-parse", "HEAD"))))
                    .thenReturn(ok("0123456789abcdef\n"));

            Optional<String> hash = service.commitFeature(projectPath, "F1", null);

            assertEquals(Optional.of("0123456789abcdef"), hash);
            verify(processRunner).run(projectDir, 60, List.of("git", "commit", "-m",
                    "feat: Add a dark mode toggle\n\n" + FeatureVerificationService.COMMIT_TRAILER));
            assertEquals("Changes committed: 01234567", events.get(0).payload().get("message"));
        }

        @Test
        @DisplayName("returns empty when there is nothing to commit")
        void nothingToCommit() {
            when(processRunner.run(any(), anyLong(), any())).thenReturn(ok(""));

            assertTrue(service.commitFeature(projectPath, "F1", null).isEmpty());

            verify(processRunner, times(1)).run(any(), anyLong(), any());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("returns empty when the commit fails")
        void commitFails() {
            when(processRunner.run(any(), anyLong(), any())).thenReturn(ok("?? new.txt"));
            when(processRunner.run(any(), anyLong(), argThat(c -> c != null && c.size() > 1 && c.get(1).equals("commit"))))
                    .thenReturn(new ProcessRunner.Result(1, "hook rejected"));

            assertTrue(service.commitFeature(projectPath, "F1", null).isEmpty());
            assertTrue(events.isEmpty());
        }
    }

    // -- workspace resolution tests ---

    @Nested
    @DisplayName("resolveWorkDir")
    class ResolveWorkDirTests {

        @Test
        @DisplayName("prefers an existing explicit worktree")
        void explicitWorktree() throws Exception {
            Path worktree = Files.createDirectory(projectDir.resolve("wt"));

            assertEquals(worktree, service.resolveWorkDir(projectPath, "F1", worktree.toString()));
            verifyNoInteractions(workspaceResolver);
        }

        @Test
        @DisplayName("uses the worktree of the feature branch")
        void branchWorktree() {
            Feature feature = featureStore.load(projectPath, "F1").orElseThrow();
            feature.setBranchName("feature/dark-mode");
            featureStore.save(projectPath, feature);
            Path worktree = projectDir.resolve("trees/dark-mode");
            when(workspaceResolver.findWorkspaceForBranch(projectPath, "feature/dark-mode"))
                    .thenReturn(Optional.of(worktree));

            assertEquals(worktree, service.resolveWorkDir(projectPath, "F1", projectDir.resolve("missing").toString()));
        }

        @Test
        @DisplayName("falls back to the legacy directory, then the project")
        void fallbacks() throws Exception {
            assertEquals(projectDir, service.resolveWorkDir(projectPath, "F1", null));

            Path legacy = Files.createDirectories(projectDir.resolve(".worktrees").resolve("F1"));
            assertEquals(legacy, service.resolveWorkDir(projectPath, "F1", null));
        }
    }
}
