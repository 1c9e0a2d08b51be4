package com.automaker.core.engine;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.model.Feature;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.workspace.ProcessRunner;
import com.automaker.core.workspace.WorkspaceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the project's verification commands against a feature's workspace and commits its changes.
 */
@Service
public class FeatureVerificationService {

    private static final Logger log = LoggerFactory.getLogger(FeatureVerificationService.class);

    private static final long GIT_TIMEOUT_SECONDS = 60;
    static final String COMMIT_TRAILER = "Implemented by Automaker auto-mode";

    private final FeatureStore featureStore;
    private final WorkspaceResolver workspaceResolver;
    private final ProcessRunner processRunner;
    private final EventBus eventBus;
    private final List<String> verificationCommands;
    private final long verificationTimeoutSeconds;

    public FeatureVerificationService(FeatureStore featureStore, WorkspaceResolver workspaceResolver,
                                      ProcessRunner processRunner, EventBus eventBus,
                                      AutomakerProperties properties) {
        this.featureStore = featureStore;
        this.workspaceResolver = workspaceResolver;
        this.processRunner = processRunner;
        this.eventBus = eventBus;
        this.verificationCommands = List.copyOf(properties.getVerification().getCommands());
        this.verificationTimeoutSeconds = properties.getVerification().getTimeoutSeconds();
    }

    /**
     * Runs each verification command in order, stopping at the first failure.
     *
     * @return true when every command exited with status 0
     */
    public boolean verifyFeature(String projectPath, String featureId) {
        Path workDir = resolveWorkDir(projectPath, featureId, null);
        String failedCommand = null;
        for (String command : verificationCommands) {
            ProcessRunner.Result result = processRunner.runShell(workDir, verificationTimeoutSeconds, command);
            if (!result.succeeded()) {
                log.info("Verification of {} failed at '{}' (exit {})", featureId, command, result.exitCode());
                failedCommand = command;
                break;
            }
            log.debug("Verification step '{}' passed for {}", command, featureId);
        }

        boolean passed = failedCommand == null;
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_FEATURE_COMPLETE, projectPath, featureId,
                Map.of("passes", passed,
                        "message", passed ? "All verification checks passed" : "Verification failed: " + failedCommand)));
        return passed;
    }

    /**
     * Stages and commits every change in the feature's workspace.
     *
     * @param worktreePath explicit workspace, or null to look one up
     * @return the commit hash, or empty when there was nothing to commit or git failed
     */
    public Optional<String> commitFeature(String projectPath, String featureId, String worktreePath) {
        Path workDir = resolveWorkDir(projectPath, featureId, worktreePath);

        ProcessRunner.Result status = git(workDir, "status", "--porcelain");
        if (!status.succeeded()) {
            log.error("git status failed for {} in {}: {}", featureId, workDir, status.output());
            return Optional.empty();
        }
        if (status.output().isBlank()) {
            log.info("No changes to commit for {}", featureId);
            return Optional.empty();
        }

        String message = featureStore.load(projectPath, featureId)
                .map(f -> "feat: " + Feature.extractTitleFromDescription(f.getDescription()) + "\n\n" + COMMIT_TRAILER)
                .orElse("feat: Feature " + featureId);

        ProcessRunner.Result add = git(workDir, "add", "-A");
        ProcessRunner.Result commit = add.succeeded() ? git(workDir, "commit", "-m", message) : add;
        if (!commit.succeeded()) {
            log.error("Commit failed for {}: {}", featureId, commit.output());
            return Optional.empty();
        }

        ProcessRunner.Result head = git(workDir, "rev-parse", "HEAD");
        if (!head.succeeded()) {
            log.error("Could not read commit hash for {}: {}", featureId, head.output());
            return Optional.empty();
        }
        String hash = head.output().trim();
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_FEATURE_COMPLETE, projectPath, featureId,
                Map.of("passes", true,
                        "message", "Changes committed: " + hash.substring(0, Math.min(8, hash.length())))));
        return Optional.of(hash);
    }

    /**
     * Explicit worktree if it exists, then the worktree of the feature's branch, then the
     * legacy {@code .worktrees/<featureId>} directory, then the project itself.
     */
    Path resolveWorkDir(String projectPath, String featureId, String explicitWorktree) {
        if (explicitWorktree != null && !explicitWorktree.isBlank()) {
            Path explicit = Path.of(explicitWorktree);
            if (Files.isDirectory(explicit)) {
                return explicit;
            }
            log.info("Provided worktree {} does not exist, using project path", explicitWorktree);
        }
        Optional<Path> branchWorktree = featureStore.load(projectPath, featureId)
                .map(Feature::getBranchName)
                .flatMap(branch -> workspaceResolver.findWorkspaceForBranch(projectPath, branch));
        if (branchWorktree.isPresent()) {
            return branchWorktree.get();
        }
        Path legacy = Path.of(projectPath, ".worktrees", featureId);
        return Files.isDirectory(legacy) ? legacy : Path.of(projectPath);
    }

    private ProcessRunner.Result git(Path workDir, String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        return processRunner.run(workDir, GIT_TIMEOUT_SECONDS, command);
    }
}
