package com.automaker.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the isolated git worktree checked out for a feature branch.
 * Worktree creation happens elsewhere; this only looks up existing ones.
 */
@Service
public class WorkspaceResolver {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceResolver.class);

    private static final long GIT_TIMEOUT_SECONDS = 30;

    private final ProcessRunner processRunner;

    public WorkspaceResolver(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    public Optional<Path> findWorkspaceForBranch(String projectPath, String branchName) {
        if (branchName == null || branchName.isBlank()) {
            return Optional.empty();
        }
        ProcessRunner.Result result = processRunner.run(Path.of(projectPath), GIT_TIMEOUT_SECONDS,
                List.of("git", "worktree", "list", "--porcelain"));
        if (!result.succeeded()) {
            log.debug("git worktree list failed in {}: {}", projectPath, result.output());
            return Optional.empty();
        }
        return parseWorktreeList(result.output(), branchName)
                .filter(Files::isDirectory);
    }

    /**
     * Parses {@code git worktree list --porcelain} output. Blocks are separated by blank lines
     * and contain {@code worktree <path>} and {@code branch refs/heads/<name>} lines.
     */
    static Optional<Path> parseWorktreeList(String porcelain, String branchName) {
        String currentPath = null;
        for (String line : porcelain.split("\n")) {
            if (line.startsWith("worktree ")) {
                currentPath = line.substring("worktree ".length()).trim();
            } else if (line.startsWith("branch ") && currentPath != null) {
                String ref = line.substring("branch ".length()).trim();
                String branch = ref.startsWith("refs/heads/") ? ref.substring("refs/heads/".length()) : ref;
                if (branch.equals(branchName)) {
                    return Optional.of(Path.of(currentPath));
                }
            } else if (line.isBlank()) {
                currentPath = null;
            }
        }
        return Optional.empty();
    }
}
