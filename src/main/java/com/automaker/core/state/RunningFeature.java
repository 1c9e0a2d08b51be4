package com.automaker.core.state;

import com.automaker.core.agent.CancellationToken;

import java.nio.file.Path;
import java.time.Instant;

/**
 * In-memory record of a feature with an active execution attempt.
 * Workspace and model fields are filled in once they are resolved.
 */
public class RunningFeature {

    private final String featureId;
    private final String projectPath;
    private final CancellationToken cancellation;
    private final Instant startTime;
    private final boolean autoMode;

    private volatile Path worktreePath;
    private volatile String branchName;
    private volatile String model;
    private volatile String provider;

    public RunningFeature(String featureId, String projectPath, boolean autoMode) {
        this.featureId = featureId;
        this.projectPath = projectPath;
        this.autoMode = autoMode;
        this.cancellation = new CancellationToken();
        this.startTime = Instant.now();
    }

    public String getFeatureId() { return featureId; }
    public String getProjectPath() { return projectPath; }
    public CancellationToken getCancellation() { return cancellation; }
    public Instant getStartTime() { return startTime; }
    public boolean isAutoMode() { return autoMode; }
    public Path getWorktreePath() { return worktreePath; }
    public void setWorktreePath(Path worktreePath) { this.worktreePath = worktreePath; }
    public String getBranchName() { return branchName; }
    public void setBranchName(String branchName) { this.branchName = branchName; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
}
