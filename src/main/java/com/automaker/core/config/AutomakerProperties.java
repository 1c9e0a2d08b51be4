package com.automaker.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "automaker")
public class AutomakerProperties {

    private AutoLoop autoLoop = new AutoLoop();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Approval approval = new Approval();
    private Output output = new Output();
    private Storage storage = new Storage();
    private Agent agent = new Agent();
    private Recovery recovery = new Recovery();
    private Verification verification = new Verification();

    public AutoLoop getAutoLoop() { return autoLoop; }
    public void setAutoLoop(AutoLoop autoLoop) { this.autoLoop = autoLoop; }
    public CircuitBreaker getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreaker circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    public Approval getApproval() { return approval; }
    public void setApproval(Approval approval) { this.approval = approval; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }
    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }

    public static class AutoLoop {
        private int maxConcurrency = 3;
        private long capacityBackoffMs = 5000;
        private long idleBackoffMs = 10000;
        private long dispatchIntervalMs = 2000;
        private long errorBackoffMs = 5000;
        private boolean useWorktrees = true;
        private boolean skipVerification = false;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public long getCapacityBackoffMs() { return capacityBackoffMs; }
        public void setCapacityBackoffMs(long capacityBackoffMs) { this.capacityBackoffMs = capacityBackoffMs; }
        public long getIdleBackoffMs() { return idleBackoffMs; }
        public void setIdleBackoffMs(long idleBackoffMs) { this.idleBackoffMs = idleBackoffMs; }
        public long getDispatchIntervalMs() { return dispatchIntervalMs; }
        public void setDispatchIntervalMs(long dispatchIntervalMs) { this.dispatchIntervalMs = dispatchIntervalMs; }
        public long getErrorBackoffMs() { return errorBackoffMs; }
        public void setErrorBackoffMs(long errorBackoffMs) { this.errorBackoffMs = errorBackoffMs; }
        public boolean isUseWorktrees() { return useWorktrees; }
        public void setUseWorktrees(boolean useWorktrees) { this.useWorktrees = useWorktrees; }
        public boolean isSkipVerification() { return skipVerification; }
        public void setSkipVerification(boolean skipVerification) { this.skipVerification = skipVerification; }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 3;
        private long windowMs = 60_000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }
    }

    public static class Approval {
        private long timeoutMinutes = 30;

        public long getTimeoutMinutes() { return timeoutMinutes; }
        public void setTimeoutMinutes(long timeoutMinutes) { this.timeoutMinutes = timeoutMinutes; }
    }

    public static class Output {
        private long debounceMs = 500;
        private boolean rawOutputEnabled = false;

        public long getDebounceMs() { return debounceMs; }
        public void setDebounceMs(long debounceMs) { this.debounceMs = debounceMs; }
        public boolean isRawOutputEnabled() { return rawOutputEnabled; }
        public void setRawOutputEnabled(boolean rawOutputEnabled) { this.rawOutputEnabled = rawOutputEnabled; }
    }

    public static class Storage {
        private int backupCount = 3;

        public int getBackupCount() { return backupCount; }
        public void setBackupCount(int backupCount) { this.backupCount = backupCount; }
    }

    public static class Agent {
        private String provider = "spring-ai";
        private String defaultModel = "gpt-4o";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
    }

    public static class Recovery {
        private boolean resumeOnStartup = true;
        private List<String> projectPaths = new ArrayList<>();

        public boolean isResumeOnStartup() { return resumeOnStartup; }
        public void setResumeOnStartup(boolean resumeOnStartup) { this.resumeOnStartup = resumeOnStartup; }
        public List<String> getProjectPaths() { return projectPaths; }
        public void setProjectPaths(List<String> projectPaths) { this.projectPaths = projectPaths; }
    }

    public static class Verification {
        private List<String> commands = new ArrayList<>(List.of(
                "npm run lint", "npm run typecheck", "npm test", "npm run build"));
        private long timeoutSeconds = 120;

        public List<String> getCommands() { return commands; }
        public void setCommands(List<String> commands) { this.commands = commands; }
        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
