package com.automaker.core.approval;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.errors.PlanApprovalException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of plans awaiting human review, at most one per feature.
 * <p>
 * {@link #waitForApproval} registers the request and returns a future; callers must register
 * before announcing that approval is needed so a fast reviewer cannot resolve an unregistered
 * feature. Each request auto-rejects after the configured timeout, and the timer is cancelled
 * on every other completion path.
 */
@Service
public class PlanApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(PlanApprovalGate.class);

    private final ConcurrentHashMap<String, PendingApproval> pending = new ConcurrentHashMap<>();
    private final long timeoutMs;
    private final String timeoutMessage;

    private final ScheduledExecutorService timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "plan-approval-timeout");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public PlanApprovalGate(AutomakerProperties properties) {
        this(TimeUnit.MINUTES.toMillis(properties.getApproval().getTimeoutMinutes()),
                "Plan approval timed out after " + properties.getApproval().getTimeoutMinutes()
                        + " minutes - feature execution cancelled");
    }

    /**
     * @param timeoutMs      how long a request may stay pending before it is rejected
     * @param timeoutMessage message of the {@link PlanApprovalException} a timed-out request fails with
     */
    public PlanApprovalGate(long timeoutMs, String timeoutMessage) {
        this.timeoutMs = timeoutMs;
        this.timeoutMessage = timeoutMessage;
    }

    private record PendingApproval(
            String featureId,
            String projectPath,
            CompletableFuture<PlanApprovalResult> future,
            ScheduledFuture<?> timeout
    ) {}

    /**
     * Registers a pending approval for {@code featureId}. A previous request for the same
     * feature is cancelled first.
     */
    public CompletableFuture<PlanApprovalResult> waitForApproval(String featureId, String projectPath) {
        cancel(featureId);

        CompletableFuture<PlanApprovalResult> future = new CompletableFuture<>();
        ScheduledFuture<?> timeout = timeoutScheduler.schedule(() -> {
            PendingApproval entry = pending.get(featureId);
            if (entry != null && entry.future() == future && pending.remove(featureId, entry)) {
                log.warn("Plan approval for feature {} timed out", featureId);
                future.completeExceptionally(new PlanApprovalException(timeoutMessage));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);

        PendingApproval entry = new PendingApproval(featureId, projectPath, future, timeout);
        pending.put(featureId, entry);
        future.whenComplete((result, error) -> timeout.cancel(false));
        log.info("Registered pending approval for feature {}", featureId);
        return future;
    }

    /**
     * Completes a pending approval.
     *
     * @return false when nothing was pending for the feature; the call is then a no-op
     */
    public boolean resolve(String featureId, PlanApprovalResult result) {
        PendingApproval entry = pending.remove(featureId);
        if (entry == null) {
            return false;
        }
        log.info("Plan approval resolved for feature {} (approved={})", featureId, result.approved());
        entry.future().complete(result);
        return true;
    }

    /**
     * Rejects a pending approval because the feature was stopped.
     *
     * @return true when an approval was pending
     */
    public boolean cancel(String featureId) {
        PendingApproval entry = pending.remove(featureId);
        if (entry == null) {
            return false;
        }
        log.info("Cancelled pending approval for feature {}", featureId);
        entry.future().completeExceptionally(new PlanApprovalException("Plan approval cancelled - feature was stopped"));
        return true;
    }

    public boolean hasPending(String featureId) {
        return pending.containsKey(featureId);
    }

    public Optional<String> pendingProjectPath(String featureId) {
        PendingApproval entry = pending.get(featureId);
        return entry != null ? Optional.ofNullable(entry.projectPath()) : Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        timeoutScheduler.shutdownNow();
    }
}
