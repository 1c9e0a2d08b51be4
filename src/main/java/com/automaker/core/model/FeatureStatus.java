package com.automaker.core.model;

/**
 * Lifecycle status strings persisted on a {@link Feature}.
 * <p>
 * Statuses are kept as strings rather than an enum because pipeline steps produce
 * dynamic values of the form {@code pipeline_<stepId>}.
 */
public final class FeatureStatus {

    public static final String BACKLOG = "backlog";
    public static final String PENDING = "pending";
    public static final String READY = "ready";
    public static final String IN_PROGRESS = "in_progress";
    public static final String WAITING_APPROVAL = "waiting_approval";
    public static final String VERIFIED = "verified";
    public static final String COMPLETED = "completed";

    public static final String PIPELINE_PREFIX = "pipeline_";

    private FeatureStatus() {}

    /** True for statuses the scheduler loop may pick up. */
    public static boolean isSchedulable(String status) {
        return PENDING.equals(status) || READY.equals(status) || BACKLOG.equals(status);
    }

    public static boolean isPipeline(String status) {
        return status != null && status.startsWith(PIPELINE_PREFIX);
    }

    public static String pipeline(String stepId) {
        return PIPELINE_PREFIX + stepId;
    }

    /**
     * Extracts the step id from a pipeline status.
     *
     * @return the step id, or {@code null} when the status is not a well-formed pipeline status
     */
    public static String stepIdOf(String status) {
        if (!isPipeline(status)) {
            return null;
        }
        String stepId = status.substring(PIPELINE_PREFIX.length());
        return stepId.isBlank() ? null : stepId;
    }

    /** Final status after a successful run. */
    public static String finalStatus(boolean skipTests) {
        return skipTests ? WAITING_APPROVAL : VERIFIED;
    }
}
