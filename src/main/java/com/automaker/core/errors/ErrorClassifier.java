package com.automaker.core.errors;

import java.util.List;
import java.util.Locale;

/**
 * Maps exceptions from feature execution to an {@link ErrorType} by inspecting the
 * exception type and message text of the whole cause chain. A user stop is recognised by
 * {@link FeatureAbortedException} alone, never by message text.
 */
public final class ErrorClassifier {

    private static final List<String> QUOTA_MARKERS = List.of(
            "quota", "usage limit", "credit balance", "insufficient_quota", "billing");
    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate limit", "rate_limit", "429", "too many requests");
    private static final List<String> AUTH_MARKERS = List.of(
            "authentication", "unauthorized", "401", "invalid api key", "api key");

    private ErrorClassifier() {}

    public static ErrorInfo classify(Throwable error) {
        if (error == null) {
            return new ErrorInfo(ErrorType.UNKNOWN, "Unknown error");
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof FeatureAbortedException) {
                return new ErrorInfo(ErrorType.ABORT, message);
            }
            if (t instanceof InterruptedException) {
                return new ErrorInfo(ErrorType.CANCELLATION, message);
            }
        }

        // Only a typed abort counts as a user stop; backend messages such as "connection aborted" are failures
        String text = collectMessages(error).toLowerCase(Locale.ROOT);
        if (containsAny(text, QUOTA_MARKERS)) {
            return new ErrorInfo(ErrorType.QUOTA_EXHAUSTED, message);
        }
        if (containsAny(text, RATE_LIMIT_MARKERS)) {
            return new ErrorInfo(ErrorType.RATE_LIMIT, message);
        }
        if (containsAny(text, AUTH_MARKERS)) {
            return new ErrorInfo(ErrorType.AUTHENTICATION, message);
        }
        if (error instanceof AgentExecutionException || error instanceof PlanApprovalException) {
            return new ErrorInfo(ErrorType.EXECUTION, message);
        }
        return new ErrorInfo(ErrorType.UNKNOWN, message);
    }

    private static String collectMessages(Throwable error) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append('\n');
            }
        }
        return sb.toString();
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
