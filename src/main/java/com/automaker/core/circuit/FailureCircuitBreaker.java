package com.automaker.core.circuit;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.errors.ErrorInfo;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.metrics.AutoModeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Per-project sliding-window failure counter that pauses auto mode.
 * <p>
 * Each failure is appended with its timestamp and entries older than the window are dropped.
 * The project pauses when the window holds at least the threshold, or at once for quota and
 * rate-limit errors. Pausing is idempotent and sticky until {@link #reset(String)}; a success
 * clears the window but leaves a pause in place.
 */
@Service
public class FailureCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(FailureCircuitBreaker.class);

    private final EventBus eventBus;
    private final AutoModeMetrics metrics;
    private final int threshold;
    private final long windowMs;
    private final LongSupplier clock;

    private final ConcurrentHashMap<String, ProjectFailures> projects = new ConcurrentHashMap<>();
    private final List<Consumer<String>> pauseListeners = new CopyOnWriteArrayList<>();

    @Autowired
    public FailureCircuitBreaker(EventBus eventBus, AutoModeMetrics metrics, AutomakerProperties properties) {
        this(eventBus, metrics,
                properties.getCircuitBreaker().getFailureThreshold(),
                properties.getCircuitBreaker().getWindowMs(),
                System::currentTimeMillis);
    }

    FailureCircuitBreaker(EventBus eventBus, AutoModeMetrics metrics, int threshold, long windowMs, LongSupplier clock) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.threshold = threshold;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    /** Registers a callback invoked with the project path whenever a project becomes paused. */
    public void onPause(Consumer<String> listener) {
        pauseListeners.add(listener);
    }

    /**
     * Records a failure and pauses the project if the window is now full or the error is a
     * usage limit.
     *
     * @return true when this failure paused the project
     */
    public boolean recordFailure(String projectPath, ErrorInfo error) {
        ProjectFailures state = projects.computeIfAbsent(projectPath, k -> new ProjectFailures());
        int failureCount;
        synchronized (state) {
            long now = clock.getAsLong();
            state.timestamps.addLast(now);
            while (!state.timestamps.isEmpty() && now - state.timestamps.peekFirst() >= windowMs) {
                state.timestamps.removeFirst();
            }
            failureCount = state.timestamps.size();
            boolean shouldPause = failureCount >= threshold || error.type().isUsageLimit();
            log.debug("Failure recorded for {} ({} in window, type={})", projectPath, failureCount, error.type().value());
            if (!shouldPause || state.paused) {
                return false;
            }
            state.paused = true;
        }

        boolean repeated = failureCount >= threshold;
        log.info("Pausing auto loop for {} after {} consecutive failures. Last error: {}",
                projectPath, failureCount, error.type().value());
        metrics.recordPause(repeated ? "consecutive_failures" : error.type().value());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", repeated
                ? "Auto Mode paused: " + failureCount + " consecutive failures detected. This may indicate a "
                        + "quota limit or API issue. Please check your usage and try again."
                : "Auto Mode paused: Usage limit or API error detected. Please wait for your quota to reset "
                        + "or check your API configuration.");
        payload.put("errorType", error.type().value());
        payload.put("originalError", error.message());
        payload.put("failureCount", failureCount);
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_PAUSED_FAILURES, projectPath, payload));

        for (Consumer<String> listener : pauseListeners) {
            listener.accept(projectPath);
        }
        return true;
    }

    /** Clears the failure window after a successful feature. */
    public void recordSuccess(String projectPath) {
        ProjectFailures state = projects.get(projectPath);
        if (state != null) {
            synchronized (state) {
                state.timestamps.clear();
            }
        }
    }

    /** Clears both the window and the paused flag; called when the user restarts auto mode. */
    public void reset(String projectPath) {
        projects.remove(projectPath);
    }

    public boolean isPaused(String projectPath) {
        ProjectFailures state = projects.get(projectPath);
        return state != null && state.paused;
    }

    public int failureCount(String projectPath) {
        ProjectFailures state = projects.get(projectPath);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.timestamps.size();
        }
    }

    private static final class ProjectFailures {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private boolean paused;
    }
}
