package com.automaker.core.runner;

import com.automaker.core.agent.AgentInvocation;
import com.automaker.core.agent.AgentMessage;
import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.AutoModeEventType;
import com.automaker.core.events.EventBus;
import com.automaker.core.persistence.FeatureStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Accumulates a feature's agent transcript, mirrors it to {@code agent-output.md} with a
 * debounce, and republishes text and tool activity as progress events.
 */
class AgentOutputRecorder implements AgentInvocation.Listener {

    private static final Logger log = LoggerFactory.getLogger(AgentOutputRecorder.class);

    static final String FOLLOW_UP_SEPARATOR = "\n\n---\n\n## Follow-up Session\n\n";

    private final String projectPath;
    private final String featureId;
    private final FeatureStore featureStore;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final long debounceMs;
    private final ObjectMapper mapper;
    private final boolean rawOutputEnabled;

    private final StringBuilder transcript = new StringBuilder();
    private ScheduledFuture<?> pendingWrite;

    /**
     * @param previousContent transcript of an earlier session; when present the new output
     *                        follows it under a follow-up heading
     * @param rawOutputEnabled whether every stream event is also appended to {@code raw-output.jsonl}
     */
    AgentOutputRecorder(String projectPath, String featureId, FeatureStore featureStore, EventBus eventBus,
                        ScheduledExecutorService scheduler, long debounceMs, ObjectMapper mapper,
                        boolean rawOutputEnabled, String previousContent) {
        this.projectPath = projectPath;
        this.featureId = featureId;
        this.featureStore = featureStore;
        this.eventBus = eventBus;
        this.scheduler = scheduler;
        this.debounceMs = debounceMs;
        this.mapper = mapper;
        this.rawOutputEnabled = rawOutputEnabled;
        if (previousContent != null && !previousContent.isEmpty()) {
            transcript.append(previousContent).append(FOLLOW_UP_SEPARATOR);
        }
    }

    @Override
    public void onText(String text) {
        append(text);
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_PROGRESS, projectPath, featureId,
                Map.of("content", text)));
    }

    @Override
    public void onToolUse(String tool, Map<String, Object> input) {
        append("\n\nTool: " + tool + "\n" + toJson(input) + "\n");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", tool);
        payload.put("input", input);
        eventBus.publish(AutoModeEvent.of(AutoModeEventType.AUTO_MODE_TOOL, projectPath, featureId, payload));
    }

    @Override
    public void onRaw(AgentMessage message) {
        if (!rawOutputEnabled) {
            return;
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", Instant.now().toString());
        line.put("type", message.type().name().toLowerCase());
        if (message.text() != null) {
            line.put("text", message.text());
        }
        if (message.toolName() != null) {
            line.put("tool", message.toolName());
            line.put("input", message.toolInput());
        }
        featureStore.appendRawOutput(projectPath, featureId, toJson(line));
    }

    /** Appends text that is not agent output, such as section headings. */
    void appendSection(String text) {
        append(text);
    }

    synchronized String transcript() {
        return transcript.toString();
    }

    /** Writes the transcript now, cancelling any pending debounced write. */
    synchronized void flush() {
        if (pendingWrite != null) {
            pendingWrite.cancel(false);
            pendingWrite = null;
        }
        write();
    }

    private synchronized void append(String text) {
        transcript.append(text);
        if (pendingWrite == null || pendingWrite.isDone()) {
            pendingWrite = scheduler.schedule(this::debouncedWrite, debounceMs, TimeUnit.MILLISECONDS);
        }
    }

    private synchronized void debouncedWrite() {
        pendingWrite = null;
        write();
    }

    private void write() {
        try {
            featureStore.writeAgentOutput(projectPath, featureId, transcript.toString());
        } catch (RuntimeException e) {
            log.warn("Failed to write agent output for {}: {}", featureId, e.getMessage());
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
