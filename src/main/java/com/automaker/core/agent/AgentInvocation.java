package com.automaker.core.agent;

import com.automaker.core.errors.AgentExecutionException;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Consumes one agent stream: forwards text and tool events to a {@link Listener}, checks the
 * cancellation token between events, and turns error events and authentication failures into
 * {@link AgentExecutionException}.
 */
public final class AgentInvocation {

    private static final List<String> AUTH_FAILURE_PHRASES = List.of(
            "authentication failed", "invalid api key", "not logged in", "please run /login");

    private AgentInvocation() {}

    public interface Listener {
        void onText(String text);

        void onToolUse(String tool, Map<String, Object> input);

        default void onRaw(AgentMessage message) {
        }
    }

    /**
     * Streams {@code query} to completion.
     *
     * @param stopWhen checked against the text accumulated so far after every text event;
     *                 returning true ends the stream early
     * @return the text produced by this invocation
     */
    public static String stream(AgentProvider provider, AgentQuery query, Listener listener,
                                Predicate<String> stopWhen) {
        StringBuilder text = new StringBuilder();
        try (Stream<AgentMessage> stream = provider.executeQuery(query)) {
            Iterator<AgentMessage> it = stream.iterator();
            while (it.hasNext()) {
                if (query.cancellation() != null) {
                    query.cancellation().throwIfCancelled();
                }
                AgentMessage message = it.next();
                listener.onRaw(message);
                switch (message.type()) {
                    case TEXT -> {
                        String chunk = message.text() != null ? message.text() : "";
                        checkAuthFailure(chunk);
                        text.append(chunk);
                        listener.onText(chunk);
                        if (stopWhen != null && stopWhen.test(text.toString())) {
                            return text.toString();
                        }
                    }
                    case TOOL_USE -> listener.onToolUse(message.toolName(), message.toolInput());
                    case ERROR -> throw new AgentExecutionException(
                            message.text() != null ? message.text() : "Unknown agent error");
                    case RESULT -> {
                        // stream finished
                    }
                }
            }
        }
        if (query.cancellation() != null) {
            query.cancellation().throwIfCancelled();
        }
        return text.toString();
    }

    public static String stream(AgentProvider provider, AgentQuery query, Listener listener) {
        return stream(provider, query, listener, null);
    }

    static void checkAuthFailure(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : AUTH_FAILURE_PHRASES) {
            if (lower.contains(phrase)) {
                throw new AgentExecutionException("Authentication failed: the agent backend rejected the "
                        + "configured credentials. Check your API key configuration.");
            }
        }
    }
}
