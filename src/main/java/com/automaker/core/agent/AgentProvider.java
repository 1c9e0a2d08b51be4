package com.automaker.core.agent;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Backend that runs an AI coding agent and streams its output.
 * <p>
 * Implementations must honour {@link AgentQuery#cancellation()} between stream elements.
 */
public interface AgentProvider {

    /** Provider name reported in running-agent listings. */
    String name();

    /**
     * Starts a query. The returned stream is lazy and must be closed by the caller.
     */
    Stream<AgentMessage> executeQuery(AgentQuery query);

    /** Whether this provider serves the given model. */
    default boolean supportsModel(String model) {
        return true;
    }

    /**
     * Runs a one-shot query and returns the concatenated text, ignoring tool events.
     */
    default String simpleQuery(AgentQuery query) {
        try (Stream<AgentMessage> stream = executeQuery(query)) {
            return stream
                    .filter(m -> m.type() == AgentMessage.Type.TEXT)
                    .map(AgentMessage::text)
                    .collect(Collectors.joining());
        }
    }
}
