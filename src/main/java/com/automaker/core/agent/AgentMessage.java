package com.automaker.core.agent;

import java.util.Map;

/**
 * One event from an agent provider's stream.
 *
 * @param type      the kind of event
 * @param text      assistant text, error text or final result text
 * @param toolName  tool name for {@link Type#TOOL_USE}
 * @param toolInput tool arguments for {@link Type#TOOL_USE}
 */
public record AgentMessage(
    Type type,
    String text,
    String toolName,
    Map<String, Object> toolInput
) {

    public enum Type {
        TEXT,
        TOOL_USE,
        ERROR,
        RESULT
    }

    public static AgentMessage text(String text) {
        return new AgentMessage(Type.TEXT, text, null, Map.of());
    }

    public static AgentMessage toolUse(String toolName, Map<String, Object> input) {
        return new AgentMessage(Type.TOOL_USE, null, toolName, input != null ? input : Map.of());
    }

    public static AgentMessage error(String error) {
        return new AgentMessage(Type.ERROR, error, null, Map.of());
    }

    public static AgentMessage result(String result) {
        return new AgentMessage(Type.RESULT, result, null, Map.of());
    }
}
