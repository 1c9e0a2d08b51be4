package com.automaker.core.errors;

/**
 * Thrown when the agent stream reports an error or its output signals an authentication failure.
 */
public class AgentExecutionException extends RuntimeException {

    public AgentExecutionException(String message) {
        super(message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
