package com.foreman.core.lifecycle;

/**
 * Wraps a checked exception thrown by an {@link AgentInitializer}.
 */
public class AgentInitializationException extends RuntimeException {

    public AgentInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
