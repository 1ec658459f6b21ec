package com.foreman.core.state;

/**
 * Base class for every failure raised by {@link ProjectStateManager}.
 */
public class ProjectStateException extends RuntimeException {

    public ProjectStateException(String message) {
        super(message);
    }

    public ProjectStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
