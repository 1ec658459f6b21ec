package com.foreman.core.state;

/**
 * Thrown when a rollback target cannot be resolved or applied. No part of the rollback is persisted.
 */
public class StateRollbackException extends ProjectStateException {

    public StateRollbackException(String message) {
        super(message);
    }

    public StateRollbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
