package com.foreman.core.state;

/**
 * Thrown when reading or writing project state fails at the storage layer.
 * The operation's database transaction has been rolled back; nothing is retried.
 */
public class StatePersistenceException extends ProjectStateException {

    public StatePersistenceException(String message) {
        super(message);
    }

    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
