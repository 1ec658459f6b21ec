package com.foreman.core.state;

import java.time.Instant;

/**
 * Thrown when an update's expected {@code lastUpdated} no longer matches the stored row.
 * Callers should re-read the state and retry.
 */
public class StateConflictException extends ProjectStateException {

    private final String projectId;
    private final Instant expected;
    private final Instant actual;

    public StateConflictException(String projectId, Instant expected, Instant actual) {
        super("Project " + projectId + " was modified concurrently (expected last update "
                + expected + ", found " + actual + ")");
        this.projectId = projectId;
        this.expected = expected;
        this.actual = actual;
    }

    public String getProjectId() {
        return projectId;
    }

    public Instant getExpected() {
        return expected;
    }

    public Instant getActual() {
        return actual;
    }
}
