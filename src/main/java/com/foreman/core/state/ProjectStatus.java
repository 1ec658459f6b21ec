package com.foreman.core.state;

/**
 * Overall status of a project. Stored in lower case.
 */
public enum ProjectStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ProjectStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not a known status
     */
    public static ProjectStatus fromValue(String value) {
        for (ProjectStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown project status: " + value);
    }
}
