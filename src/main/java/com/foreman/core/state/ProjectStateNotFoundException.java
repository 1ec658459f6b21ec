package com.foreman.core.state;

public class ProjectStateNotFoundException extends ProjectStateException {

    private final String projectId;

    public ProjectStateNotFoundException(String projectId) {
        super("Project state not found: " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
