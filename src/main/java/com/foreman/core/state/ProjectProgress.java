package com.foreman.core.state;

import java.time.Instant;

/**
 * Completion figures derived from the current project state.
 *
 * @param completionRatio completed / total, or 0.0 when the project has no tasks
 */
public record ProjectProgress(
    String projectId,
    int completedTasks,
    int pendingTasks,
    int totalTasks,
    double completionRatio,
    ProjectStatus status,
    Instant lastUpdated
) {

    public static ProjectProgress of(ProjectState state) {
        int completed = state.completedTasks().size();
        int pending = state.pendingTasks().size();
        int total = completed + pending;
        double ratio = total == 0 ? 0.0 : (double) completed / total;
        return new ProjectProgress(state.projectId(), completed, pending, total, ratio,
                state.status(), state.lastUpdated());
    }
}
