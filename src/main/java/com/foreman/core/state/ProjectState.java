package com.foreman.core.state;

import com.foreman.core.util.Immutables;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The durable state of one project, as read from the {@code project_state} row.
 * <p>
 * Lists and metadata are unmodifiable copies, nested metadata maps and lists included.
 * Timestamps are UTC and truncated to microseconds.
 */
public record ProjectState(
    String projectId,
    String currentPhase,
    String activeTaskId,
    String activeAgentId,
    List<String> completedTasks,
    List<String> pendingTasks,
    Map<String, Object> metadata,
    ProjectStatus status,
    String lastAction,
    Instant createdAt,
    Instant lastUpdated
) {

    public ProjectState {
        completedTasks = completedTasks == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(completedTasks));
        pendingTasks = pendingTasks == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(pendingTasks));
        metadata = Immutables.deepCopy(metadata);
        status = status == null ? ProjectStatus.ACTIVE : status;
    }

    /**
     * Renders the state as a JSON-ready document with snake_case keys and ISO-8601 timestamps.
     * This is the shape stored in transaction {@code previous_state} and snapshot {@code state} columns.
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("project_id", projectId);
        doc.put("current_phase", currentPhase);
        doc.put("active_task_id", activeTaskId);
        doc.put("active_agent_id", activeAgentId);
        doc.put("completed_tasks", new ArrayList<>(completedTasks));
        doc.put("pending_tasks", new ArrayList<>(pendingTasks));
        doc.put("metadata", new LinkedHashMap<>(metadata));
        doc.put("status", status.value());
        doc.put("last_action", lastAction);
        doc.put("created_at", createdAt != null ? createdAt.toString() : null);
        doc.put("last_updated", lastUpdated != null ? lastUpdated.toString() : null);
        return doc;
    }
}
