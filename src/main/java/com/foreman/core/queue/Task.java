package com.foreman.core.queue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work waiting for, or assigned to, an agent.
 * <p>
 * Priority is only changed through {@link TaskQueue#prioritizeTask(String, int)}
 * so that the queue ordering never goes stale. Status, assignment and result are
 * owned by the orchestrator once the task has left the queue.
 */
public class Task {

    private final String taskId;
    private final String taskType;
    private final String agentType;
    private final Map<String, Object> payload;
    private final Instant createdAt;

    private int priority;
    private TaskStatus status = TaskStatus.PENDING;
    private String assignedAgentId;
    private Map<String, Object> result;

    public Task(String taskId, String taskType, String agentType) {
        this(taskId, taskType, agentType, 0, Map.of());
    }

    public Task(String taskId, String taskType, String agentType, int priority, Map<String, Object> payload) {
        this(taskId, taskType, agentType, priority, payload, Instant.now());
    }

    public Task(String taskId, String taskType, String agentType, int priority,
                Map<String, Object> payload, Instant createdAt) {
        this.taskId = taskId;
        this.taskType = taskType;
        this.agentType = agentType;
        this.priority = priority;
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTaskType() {
        return taskType;
    }

    public String getAgentType() {
        return agentType;
    }

    public int getPriority() {
        return priority;
    }

    void setPriority(int priority) {
        this.priority = priority;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public String getAssignedAgentId() {
        return assignedAgentId;
    }

    public void setAssignedAgentId(String assignedAgentId) {
        this.assignedAgentId = assignedAgentId;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public void setResult(Map<String, Object> result) {
        this.result = result;
    }

    @Override
    public String toString() {
        return "Task[" + taskId + ", type=" + taskType + ", agent=" + agentType
                + ", priority=" + priority + ", status=" + status + "]";
    }
}
