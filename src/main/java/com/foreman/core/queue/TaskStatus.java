package com.foreman.core.queue;

/**
 * Status of a task while it moves from submitter to queue to agent.
 */
public enum TaskStatus {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    BLOCKED
}
