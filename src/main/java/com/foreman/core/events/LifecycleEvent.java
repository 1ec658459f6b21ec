package com.foreman.core.events;

import com.foreman.core.lifecycle.AgentLifecycleState;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle notification for one agent, published after a transition or resource update.
 *
 * @param agentId   the agent the event belongs to
 * @param state     the agent's state after the change
 * @param payload   event-specific data (pause reason, gate id, resource usage, ...)
 * @param timestamp when the event was published
 */
public record LifecycleEvent(
    String agentId,
    AgentLifecycleState state,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
