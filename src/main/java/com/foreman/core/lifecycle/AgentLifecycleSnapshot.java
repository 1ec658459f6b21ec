package com.foreman.core.lifecycle;

import com.foreman.core.util.Immutables;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time, immutable view of an agent's lifecycle record.
 * Changing the manager afterwards never changes a snapshot, and a snapshot cannot change the manager.
 */
public record AgentLifecycleSnapshot(
    String agentId,
    AgentLifecycleState state,
    AgentResources resources,
    Map<String, Object> metadata,
    String pauseReason,
    String pauseGateId,
    Instant lastTransitionAt,
    String lastKnownTaskId
) {
    public AgentLifecycleSnapshot {
        metadata = Immutables.deepCopy(metadata);
    }
}
