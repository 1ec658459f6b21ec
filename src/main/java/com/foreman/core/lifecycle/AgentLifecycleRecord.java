package com.foreman.core.lifecycle;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable lifecycle record owned by {@link AgentLifecycleManager}. Only touched under the manager's lock.
 */
class AgentLifecycleRecord {

    final String agentId;
    AgentLifecycleState state;
    double memoryMb;
    Set<String> openFileHandles = new HashSet<>();
    Set<String> databaseConnections = new HashSet<>();
    final Map<String, Object> metadata = new LinkedHashMap<>();
    String pauseReason;
    String pauseGateId;
    Instant lastTransitionAt;
    String lastKnownTaskId;
    boolean initializerRunning;
    /** Incremented by every start; the READY step of an initializer start checks it is still current. */
    long startToken;

    AgentLifecycleRecord(String agentId, AgentLifecycleState state, Instant now) {
        this.agentId = agentId;
        this.state = state;
        this.lastTransitionAt = now;
    }

    void resetResources() {
        memoryMb = 0.0;
        openFileHandles.clear();
        databaseConnections.clear();
    }

    AgentResources resources() {
        return new AgentResources(memoryMb, openFileHandles, databaseConnections);
    }

    AgentLifecycleSnapshot snapshot() {
        return new AgentLifecycleSnapshot(agentId, state, resources(), metadata,
                pauseReason, pauseGateId, lastTransitionAt, lastKnownTaskId);
    }
}
