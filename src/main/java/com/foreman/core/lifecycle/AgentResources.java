package com.foreman.core.lifecycle;

import java.util.Set;

/**
 * Resource usage tracked for an agent. Instances are immutable copies.
 *
 * @param memoryMb            memory in megabytes
 * @param openFileHandles     identifiers of open file handles
 * @param databaseConnections identifiers of held database connections
 */
public record AgentResources(
    double memoryMb,
    Set<String> openFileHandles,
    Set<String> databaseConnections
) {

    public static final AgentResources NONE = new AgentResources(0.0, Set.of(), Set.of());

    public AgentResources {
        openFileHandles = openFileHandles != null ? Set.copyOf(openFileHandles) : Set.of();
        databaseConnections = databaseConnections != null ? Set.copyOf(databaseConnections) : Set.of();
    }

    public boolean isReleased() {
        return memoryMb == 0.0 && openFileHandles.isEmpty() && databaseConnections.isEmpty();
    }
}
