package com.foreman.core.lifecycle;

import java.util.Map;

/**
 * Observer notified after every lifecycle transition and resource update.
 * Implementations may throw; the manager logs and swallows the failure.
 */
@FunctionalInterface
public interface AgentStatusCallback {

    void onStatusChange(String agentId, AgentLifecycleState state, Map<String, Object> payload);
}
