package com.foreman.core.lifecycle;

/**
 * Operational states of an agent instance.
 * <pre>
 * INITIALIZING -> READY -> ACTIVE <-> PAUSED -> STOPPED -> CLEANED_UP
 * </pre>
 * READY, ACTIVE and PAUSED can all be stopped; STOPPED and CLEANED_UP agents can be started again.
 */
public enum AgentLifecycleState {
    INITIALIZING,
    READY,
    ACTIVE,
    PAUSED,
    STOPPED,
    CLEANED_UP
}
