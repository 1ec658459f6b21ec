package com.foreman.core.lifecycle;

/**
 * Thrown when an operation is not legal from the agent's current state,
 * or when the agent has never been registered.
 */
public class LifecycleStateException extends RuntimeException {

    private final String agentId;
    private final AgentLifecycleState currentState;

    public LifecycleStateException(String agentId, AgentLifecycleState currentState, String message) {
        super(message);
        this.agentId = agentId;
        this.currentState = currentState;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * @return the state the agent was in, or null if the agent is not registered
     */
    public AgentLifecycleState getCurrentState() {
        return currentState;
    }
}
