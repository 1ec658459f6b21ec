package com.foreman.core.lifecycle;

/**
 * Caller-supplied setup run by {@link AgentLifecycleManager#startAgent} before an agent becomes READY.
 */
@FunctionalInterface
public interface AgentInitializer {

    void initialize() throws Exception;
}
