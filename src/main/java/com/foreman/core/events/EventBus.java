package com.foreman.core.events;

import com.foreman.core.lifecycle.AgentLifecycleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for agent lifecycle events.
 * <p>
 * Listeners subscribe to one agent, to one lifecycle state across all agents (for example
 * every PAUSED transition), or to everything. Each event goes to the agent's listeners,
 * then the state's, then the global ones. A listener that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LifecycleEvent>>> byAgent =
            new ConcurrentHashMap<>();

    private final Map<AgentLifecycleState, CopyOnWriteArrayList<Consumer<LifecycleEvent>>> byState =
            new EnumMap<>(AgentLifecycleState.class);

    private final CopyOnWriteArrayList<Consumer<LifecycleEvent>> everything = new CopyOnWriteArrayList<>();

    public EventBus() {
        // filled once, only the lists change afterwards
        for (AgentLifecycleState state : AgentLifecycleState.values()) {
            byState.put(state, new CopyOnWriteArrayList<>());
        }
    }

    public void publish(LifecycleEvent event) {
        log.debug("Publishing lifecycle event: agent {} -> {}", event.agentId(), event.state());

        var agentListeners = byAgent.get(event.agentId());
        if (agentListeners != null) {
            deliverAll(agentListeners, event);
        }
        deliverAll(byState.get(event.state()), event);
        deliverAll(everything, event);
    }

    /**
     * Subscribe to every event of one agent.
     *
     * @return a handle that removes the listener again
     */
    public Subscription subscribe(String agentId, Consumer<LifecycleEvent> listener) {
        byAgent.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Subscribed to agent {}", agentId);
        return () -> byAgent.computeIfPresent(agentId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /**
     * Subscribe to transitions into {@code state}, whichever agent makes them.
     */
    public Subscription subscribe(AgentLifecycleState state, Consumer<LifecycleEvent> listener) {
        var listeners = byState.get(state);
        listeners.add(listener);
        log.debug("Subscribed to {} transitions", state);
        return () -> listeners.remove(listener);
    }

    public Subscription subscribeAll(Consumer<LifecycleEvent> listener) {
        everything.add(listener);
        log.debug("Subscribed to all lifecycle events");
        return () -> everything.remove(listener);
    }

    /** Handle for cancelling a subscription. Unsubscribing twice is harmless. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverAll(Collection<Consumer<LifecycleEvent>> listeners, LifecycleEvent event) {
        for (Consumer<LifecycleEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Listener failed on {} event for agent {}: {}",
                        event.state(), event.agentId(), e.getMessage(), e);
            }
        }
    }
}
