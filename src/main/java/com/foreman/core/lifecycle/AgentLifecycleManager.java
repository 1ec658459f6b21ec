package com.foreman.core.lifecycle;

import com.foreman.core.util.Immutables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks every agent instance through its lifecycle state machine and records its resource usage.
 * <p>
 * Legal transitions:
 * <pre>
 * start    (unregistered), STOPPED, CLEANED_UP  -> INITIALIZING -> READY
 * resume   READY, PAUSED                        -> ACTIVE
 * pause    ACTIVE                               -> PAUSED
 * stop     READY, ACTIVE, PAUSED                -> STOPPED
 * cleanup  STOPPED                              -> CLEANED_UP
 * </pre>
 * Anything else raises {@link LifecycleStateException} and leaves the record untouched.
 * <p>
 * All operations run under one reentrant lock. Status callbacks are invoked while the lock is
 * held, so they observe transitions in order and may safely read back through
 * {@link #getAgentStatus(String)}. A failing callback is logged and never affects the transition.
 */
public class AgentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycleManager.class);

    private static final Set<AgentLifecycleState> STARTABLE =
            EnumSet.of(AgentLifecycleState.STOPPED, AgentLifecycleState.CLEANED_UP);
    private static final Set<AgentLifecycleState> RESUMABLE =
            EnumSet.of(AgentLifecycleState.READY, AgentLifecycleState.PAUSED);
    private static final Set<AgentLifecycleState> STOPPABLE =
            EnumSet.of(AgentLifecycleState.READY, AgentLifecycleState.ACTIVE, AgentLifecycleState.PAUSED);

    private final Map<String, AgentLifecycleRecord> records = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private volatile AgentStatusCallback statusCallback;

    public AgentLifecycleManager() {
        this(null);
    }

    public AgentLifecycleManager(AgentStatusCallback statusCallback) {
        this(statusCallback, Clock.systemUTC());
    }

    public AgentLifecycleManager(AgentStatusCallback statusCallback, Clock clock) {
        this.statusCallback = statusCallback;
        this.clock = clock;
    }

    public void setStatusCallback(AgentStatusCallback callback) {
        lock.lock();
        try {
            this.statusCallback = callback;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers an agent and brings it to READY without an initializer.
     */
    public AgentLifecycleState registerAgent(String agentId, Map<String, Object> metadata) {
        return startAgent(agentId, null, metadata);
    }

    public AgentLifecycleState startAgent(String agentId) {
        return startAgent(agentId, null, null);
    }

    /**
     * Starts (or restarts) an agent. Without an initializer both transitions happen under one
     * lock hold. With one, the initializer runs outside the lock between INITIALIZING and READY;
     * no other start can begin until it returns. If it fails the agent stays INITIALIZING and the
     * failure propagates; calling {@code startAgent} again retries.
     *
     * @param initializer optional setup hook
     * @param metadata    optional metadata merged into the record
     * @return READY
     * @throws LifecycleStateException if the agent is registered and not startable
     */
    public AgentLifecycleState startAgent(String agentId, AgentInitializer initializer, Map<String, Object> metadata) {
        requireAgentId(agentId);
        Map<String, Object> metadataPayload = Immutables.deepCopy(metadata);

        long startToken;
        lock.lock();
        try {
            AgentLifecycleRecord record = records.get(agentId);
            if (record != null && !canStart(record)) {
                throw invalid(record, "start");
            }
            if (record == null) {
                record = new AgentLifecycleRecord(agentId, AgentLifecycleState.INITIALIZING, now());
                records.put(agentId, record);
                log.info("Agent {} registered: {}", agentId, AgentLifecycleState.INITIALIZING);
            } else {
                transition(record, AgentLifecycleState.INITIALIZING);
            }
            if (metadata != null) {
                record.metadata.putAll(metadataPayload);
            }
            startToken = ++record.startToken;
            record.initializerRunning = initializer != null;
            notifyStatus(agentId, AgentLifecycleState.INITIALIZING, Map.of("metadata", metadataPayload));

            if (initializer == null) {
                return completeStart(record, metadataPayload);
            }
        } finally {
            lock.unlock();
        }

        runInitializer(agentId, initializer, startToken);

        lock.lock();
        try {
            AgentLifecycleRecord record = records.get(agentId);
            if (record.startToken != startToken || record.state != AgentLifecycleState.INITIALIZING) {
                throw new LifecycleStateException(agentId, record.state,
                        "Agent " + agentId + " was changed by another caller while initializing");
            }
            record.initializerRunning = false;
            return completeStart(record, metadataPayload);
        } finally {
            lock.unlock();
        }
    }

    /** INITIALIZING -> READY. Caller holds the lock. */
    private AgentLifecycleState completeStart(AgentLifecycleRecord record, Map<String, Object> metadataPayload) {
        transition(record, AgentLifecycleState.READY);
        notifyStatus(record.agentId, AgentLifecycleState.READY, Map.of("metadata", metadataPayload));
        return record.state;
    }

    /**
     * Moves a READY or PAUSED agent to ACTIVE. Pause metadata is cleared; a {@code task_id}
     * entry in {@code metadata} becomes the agent's last known task.
     */
    public AgentLifecycleState resumeAgent(String agentId, Map<String, Object> metadata) {
        lock.lock();
        try {
            AgentLifecycleRecord record = requireRecord(agentId);
            if (!RESUMABLE.contains(record.state)) {
                throw invalid(record, "resume");
            }

            record.pauseReason = null;
            record.pauseGateId = null;
            if (metadata != null) {
                record.metadata.putAll(Immutables.deepCopy(metadata));
                Object taskId = metadata.get("task_id");
                if (taskId != null) {
                    record.lastKnownTaskId = taskId.toString();
                }
            }
            transition(record, AgentLifecycleState.ACTIVE);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("metadata", Immutables.deepCopy(metadata));
            payload.put("task_id", record.lastKnownTaskId);
            notifyStatus(agentId, AgentLifecycleState.ACTIVE, payload);
            return record.state;
        } finally {
            lock.unlock();
        }
    }

    public AgentLifecycleState resumeAgent(String agentId) {
        return resumeAgent(agentId, null);
    }

    /**
     * Pauses an ACTIVE agent.
     *
     * @param reason why the agent was paused; required
     * @param gateId optional reference to an external approval gate
     */
    public AgentLifecycleState pauseAgent(String agentId, String reason, String gateId) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A pause reason is required");
        }
        lock.lock();
        try {
            AgentLifecycleRecord record = requireRecord(agentId);
            if (record.state != AgentLifecycleState.ACTIVE) {
                throw invalid(record, "pause");
            }

            record.pauseReason = reason;
            record.pauseGateId = gateId;
            transition(record, AgentLifecycleState.PAUSED);

            notifyStatus(agentId, AgentLifecycleState.PAUSED, pausePayload(record));
            return record.state;
        } finally {
            lock.unlock();
        }
    }

    public AgentLifecycleState pauseAgent(String agentId, String reason) {
        return pauseAgent(agentId, reason, null);
    }

    /**
     * Stops a READY, ACTIVE or PAUSED agent and forgets its active task. Resources stay
     * tracked until {@link #cleanupAgent(String)}.
     */
    public AgentLifecycleState stopAgent(String agentId, String reason) {
        lock.lock();
        try {
            AgentLifecycleRecord record = requireRecord(agentId);
            if (!STOPPABLE.contains(record.state)) {
                throw invalid(record, "stop");
            }

            record.metadata.put("stop_reason", reason);
            record.lastKnownTaskId = null;
            transition(record, AgentLifecycleState.STOPPED);

            notifyStatus(agentId, AgentLifecycleState.STOPPED, Map.of("stop_reason", reason != null ? reason : ""));
            return record.state;
        } finally {
            lock.unlock();
        }
    }

    public AgentLifecycleState stopAgent(String agentId) {
        return stopAgent(agentId, null);
    }

    /**
     * Releases the resources tracked for a STOPPED agent and marks it CLEANED_UP.
     */
    public AgentLifecycleState cleanupAgent(String agentId) {
        lock.lock();
        try {
            AgentLifecycleRecord record = requireRecord(agentId);
            if (record.state != AgentLifecycleState.STOPPED) {
                throw invalid(record, "cleanup");
            }

            record.resetResources();
            record.metadata.remove("stop_reason");
            transition(record, AgentLifecycleState.CLEANED_UP);

            notifyStatus(agentId, AgentLifecycleState.CLEANED_UP, Map.of());
            return record.state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrites tracked resource usage. Legal in any state; null arguments leave that resource as is.
     *
     * @return a copy of the resulting resource usage
     */
    public AgentResources updateResourceUsage(String agentId, Double memoryMb,
                                              Set<String> openFileHandles, Set<String> databaseConnections) {
        lock.lock();
        try {
            AgentLifecycleRecord record = requireRecord(agentId);
            if (memoryMb != null) {
                record.memoryMb = memoryMb;
            }
            if (openFileHandles != null) {
                record.openFileHandles = new HashSet<>(openFileHandles);
            }
            if (databaseConnections != null) {
                record.databaseConnections = new HashSet<>(databaseConnections);
            }

            AgentResources resources = record.resources();
            Map<String, Object> usage = new LinkedHashMap<>();
            usage.put("memory_mb", resources.memoryMb());
            usage.put("open_file_handles", new ArrayList<>(resources.openFileHandles()));
            usage.put("database_connections", new ArrayList<>(resources.databaseConnections()));
            notifyStatus(agentId, record.state, Map.of("resources", usage));
            return resources;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Associates an approval gate with a PAUSED agent.
     */
    public void attachGate(String agentId, String gateId) {
        lock.lock();
        try {
            AgentLifecycleRecord record = requireRecord(agentId);
            if (record.state != AgentLifecycleState.PAUSED) {
                throw new LifecycleStateException(agentId, record.state,
                        "Agent " + agentId + " is not paused (state " + record.state + "); cannot attach gate");
            }
            record.pauseGateId = gateId;
            notifyStatus(agentId, AgentLifecycleState.PAUSED, pausePayload(record));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return an immutable snapshot of the agent's record
     * @throws LifecycleStateException if the agent is not registered
     */
    public AgentLifecycleSnapshot getAgentStatus(String agentId) {
        lock.lock();
        try {
            return requireRecord(agentId).snapshot();
        } finally {
            lock.unlock();
        }
    }

    public List<String> getRegisteredAgentIds() {
        lock.lock();
        try {
            return records.keySet().stream().sorted().toList();
        } finally {
            lock.unlock();
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private boolean canStart(AgentLifecycleRecord record) {
        if (STARTABLE.contains(record.state)) {
            return true;
        }
        // a failed initializer leaves the agent INITIALIZING; a new start retries it
        return record.state == AgentLifecycleState.INITIALIZING && !record.initializerRunning;
    }

    /** Runs outside the lock. On failure the start is released so a new start may retry. */
    private void runInitializer(String agentId, AgentInitializer initializer, long startToken) {
        boolean succeeded = false;
        try {
            initializer.initialize();
            succeeded = true;
        } catch (RuntimeException e) {
            log.error("Agent {} initializer failed", agentId, e);
            throw e;
        } catch (Exception e) {
            log.error("Agent {} initializer failed", agentId, e);
            throw new AgentInitializationException("Initializer failed for agent " + agentId, e);
        } finally {
            if (!succeeded) {
                releaseFailedStart(agentId, startToken);
            }
        }
    }

    private void releaseFailedStart(String agentId, long startToken) {
        lock.lock();
        try {
            AgentLifecycleRecord record = records.get(agentId);
            if (record.startToken == startToken) {
                record.initializerRunning = false;
            }
        } finally {
            lock.unlock();
        }
    }

    private void transition(AgentLifecycleRecord record, AgentLifecycleState target) {
        AgentLifecycleState previous = record.state;
        record.state = target;
        record.lastTransitionAt = now();
        log.info("Agent {}: {} -> {}", record.agentId, previous, target);
    }

    private Map<String, Object> pausePayload(AgentLifecycleRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pause_reason", record.pauseReason);
        payload.put("gate_id", record.pauseGateId);
        return payload;
    }

    private AgentLifecycleRecord requireRecord(String agentId) {
        AgentLifecycleRecord record = records.get(agentId);
        if (record == null) {
            throw new LifecycleStateException(agentId, null, "Agent " + agentId + " is not registered");
        }
        return record;
    }

    private static void requireAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Agent id must not be blank");
        }
    }

    private static LifecycleStateException invalid(AgentLifecycleRecord record, String operation) {
        return new LifecycleStateException(record.agentId, record.state,
                "Agent " + record.agentId + " cannot " + operation + " from state " + record.state);
    }

    private Instant now() {
        return clock.instant();
    }

    private void notifyStatus(String agentId, AgentLifecycleState state, Map<String, Object> payload) {
        AgentStatusCallback callback = statusCallback;
        if (callback == null) {
            return;
        }
        try {
            callback.onStatusChange(agentId, state, payload);
        } catch (Exception e) {
            log.warn("Lifecycle status callback failed for agent {} ({}): {}",
                    agentId, state, e.getMessage(), e);
        }
    }
}
