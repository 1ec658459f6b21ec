package com.foreman.core.lifecycle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AgentLifecycleManager}.
 */
class AgentLifecycleManagerTest {

    private record Notification(String agentId, AgentLifecycleState state, Map<String, Object> payload) {}

    private List<Notification> notifications;
    private AgentLifecycleManager manager;

    @BeforeEach
    void setUp() {
        notifications = new ArrayList<>();
        manager = new AgentLifecycleManager(
                (agentId, state, payload) -> notifications.add(new Notification(agentId, state, payload)),
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    /** Drives a fresh agent into {@code target} along legal transitions. */
    private void driveTo(String agentId, AgentLifecycleState target) {
        switch (target) {
            case INITIALIZING -> assertThrows(IllegalStateException.class,
                    () -> manager.startAgent(agentId, () -> { throw new IllegalStateException("boom"); }, null));
            case READY -> manager.startAgent(agentId);
            case ACTIVE -> {
                manager.startAgent(agentId);
                manager.resumeAgent(agentId);
            }
            case PAUSED -> {
                driveTo(agentId, AgentLifecycleState.ACTIVE);
                manager.pauseAgent(agentId, "waiting");
            }
            case STOPPED -> {
                manager.startAgent(agentId);
                manager.stopAgent(agentId);
            }
            case CLEANED_UP -> {
                driveTo(agentId, AgentLifecycleState.STOPPED);
                manager.cleanupAgent(agentId);
            }
        }
        assertEquals(target, manager.getAgentStatus(agentId).state());
    }

    private static final Map<String, Set<AgentLifecycleState>> LEGAL_SOURCES = Map.of(
            "start", EnumSet.of(AgentLifecycleState.STOPPED, AgentLifecycleState.CLEANED_UP,
                    AgentLifecycleState.INITIALIZING),
            "resume", EnumSet.of(AgentLifecycleState.READY, AgentLifecycleState.PAUSED),
            "pause", EnumSet.of(AgentLifecycleState.ACTIVE),
            "stop", EnumSet.of(AgentLifecycleState.READY, AgentLifecycleState.ACTIVE, AgentLifecycleState.PAUSED),
            "cleanup", EnumSet.of(AgentLifecycleState.STOPPED));

    private static final Map<String, AgentLifecycleState> TARGETS = Map.of(
            "start", AgentLifecycleState.READY,
            "resume", AgentLifecycleState.ACTIVE,
            "pause", AgentLifecycleState.PAUSED,
            "stop", AgentLifecycleState.STOPPED,
            "cleanup", AgentLifecycleState.CLEANED_UP);

    private Consumer<String> operation(String name) {
        return switch (name) {
            case "start" -> manager::startAgent;
            case "resume" -> manager::resumeAgent;
            case "pause" -> id -> manager.pauseAgent(id, "reason");
            case "stop" -> manager::stopAgent;
            case "cleanup" -> manager::cleanupAgent;
            default -> throw new IllegalArgumentException(name);
        };
    }

    // -- Transition table -------------------------------------------------------

    @Nested
    @DisplayName("transition table")
    class TransitionTableTests {

        @ParameterizedTest(name = "from {0}")
        @EnumSource(AgentLifecycleState.class)
        @DisplayName("every operation succeeds exactly from its legal source states")
        void everyStateOperationPair(AgentLifecycleState source) {
            for (String op : LEGAL_SOURCES.keySet()) {
                String agentId = "agent-" + source + "-" + op;
                driveTo(agentId, source);
                var before = manager.getAgentStatus(agentId);

                if (LEGAL_SOURCES.get(op).contains(source)) {
                    operation(op).accept(agentId);
                    assertEquals(TARGETS.get(op), manager.getAgentStatus(agentId).state(),
                            op + " from " + source);
                } else {
                    var ex = assertThrows(LifecycleStateException.class, () -> operation(op).accept(agentId),
                            op + " from " + source + " should be rejected");
                    assertEquals(source, ex.getCurrentState());
                    assertTrue(ex.getMessage().contains(source.name()), ex.getMessage());
                    assertEquals(before, manager.getAgentStatus(agentId), "state must be unchanged");
                }
            }
        }

        @Test
        @DisplayName("operations on unknown agents are rejected")
        void unknownAgent() {
            var ex = assertThrows(LifecycleStateException.class, () -> manager.resumeAgent("ghost"));
            assertEquals("ghost", ex.getAgentId());
            assertNull(ex.getCurrentState());
            assertThrows(LifecycleStateException.class, () -> manager.getAgentStatus("ghost"));
            assertThrows(LifecycleStateException.class, () -> manager.stopAgent("ghost"));
            assertThrows(LifecycleStateException.class, () -> manager.cleanupAgent("ghost"));
            assertThrows(LifecycleStateException.class, () -> manager.updateResourceUsage("ghost", 1.0, null, null));
        }

        @Test
        @DisplayName("pause requires a reason")
        void pauseRequiresReason() {
            driveTo("A1", AgentLifecycleState.ACTIVE);

            assertThrows(IllegalArgumentException.class, () -> manager.pauseAgent("A1", " "));
            assertEquals(AgentLifecycleState.ACTIVE, manager.getAgentStatus("A1").state());
        }

        @Test
        @DisplayName("blank agent id is rejected on start")
        void blankAgentId() {
            assertThrows(IllegalArgumentException.class, () -> manager.startAgent(""));
            assertTrue(manager.getRegisteredAgentIds().isEmpty());
        }
    }

    // -- Scenario ---------------------------------------------------------------

    @Test
    @DisplayName("A1 goes start, resume, pause, stop, cleanup")
    void fullLifecycleScenario() {
        assertEquals(AgentLifecycleState.READY, manager.startAgent("A1"));
        assertEquals(AgentLifecycleState.ACTIVE, manager.resumeAgent("A1", Map.of("task_id", "t1")));
        assertEquals("t1", manager.getAgentStatus("A1").lastKnownTaskId());

        assertEquals(AgentLifecycleState.PAUSED, manager.pauseAgent("A1", "gate-42"));
        assertEquals("gate-42", manager.getAgentStatus("A1").pauseReason());

        manager.updateResourceUsage("A1", 512.0, Set.of("/tmp/a.log"), Set.of("db-1"));

        assertEquals(AgentLifecycleState.STOPPED, manager.stopAgent("A1"));
        var stopped = manager.getAgentStatus("A1");
        assertNull(stopped.lastKnownTaskId());
        assertEquals(512.0, stopped.resources().memoryMb());

        assertEquals(AgentLifecycleState.CLEANED_UP, manager.cleanupAgent("A1"));
        var cleaned = manager.getAgentStatus("A1");
        assertEquals(0.0, cleaned.resources().memoryMb());
        assertTrue(cleaned.resources().openFileHandles().isEmpty());
        assertTrue(cleaned.resources().databaseConnections().isEmpty());
        assertTrue(cleaned.resources().isReleased());

        var states = notifications.stream().map(Notification::state).toList();
        assertEquals(List.of(
                AgentLifecycleState.INITIALIZING,
                AgentLifecycleState.READY,
                AgentLifecycleState.ACTIVE,
                AgentLifecycleState.PAUSED,
                AgentLifecycleState.PAUSED,
                AgentLifecycleState.STOPPED,
                AgentLifecycleState.CLEANED_UP), states);
    }

    // -- Pause, gate and resume -------------------------------------------------

    @Nested
    @DisplayName("pause metadata")
    class PauseTests {

        @Test
        @DisplayName("pause records reason and gate; resume clears them")
        void resumeClearsPauseMetadata() {
            driveTo("A1", AgentLifecycleState.ACTIVE);

            manager.pauseAgent("A1", "needs approval", "gate-7");
            var paused = manager.getAgentStatus("A1");
            assertEquals("needs approval", paused.pauseReason());
            assertEquals("gate-7", paused.pauseGateId());

            manager.resumeAgent("A1");
            var resumed = manager.getAgentStatus("A1");
            assertNull(resumed.pauseReason());
            assertNull(resumed.pauseGateId());
        }

        @Test
        @DisplayName("attachGate only while paused")
        void attachGateOnlyWhilePaused() {
            driveTo("A1", AgentLifecycleState.ACTIVE);
            assertThrows(LifecycleStateException.class, () -> manager.attachGate("A1", "gate-1"));

            manager.pauseAgent("A1", "risky change");
            manager.attachGate("A1", "gate-1");

            assertEquals("gate-1", manager.getAgentStatus("A1").pauseGateId());
            assertEquals("gate-1", notifications.get(notifications.size() - 1).payload().get("gate_id"));
        }

        @Test
        @DisplayName("stop records reason in metadata; cleanup removes it")
        void stopReason() {
            driveTo("A1", AgentLifecycleState.READY);

            manager.stopAgent("A1", "scaled down");
            assertEquals("scaled down", manager.getAgentStatus("A1").metadata().get("stop_reason"));

            manager.cleanupAgent("A1");
            assertFalse(manager.getAgentStatus("A1").metadata().containsKey("stop_reason"));
        }
    }

    // -- Initializer ------------------------------------------------------------

    @Nested
    @DisplayName("initializer")
    class InitializerTests {

        /** Runs a start, treating a refused start as a normal outcome of the race. */
        private AgentLifecycleState startQuietly(Supplier<AgentLifecycleState> start) {
            try {
                return start.get();
            } catch (LifecycleStateException e) {
                return null;
            }
        }

        @Test
        @DisplayName("runs before READY")
        void runsBeforeReady() {
            List<AgentLifecycleState> seen = new ArrayList<>();
            manager.startAgent("A1", () -> seen.add(manager.getAgentStatus("A1").state()), Map.of("pool", "x"));

            assertEquals(List.of(AgentLifecycleState.INITIALIZING), seen);
            var status = manager.getAgentStatus("A1");
            assertEquals(AgentLifecycleState.READY, status.state());
            assertEquals("x", status.metadata().get("pool"));
        }

        @Test
        @DisplayName("failure propagates, leaves INITIALIZING, and a retry succeeds")
        void failureThenRetry() {
            var ex = assertThrows(IllegalStateException.class,
                    () -> manager.startAgent("A1", () -> { throw new IllegalStateException("no sandbox"); }, null));
            assertEquals("no sandbox", ex.getMessage());
            assertEquals(AgentLifecycleState.INITIALIZING, manager.getAgentStatus("A1").state());
            assertThrows(LifecycleStateException.class, () -> manager.resumeAgent("A1"));

            assertEquals(AgentLifecycleState.READY, manager.startAgent("A1"));
        }

        @Test
        @DisplayName("a second start is refused while an initializer is still running")
        void secondStartRefusedDuringInitializer() throws Exception {
            var entered = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            ExecutorService starter = Executors.newSingleThreadExecutor();
            try {
                Future<AgentLifecycleState> start = starter.submit(() -> manager.startAgent("A1", () -> {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                }, null));
                assertTrue(entered.await(5, TimeUnit.SECONDS));

                assertThrows(LifecycleStateException.class, () -> manager.startAgent("A1"));
                assertThrows(LifecycleStateException.class, () -> manager.resumeAgent("A1"));
                assertEquals(AgentLifecycleState.INITIALIZING, manager.getAgentStatus("A1").state());

                release.countDown();
                assertEquals(AgentLifecycleState.READY, start.get(5, TimeUnit.SECONDS));
            } finally {
                release.countDown();
                starter.shutdownNow();
            }
        }

        @Test
        @DisplayName("racing a plain start against an initializer start never exposes READY to the initializer")
        void racingStartsNeverReadyDuringInitializer() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(2);
            AtomicInteger readyInsideInitializer = new AtomicInteger();
            try {
                for (int trial = 0; trial < 500; trial++) {
                    String agentId = "A" + trial;
                    var go = new CountDownLatch(1);
                    Future<?> plain = pool.submit(() -> {
                        go.await();
                        return startQuietly(() -> manager.startAgent(agentId));
                    });
                    Future<?> withInit = pool.submit(() -> {
                        go.await();
                        return startQuietly(() -> manager.startAgent(agentId, () -> {
                            if (manager.getAgentStatus(agentId).state() != AgentLifecycleState.INITIALIZING) {
                                readyInsideInitializer.incrementAndGet();
                            }
                            Thread.yield();
                            if (manager.getAgentStatus(agentId).state() != AgentLifecycleState.INITIALIZING) {
                                readyInsideInitializer.incrementAndGet();
                            }
                        }, null));
                    });
                    go.countDown();
                    plain.get(5, TimeUnit.SECONDS);
                    withInit.get(5, TimeUnit.SECONDS);

                    assertEquals(AgentLifecycleState.READY, manager.getAgentStatus(agentId).state());
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(0, readyInsideInitializer.get());
        }

        @Test
        @DisplayName("checked failures are wrapped")
        void checkedFailureWrapped() {
            var ex = assertThrows(AgentInitializationException.class,
                    () -> manager.startAgent("A1", () -> { throw new IOException("disk"); }, null));
            assertInstanceOf(IOException.class, ex.getCause());
        }
    }

    // -- Callbacks and snapshots ------------------------------------------------

    @Nested
    @DisplayName("callbacks and snapshots")
    class CallbackTests {

        @Test
        @DisplayName("a throwing callback never breaks transitions")
        void throwingCallbackIsIsolated() {
            AtomicInteger calls = new AtomicInteger();
            var isolated = new AgentLifecycleManager((agentId, state, payload) -> {
                calls.incrementAndGet();
                throw new RuntimeException("observer failure");
            });

            assertEquals(AgentLifecycleState.READY, isolated.startAgent("A1"));
            assertEquals(AgentLifecycleState.ACTIVE, isolated.resumeAgent("A1"));
            assertEquals(AgentLifecycleState.STOPPED, isolated.stopAgent("A1"));
            assertEquals(4, calls.get());
        }

        @Test
        @DisplayName("callback can be replaced and removed")
        void setStatusCallback() {
            List<AgentLifecycleState> other = new ArrayList<>();
            manager.setStatusCallback((agentId, state, payload) -> other.add(state));
            manager.startAgent("A1");
            manager.setStatusCallback(null);
            manager.resumeAgent("A1");

            assertTrue(notifications.isEmpty());
            assertEquals(List.of(AgentLifecycleState.INITIALIZING, AgentLifecycleState.READY), other);
        }

        @Test
        @DisplayName("resource updates notify with current state and usage")
        void resourceUpdateNotifies() {
            driveTo("A1", AgentLifecycleState.ACTIVE);
            notifications.clear();

            manager.updateResourceUsage("A1", 128.0, null, Set.of("conn-1"));

            assertEquals(1, notifications.size());
            assertEquals(AgentLifecycleState.ACTIVE, notifications.get(0).state());
            @SuppressWarnings("unchecked")
            var usage = (Map<String, Object>) notifications.get(0).payload().get("resources");
            assertEquals(128.0, usage.get("memory_mb"));
            assertEquals(List.of("conn-1"), usage.get("database_connections"));
        }

        @Test
        @DisplayName("snapshots are immutable and detached from the manager")
        void snapshotImmutability() {
            manager.startAgent("A1", null, new HashMap<>(Map.of("team", "blue")));
            manager.updateResourceUsage("A1", 64.0, Set.of("h1"), Set.of("c1"));

            var snapshot = manager.getAgentStatus("A1");
            assertThrows(UnsupportedOperationException.class, () -> snapshot.metadata().put("team", "red"));
            assertThrows(UnsupportedOperationException.class, () -> snapshot.resources().openFileHandles().add("h2"));
            assertThrows(UnsupportedOperationException.class,
                    () -> snapshot.resources().databaseConnections().clear());

            manager.updateResourceUsage("A1", 1.0, Set.of(), Set.of());

            assertEquals(64.0, snapshot.resources().memoryMb());
            assertEquals(Set.of("h1"), snapshot.resources().openFileHandles());
            assertEquals("blue", manager.getAgentStatus("A1").metadata().get("team"));
        }

        @Test
        @DisplayName("nested metadata is copied on start and read-only in snapshots")
        @SuppressWarnings("unchecked")
        void nestedMetadataDetached() {
            Map<String, Object> labels = new HashMap<>(Map.of("tier", "gold"));
            List<String> skills = new ArrayList<>(List.of("java"));
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("labels", labels);
            metadata.put("skills", skills);
            metadata.put("owner", null);
            manager.startAgent("A1", null, metadata);

            labels.put("tier", "bronze");
            skills.add("go");

            var snapshot = manager.getAgentStatus("A1");
            var snapshotLabels = (Map<String, Object>) snapshot.metadata().get("labels");
            assertEquals(Map.of("tier", "gold"), snapshotLabels);
            assertEquals(List.of("java"), snapshot.metadata().get("skills"));
            assertTrue(snapshot.metadata().containsKey("owner"));
            assertThrows(UnsupportedOperationException.class, () -> snapshotLabels.put("tier", "silver"));
            assertThrows(UnsupportedOperationException.class,
                    () -> ((List<String>) snapshot.metadata().get("skills")).add("rust"));
        }

        @Test
        @DisplayName("lists registered agents in id order")
        void registeredAgents() {
            manager.registerAgent("b", Map.of());
            manager.registerAgent("a", null);

            assertEquals(List.of("a", "b"), manager.getRegisteredAgentIds());
            assertEquals(AgentLifecycleState.READY, manager.getAgentStatus("a").state());
        }
    }
}
