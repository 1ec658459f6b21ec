package com.foreman.core.state;

import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.persistence.InMemoryStateCache;
import com.foreman.core.persistence.JsonColumns;
import com.foreman.core.persistence.ProjectStateDao;
import com.foreman.core.persistence.StateCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable, auditable project state with snapshots and rollback.
 * <p>
 * Each state-changing call runs in one database transaction: the row is read with
 * {@code SELECT ... FOR UPDATE}, the optional optimistic check is applied, the row is written
 * and an audit entry carrying the full prior row is appended before commit. Any failure rolls
 * the whole operation back.
 * <p>
 * Reads may be served from a process-local {@link StateCache}. Writes evict the entry after
 * commit and never repopulate it, so the next read goes to the database. Another process's
 * cache is not notified; use {@code expectedLastUpdated} to detect concurrent writers.
 */
public class ProjectStateManager {

    private static final Logger log = LoggerFactory.getLogger(ProjectStateManager.class);

    public static final String INITIALIZE_STATE = "initialize_state";
    public static final String UPDATE_STATE = "update_state";
    public static final String RECORD_TASK_COMPLETION = "record_task_completion";
    public static final String ROLLBACK_STATE = "rollback_state";
    public static final String CREATE_SNAPSHOT = "create_snapshot";

    private final DataSource dataSource;
    private final ProjectStateDao dao;
    private final StateCache cache;
    private final Clock clock;
    private final ForemanMetrics metrics;

    public ProjectStateManager(DataSource dataSource) {
        this(dataSource, new ProjectStateDao(new JsonColumns()), new InMemoryStateCache(), Clock.systemUTC(), null);
    }

    /**
     * @param cache   read cache, or null to always read from the database
     * @param metrics optional metrics sink
     */
    public ProjectStateManager(DataSource dataSource, ProjectStateDao dao, StateCache cache,
                               Clock clock, ForemanMetrics metrics) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.dao = Objects.requireNonNull(dao, "ProjectStateDao must not be null");
        this.cache = cache;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.metrics = metrics;
    }

    /**
     * Creates the state row for a new project and logs an {@code initialize_state} transaction
     * with no previous state.
     *
     * @throws StatePersistenceException if the project already exists or the insert fails
     */
    public ProjectState initializeState(String projectId, String currentPhase, List<String> pendingTasks,
                                        Map<String, Object> metadata, String actor) {
        requireText(projectId, "projectId");
        requireText(currentPhase, "currentPhase");
        long start = System.nanoTime();

        ProjectState created = inTransaction(projectId, INITIALIZE_STATE, conn -> {
            if (dao.findState(conn, projectId, true).isPresent()) {
                throw new StatePersistenceException("Project state already exists: " + projectId);
            }
            Instant now = now();
            ProjectState state = new ProjectState(projectId, currentPhase, null, null, List.of(),
                    pendingTasks, metadata, ProjectStatus.ACTIVE, "Initialized project state", now, now);
            dao.insertState(conn, state);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("current_phase", currentPhase);
            payload.put("pending_tasks", new ArrayList<>(state.pendingTasks()));
            payload.put("metadata", new LinkedHashMap<>(state.metadata()));
            appendTransaction(conn, projectId, INITIALIZE_STATE, payload, actor, null);
            return requireState(conn, projectId, false);
        });

        afterWrite(projectId, INITIALIZE_STATE, start);
        log.info("Initialized project {} in phase '{}' with {} pending tasks",
                projectId, currentPhase, created.pendingTasks().size());
        return created;
    }

    public ProjectState getState(String projectId) {
        return getState(projectId, true);
    }

    /**
     * @param useCache false to bypass the cache; the fresh value then replaces the cached one
     * @throws ProjectStateNotFoundException if the project has no state row
     */
    public ProjectState getState(String projectId, boolean useCache) {
        if (useCache && cache != null) {
            var cached = cache.get(projectId);
            if (metrics != null) {
                metrics.recordCacheLookup(cached.isPresent());
            }
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        long generation = cache != null ? cache.generation(projectId) : 0L;
        ProjectState state = withConnection(projectId, "read state",
                conn -> dao.findState(conn, projectId, false))
                .orElseThrow(() -> new ProjectStateNotFoundException(projectId));
        if (cache != null && !cache.putIfGeneration(state, generation)) {
            log.debug("Not caching state of project {}: a write landed during the read", projectId);
        }
        return state;
    }

    /**
     * Applies the fields set on {@code update}. An update with no fields set returns the current
     * state without writing anything.
     *
     * @throws StateConflictException        if {@code expectedLastUpdated} is stale; nothing is written
     * @throws ProjectStateNotFoundException if the project has no state row
     * @throws IllegalArgumentException      if the new pending list names an already completed task
     */
    public ProjectState updateState(String projectId, ProjectStateUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        long start = System.nanoTime();

        ProjectState result = inTransaction(projectId, UPDATE_STATE, conn -> {
            ProjectState current = requireState(conn, projectId, true);
            checkExpectedLastUpdated(current, update.expectedLastUpdated());
            if (update.isEmpty()) {
                return current;
            }

            Map<String, Object> changes = new LinkedHashMap<>();
            String phase = current.currentPhase();
            if (update.currentPhase() != null) {
                phase = update.currentPhase();
                changes.put("current_phase", phase);
            }
            String activeTaskId = current.activeTaskId();
            if (update.activeTaskId() != null) {
                activeTaskId = update.activeTaskId();
                changes.put("active_task_id", activeTaskId);
            }
            String activeAgentId = current.activeAgentId();
            if (update.activeAgentId() != null) {
                activeAgentId = update.activeAgentId();
                changes.put("active_agent_id", activeAgentId);
            }
            Map<String, Object> metadata = new LinkedHashMap<>(current.metadata());
            if (update.metadata() != null) {
                metadata.putAll(update.metadata());
                changes.put("metadata", new LinkedHashMap<>(update.metadata()));
            }
            List<String> pending = current.pendingTasks();
            if (update.pendingTasks() != null) {
                pending = update.pendingTasks();
                for (String taskId : pending) {
                    if (current.completedTasks().contains(taskId)) {
                        throw new IllegalArgumentException(
                                "Task " + taskId + " is already completed in project " + projectId);
                    }
                }
                changes.put("pending_tasks", new ArrayList<>(pending));
            }
            ProjectStatus status = current.status();
            if (update.status() != null) {
                status = update.status();
                changes.put("status", status.value());
            }
            String lastAction = current.lastAction();
            if (update.lastAction() != null) {
                lastAction = update.lastAction();
                changes.put("last_action", lastAction);
            }

            ProjectState next = new ProjectState(projectId, phase, activeTaskId, activeAgentId,
                    current.completedTasks(), pending, metadata, status, lastAction,
                    current.createdAt(), nextLastUpdated(current));
            dao.updateState(conn, next);
            appendTransaction(conn, projectId, UPDATE_STATE, changes, update.actor(), current.toDocument());
            return requireState(conn, projectId, false);
        });

        if (!update.isEmpty()) {
            afterWrite(projectId, UPDATE_STATE, start);
            log.info("Updated project {}: {}", projectId, describe(update));
        }
        return result;
    }

    /**
     * Marks a task completed: drops it from pending, appends it to completed once, merges
     * {@code resultMetadata} into {@code metadata.task_results[taskId]}, records the agent in
     * {@code metadata.task_owners[taskId]} and clears the active task and agent.
     * Completing a task twice never duplicates it.
     */
    public ProjectState recordTaskCompletion(String projectId, String taskId, String agentId,
                                             Map<String, Object> resultMetadata, String actor) {
        requireText(taskId, "taskId");
        long start = System.nanoTime();
        MdcContext.setTask(projectId, taskId, agentId);
        try {
            return completeTask(projectId, taskId, agentId, resultMetadata, actor, start);
        } finally {
            MdcContext.clearTask();
        }
    }

    private ProjectState completeTask(String projectId, String taskId, String agentId,
                                      Map<String, Object> resultMetadata, String actor, long start) {
        ProjectState result = inTransaction(projectId, RECORD_TASK_COMPLETION, conn -> {
            ProjectState current = requireState(conn, projectId, true);

            List<String> pending = new ArrayList<>(current.pendingTasks());
            pending.removeIf(taskId::equals);
            List<String> completed = new ArrayList<>(current.completedTasks());
            if (!completed.contains(taskId)) {
                completed.add(taskId);
            }

            Map<String, Object> metadata = new LinkedHashMap<>(current.metadata());
            if (resultMetadata != null && !resultMetadata.isEmpty()) {
                Map<String, Object> taskResults = JsonColumns.coerceMap(metadata.get("task_results"));
                Map<String, Object> entry = JsonColumns.coerceMap(taskResults.get(taskId));
                entry.putAll(resultMetadata);
                taskResults.put(taskId, entry);
                metadata.put("task_results", taskResults);
            }
            if (agentId != null && !agentId.isBlank()) {
                Map<String, Object> owners = JsonColumns.coerceMap(metadata.get("task_owners"));
                owners.put(taskId, agentId);
                metadata.put("task_owners", owners);
            }

            ProjectState next = new ProjectState(projectId, current.currentPhase(), null, null,
                    completed, pending, metadata, current.status(), "Completed task " + taskId,
                    current.createdAt(), nextLastUpdated(current));
            dao.updateState(conn, next);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("task_id", taskId);
            payload.put("agent_id", agentId);
            payload.put("result_metadata", resultMetadata != null ? new LinkedHashMap<>(resultMetadata) : Map.of());
            appendTransaction(conn, projectId, RECORD_TASK_COMPLETION, payload, actor, current.toDocument());
            return requireState(conn, projectId, false);
        });

        afterWrite(projectId, RECORD_TASK_COMPLETION, start);
        log.info("Recorded completion of task {} in project {} (agent {})", taskId, projectId, agentId);
        return result;
    }

    public ProjectProgress getProgress(String projectId) {
        return ProjectProgress.of(getState(projectId, true));
    }

    /**
     * Overwrites the live row with the state selected by {@code target} and logs a
     * {@code rollback_state} transaction, which can itself be rolled back.
     * <p>
     * For a timestamp the target is the state captured before the latest transaction at or
     * before that instant; transactions with equal timestamps are ordered by insertion.
     *
     * @throws StateRollbackException        if the target is missing, carries no prior state or
     *                                       cannot be applied; nothing is written
     * @throws ProjectStateNotFoundException if the project has no state row
     */
    public ProjectState rollbackState(String projectId, RollbackTarget target, String actor) {
        Objects.requireNonNull(target, "target must not be null");
        long start = System.nanoTime();

        ProjectState restored;
        try {
            restored = inTransaction(projectId, ROLLBACK_STATE, conn -> {
                ProjectState current = requireState(conn, projectId, true);
                Map<String, Object> targetState = resolveTarget(conn, projectId, target);
                ProjectState next = fromDocument(projectId, targetState, current);
                dao.updateState(conn, next);

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("transaction_id", target.transactionId());
                payload.put("snapshot_id", target.snapshotId());
                payload.put("restore_at", target.restoreAt() != null ? target.restoreAt().toString() : null);
                appendTransaction(conn, projectId, ROLLBACK_STATE, payload, actor, current.toDocument());
                return requireState(conn, projectId, false);
            });
        } catch (StatePersistenceException e) {
            recordRollback(target, false);
            throw new StateRollbackException("Rollback of project " + projectId + " to " + target
                    + " failed; no changes were applied", e);
        } catch (ProjectStateException e) {
            recordRollback(target, false);
            throw e;
        }

        afterWrite(projectId, ROLLBACK_STATE, start);
        recordRollback(target, true);
        log.info("Rolled back project {} to {}; phase is now '{}'", projectId, target, restored.currentPhase());
        return restored;
    }

    /**
     * Stores a full copy of the current state. Snapshots are independent of the transaction log.
     *
     * @return the new snapshot id
     */
    public String createSnapshot(String projectId, String takenBy, String notes) {
        long start = System.nanoTime();
        String snapshotId = inTransaction(projectId, CREATE_SNAPSHOT, conn -> {
            ProjectState current = requireState(conn, projectId, true);
            String id = newId();
            dao.insertSnapshot(conn, new StateSnapshot(id, projectId, now(), current.toDocument(), takenBy, notes));
            return id;
        });
        if (metrics != null) {
            metrics.recordStateWrite(CREATE_SNAPSHOT, elapsedMillis(start));
        }
        log.info("Created snapshot {} of project {}", snapshotId, projectId);
        return snapshotId;
    }

    /** Audit log for a project, oldest first. Empty for unknown projects. */
    public List<StateTransaction> listTransactions(String projectId) {
        return withConnection(projectId, "list transactions", conn -> dao.listTransactions(conn, projectId));
    }

    /** Snapshots of a project, oldest first. Empty for unknown projects. */
    public List<StateSnapshot> listSnapshots(String projectId) {
        return withConnection(projectId, "list snapshots", conn -> dao.listSnapshots(conn, projectId));
    }

    public void evict(String projectId) {
        if (cache != null) {
            cache.evict(projectId);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String projectId, String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, projectId, operation, e);
                throw e;
            } finally {
                restoreAutoCommit(conn, autoCommit);
            }
        } catch (SQLException e) {
            log.error("Failed to {} for project {}", operation, projectId, e);
            throw new StatePersistenceException("Failed to " + operation + " for project " + projectId, e);
        }
    }

    private <T> T withConnection(String projectId, String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            log.error("Failed to {} for project {}", operation, projectId, e);
            throw new StatePersistenceException("Failed to " + operation + " for project " + projectId, e);
        }
    }

    private static void rollback(Connection conn, String projectId, String operation, Exception failure) {
        try {
            conn.rollback();
            log.debug("Rolled back {} for project {}: {}", operation, projectId, failure.getMessage());
        } catch (SQLException e) {
            failure.addSuppressed(e);
            log.error("Rollback of {} for project {} failed", operation, projectId, e);
        }
    }

    private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit on connection: {}", e.getMessage());
        }
    }

    private ProjectState requireState(Connection conn, String projectId, boolean forUpdate) throws SQLException {
        return dao.findState(conn, projectId, forUpdate)
                .orElseThrow(() -> new ProjectStateNotFoundException(projectId));
    }

    private void checkExpectedLastUpdated(ProjectState current, Instant expected) {
        if (expected == null) {
            return;
        }
        Instant normalized = expected.truncatedTo(ChronoUnit.MICROS);
        if (!normalized.equals(current.lastUpdated())) {
            if (metrics != null) {
                metrics.recordStateConflict();
            }
            log.warn("Conflict updating project {}: expected last update {}, found {}",
                    current.projectId(), normalized, current.lastUpdated());
            throw new StateConflictException(current.projectId(), normalized, current.lastUpdated());
        }
    }

    private void appendTransaction(Connection conn, String projectId, String changeType, Map<String, Object> payload,
                                   String actor, Map<String, Object> previousState) throws SQLException {
        dao.insertTransaction(conn, new StateTransaction(newId(), projectId, now(), changeType,
                payload, actor, previousState));
    }

    private Map<String, Object> resolveTarget(Connection conn, String projectId, RollbackTarget target)
            throws SQLException {
        if (target.transactionId() != null) {
            StateTransaction tx = dao.findTransaction(conn, projectId, target.transactionId())
                    .orElseThrow(() -> new StateRollbackException("Transaction not found: " + target.transactionId()));
            return requirePreviousState(tx);
        }
        if (target.snapshotId() != null) {
            return dao.findSnapshot(conn, projectId, target.snapshotId())
                    .map(StateSnapshot::state)
                    .orElseThrow(() -> new StateRollbackException("Snapshot not found: " + target.snapshotId()));
        }
        Instant restoreAt = target.restoreAt().truncatedTo(ChronoUnit.MICROS);
        StateTransaction tx = dao.findLatestTransactionAtOrBefore(conn, projectId, restoreAt)
                .orElseThrow(() -> new StateRollbackException(
                        "No transaction available before restore_at " + restoreAt + " for project " + projectId));
        return requirePreviousState(tx);
    }

    private static Map<String, Object> requirePreviousState(StateTransaction tx) {
        if (tx.previousState() == null || tx.previousState().isEmpty()) {
            throw new StateRollbackException("Transaction does not contain previous state: " + tx.id()
                    + " (" + tx.changeType() + ")");
        }
        return tx.previousState();
    }

    /** Builds the row a rollback writes: the target's fields over the live row's identity and creation time. */
    private ProjectState fromDocument(String projectId, Map<String, Object> doc, ProjectState current) {
        String phase = stringOrNull(doc.get("current_phase"));
        if (phase == null || phase.isBlank()) {
            throw new StateRollbackException("Rollback target for project " + projectId + " has no current_phase");
        }
        String statusValue = stringOrNull(doc.get("status"));
        ProjectStatus status;
        try {
            status = statusValue == null ? ProjectStatus.ACTIVE : ProjectStatus.fromValue(statusValue);
        } catch (IllegalArgumentException e) {
            throw new StateRollbackException("Rollback target for project " + projectId
                    + " has invalid status '" + statusValue + "'", e);
        }
        return new ProjectState(projectId, phase,
                stringOrNull(doc.get("active_task_id")),
                stringOrNull(doc.get("active_agent_id")),
                JsonColumns.coerceList(doc.get("completed_tasks")),
                JsonColumns.coerceList(doc.get("pending_tasks")),
                JsonColumns.coerceMap(doc.get("metadata")),
                status,
                stringOrNull(doc.get("last_action")),
                current.createdAt(),
                nextLastUpdated(current));
    }

    private void afterWrite(String projectId, String changeType, long startNanos) {
        evict(projectId);
        if (metrics != null) {
            metrics.recordStateWrite(changeType, elapsedMillis(startNanos));
        }
    }

    private void recordRollback(RollbackTarget target, boolean success) {
        if (metrics != null) {
            metrics.recordRollback(target.selector(), success);
        }
    }

    /**
     * The clock may not have advanced since the previous write, so {@code lastUpdated} is
     * bumped by at least one microsecond to keep optimistic checks meaningful.
     */
    private Instant nextLastUpdated(ProjectState current) {
        Instant now = now();
        if (current.lastUpdated() == null) {
            return now;
        }
        Instant floor = current.lastUpdated().plus(1, ChronoUnit.MICROS);
        return now.isBefore(floor) ? floor : now;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static String describe(ProjectStateUpdate update) {
        List<String> fields = new ArrayList<>();
        if (update.currentPhase() != null) fields.add("phase=" + update.currentPhase());
        if (update.activeTaskId() != null) fields.add("activeTask=" + update.activeTaskId());
        if (update.activeAgentId() != null) fields.add("activeAgent=" + update.activeAgentId());
        if (update.metadata() != null) fields.add("metadata" + update.metadata().keySet());
        if (update.pendingTasks() != null) fields.add("pending=" + update.pendingTasks().size());
        if (update.status() != null) fields.add("status=" + update.status().value());
        if (update.lastAction() != null) fields.add("lastAction");
        return String.join(", ", fields);
    }
}
