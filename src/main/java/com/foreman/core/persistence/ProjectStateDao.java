package com.foreman.core.persistence;

import com.foreman.core.state.ProjectState;
import com.foreman.core.state.ProjectStatus;
import com.foreman.core.state.StateSnapshot;
import com.foreman.core.state.StateTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.foreman.core.persistence.ProjectStateSchema.SNAPSHOT_TABLE;
import static com.foreman.core.persistence.ProjectStateSchema.STATE_TABLE;
import static com.foreman.core.persistence.ProjectStateSchema.TRANSACTION_TABLE;

/**
 * Row-level JDBC access to the project state tables.
 * <p>
 * Every method runs on a caller-supplied {@link Connection}, so a caller can group several
 * calls into one database transaction. {@link SQLException}s propagate unchanged.
 */
public class ProjectStateDao {

    private static final Logger log = LoggerFactory.getLogger(ProjectStateDao.class);

    private static final String STATE_COLUMNS = """
            project_id, current_phase, active_task_id, active_agent_id, completed_tasks,
            pending_tasks, metadata, status, last_action, created_at, last_updated""";

    private static final String SELECT_STATE_SQL = """
            SELECT %s
            FROM %s
            WHERE project_id = ?""".formatted(STATE_COLUMNS, STATE_TABLE);

    private static final String SELECT_STATE_FOR_UPDATE_SQL = SELECT_STATE_SQL + " FOR UPDATE";

    private static final String INSERT_STATE_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(STATE_TABLE, STATE_COLUMNS);

    private static final String UPDATE_STATE_SQL = """
            UPDATE %s
            SET current_phase = ?, active_task_id = ?, active_agent_id = ?, completed_tasks = ?,
                pending_tasks = ?, metadata = ?, status = ?, last_action = ?, last_updated = ?
            WHERE project_id = ?
            """.formatted(STATE_TABLE);

    private static final String INSERT_TRANSACTION_SQL = """
            INSERT INTO %s (id, project_id, occurred_at, change_type, payload, actor, previous_state)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(TRANSACTION_TABLE);

    private static final String TRANSACTION_COLUMNS =
            "id, project_id, occurred_at, change_type, payload, actor, previous_state";

    private static final String SELECT_TRANSACTION_SQL = """
            SELECT %s
            FROM %s
            WHERE project_id = ? AND id = ?
            """.formatted(TRANSACTION_COLUMNS, TRANSACTION_TABLE);

    private static final String SELECT_LATEST_TRANSACTION_AT_SQL = """
            SELECT %s
            FROM %s
            WHERE project_id = ? AND occurred_at <= ?
            ORDER BY occurred_at DESC, seq DESC
            FETCH FIRST 1 ROWS ONLY
            """.formatted(TRANSACTION_COLUMNS, TRANSACTION_TABLE);

    private static final String SELECT_TRANSACTIONS_SQL = """
            SELECT %s
            FROM %s
            WHERE project_id = ?
            ORDER BY occurred_at ASC, seq ASC
            """.formatted(TRANSACTION_COLUMNS, TRANSACTION_TABLE);

    private static final String INSERT_SNAPSHOT_SQL = """
            INSERT INTO %s (id, project_id, snapshot_at, state, taken_by, notes)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(SNAPSHOT_TABLE);

    private static final String SNAPSHOT_COLUMNS = "id, project_id, snapshot_at, state, taken_by, notes";

    private static final String SELECT_SNAPSHOT_SQL = """
            SELECT %s
            FROM %s
            WHERE project_id = ? AND id = ?
            """.formatted(SNAPSHOT_COLUMNS, SNAPSHOT_TABLE);

    private static final String SELECT_SNAPSHOTS_SQL = """
            SELECT %s
            FROM %s
            WHERE project_id = ?
            ORDER BY snapshot_at ASC, seq ASC
            """.formatted(SNAPSHOT_COLUMNS, SNAPSHOT_TABLE);

    private final JsonColumns json;

    public ProjectStateDao(JsonColumns json) {
        this.json = Objects.requireNonNull(json, "JsonColumns must not be null");
    }

    // ── project_state ────────────────────────────────────────────────────

    /**
     * @param forUpdate lock the row until the surrounding transaction ends
     */
    public Optional<ProjectState> findState(Connection conn, String projectId, boolean forUpdate) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(forUpdate ? SELECT_STATE_FOR_UPDATE_SQL : SELECT_STATE_SQL)) {
            stmt.setString(1, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(stateFromResultSet(rs)) : Optional.empty();
            }
        }
    }

    public void insertState(Connection conn, ProjectState state) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_STATE_SQL)) {
            stmt.setString(1, state.projectId());
            stmt.setString(2, state.currentPhase());
            stmt.setString(3, state.activeTaskId());
            stmt.setString(4, state.activeAgentId());
            stmt.setString(5, json.write(state.completedTasks()));
            stmt.setString(6, json.write(state.pendingTasks()));
            stmt.setString(7, json.write(state.metadata()));
            stmt.setString(8, state.status().value());
            stmt.setString(9, state.lastAction());
            stmt.setObject(10, toTimestamp(state.createdAt()));
            stmt.setObject(11, toTimestamp(state.lastUpdated()));
            stmt.executeUpdate();
        }
    }

    /**
     * Overwrites every mutable column of the row. {@code created_at} is never changed.
     */
    public void updateState(Connection conn, ProjectState state) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_STATE_SQL)) {
            stmt.setString(1, state.currentPhase());
            stmt.setString(2, state.activeTaskId());
            stmt.setString(3, state.activeAgentId());
            stmt.setString(4, json.write(state.completedTasks()));
            stmt.setString(5, json.write(state.pendingTasks()));
            stmt.setString(6, json.write(state.metadata()));
            stmt.setString(7, state.status().value());
            stmt.setString(8, state.lastAction());
            stmt.setObject(9, toTimestamp(state.lastUpdated()));
            stmt.setString(10, state.projectId());
            int updated = stmt.executeUpdate();
            if (updated != 1) {
                throw new SQLException("Expected to update 1 row for project " + state.projectId()
                        + " but updated " + updated);
            }
        }
    }

    // ── project_state_transactions ───────────────────────────────────────

    public void insertTransaction(Connection conn, StateTransaction tx) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_TRANSACTION_SQL)) {
            stmt.setString(1, tx.id());
            stmt.setString(2, tx.projectId());
            stmt.setObject(3, toTimestamp(tx.occurredAt()));
            stmt.setString(4, tx.changeType());
            stmt.setString(5, json.write(tx.payload()));
            stmt.setString(6, tx.actor());
            stmt.setString(7, json.write(tx.previousState()));
            stmt.executeUpdate();
        }
        log.debug("Logged {} transaction {} for project {}", tx.changeType(), tx.id(), tx.projectId());
    }

    public Optional<StateTransaction> findTransaction(Connection conn, String projectId, String transactionId)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_TRANSACTION_SQL)) {
            stmt.setString(1, projectId);
            stmt.setString(2, transactionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(transactionFromResultSet(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Finds the latest transaction that occurred at or before {@code instant}.
     * Transactions sharing a timestamp are ordered by insertion; the last inserted wins.
     */
    public Optional<StateTransaction> findLatestTransactionAtOrBefore(Connection conn, String projectId,
                                                                      Instant instant) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_TRANSACTION_AT_SQL)) {
            stmt.setString(1, projectId);
            stmt.setObject(2, toTimestamp(instant));
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(transactionFromResultSet(rs)) : Optional.empty();
            }
        }
    }

    public List<StateTransaction> listTransactions(Connection conn, String projectId) throws SQLException {
        List<StateTransaction> transactions = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_TRANSACTIONS_SQL)) {
            stmt.setString(1, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    transactions.add(transactionFromResultSet(rs));
                }
            }
        }
        return transactions;
    }

    // ── project_state_snapshots ──────────────────────────────────────────

    public void insertSnapshot(Connection conn, StateSnapshot snapshot) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SNAPSHOT_SQL)) {
            stmt.setString(1, snapshot.id());
            stmt.setString(2, snapshot.projectId());
            stmt.setObject(3, toTimestamp(snapshot.snapshotAt()));
            stmt.setString(4, json.write(snapshot.state()));
            stmt.setString(5, snapshot.takenBy());
            stmt.setString(6, snapshot.notes());
            stmt.executeUpdate();
        }
    }

    public Optional<StateSnapshot> findSnapshot(Connection conn, String projectId, String snapshotId)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_SNAPSHOT_SQL)) {
            stmt.setString(1, projectId);
            stmt.setString(2, snapshotId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(snapshotFromResultSet(rs)) : Optional.empty();
            }
        }
    }

    public List<StateSnapshot> listSnapshots(Connection conn, String projectId) throws SQLException {
        List<StateSnapshot> snapshots = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_SNAPSHOTS_SQL)) {
            stmt.setString(1, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    snapshots.add(snapshotFromResultSet(rs));
                }
            }
        }
        return snapshots;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant fromTimestamp(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private ProjectState stateFromResultSet(ResultSet rs) throws SQLException {
        String projectId = rs.getString("project_id");
        return new ProjectState(
                projectId,
                rs.getString("current_phase"),
                rs.getString("active_task_id"),
                rs.getString("active_agent_id"),
                json.readList(rs.getString("completed_tasks"), "completed_tasks"),
                json.readList(rs.getString("pending_tasks"), "pending_tasks"),
                json.readMap(rs.getString("metadata"), "metadata"),
                parseStatus(projectId, rs.getString("status")),
                rs.getString("last_action"),
                fromTimestamp(rs, "created_at"),
                fromTimestamp(rs, "last_updated"));
    }

    private StateTransaction transactionFromResultSet(ResultSet rs) throws SQLException {
        return new StateTransaction(
                rs.getString("id"),
                rs.getString("project_id"),
                fromTimestamp(rs, "occurred_at"),
                rs.getString("change_type"),
                json.readMap(rs.getString("payload"), "payload"),
                rs.getString("actor"),
                json.readNullableMap(rs.getString("previous_state"), "previous_state"));
    }

    private StateSnapshot snapshotFromResultSet(ResultSet rs) throws SQLException {
        return new StateSnapshot(
                rs.getString("id"),
                rs.getString("project_id"),
                fromTimestamp(rs, "snapshot_at"),
                json.readMap(rs.getString("state"), "state"),
                rs.getString("taken_by"),
                rs.getString("notes"));
    }

    private static ProjectStatus parseStatus(String projectId, String value) {
        try {
            return ProjectStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            log.warn("Project {} has unknown status '{}'; reading as active", projectId, value);
            return ProjectStatus.ACTIVE;
        }
    }
}
