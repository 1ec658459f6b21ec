package com.foreman.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * DDL for the project state tables. The statements are idempotent and run on both
 * PostgreSQL and H2 (PostgreSQL mode).
 * <p>
 * JSON columns are plain {@code TEXT}; {@link JsonColumns} does the encoding. The {@code seq}
 * identity on the audit tables gives a stable insertion order when timestamps collide.
 */
public class ProjectStateSchema {

    private static final Logger log = LoggerFactory.getLogger(ProjectStateSchema.class);

    public static final String STATE_TABLE = "project_state";
    public static final String SNAPSHOT_TABLE = "project_state_snapshots";
    public static final String TRANSACTION_TABLE = "project_state_transactions";

    private static final String CREATE_STATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                project_id      VARCHAR(255) NOT NULL PRIMARY KEY,
                current_phase   VARCHAR(255) NOT NULL,
                active_task_id  VARCHAR(255),
                active_agent_id VARCHAR(255),
                completed_tasks TEXT,
                pending_tasks   TEXT,
                metadata        TEXT,
                status          VARCHAR(32) DEFAULT 'active' NOT NULL,
                last_action     TEXT,
                created_at      TIMESTAMP WITH TIME ZONE NOT NULL,
                last_updated    TIMESTAMP WITH TIME ZONE NOT NULL,
                CONSTRAINT ck_project_state_status_valid
                    CHECK (status IN ('active', 'paused', 'completed', 'failed'))
            )
            """.formatted(STATE_TABLE);

    private static final String CREATE_SNAPSHOT_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(64) NOT NULL PRIMARY KEY,
                seq         BIGINT GENERATED BY DEFAULT AS IDENTITY,
                project_id  VARCHAR(255) NOT NULL REFERENCES %s (project_id) ON DELETE CASCADE,
                snapshot_at TIMESTAMP WITH TIME ZONE NOT NULL,
                state       TEXT NOT NULL,
                taken_by    VARCHAR(255),
                notes       TEXT
            )
            """.formatted(SNAPSHOT_TABLE, STATE_TABLE);

    private static final String CREATE_TRANSACTION_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id             VARCHAR(64) NOT NULL PRIMARY KEY,
                seq            BIGINT GENERATED BY DEFAULT AS IDENTITY,
                project_id     VARCHAR(255) NOT NULL REFERENCES %s (project_id) ON DELETE CASCADE,
                occurred_at    TIMESTAMP WITH TIME ZONE NOT NULL,
                change_type    VARCHAR(64) NOT NULL,
                payload        TEXT,
                actor          VARCHAR(255),
                previous_state TEXT
            )
            """.formatted(TRANSACTION_TABLE, STATE_TABLE);

    private static final List<String> INDEX_SQL = List.of(
            "CREATE INDEX IF NOT EXISTS idx_project_state_snapshots_project ON %s (project_id, snapshot_at)"
                    .formatted(SNAPSHOT_TABLE),
            "CREATE INDEX IF NOT EXISTS idx_project_state_transactions_project ON %s (project_id, occurred_at)"
                    .formatted(TRANSACTION_TABLE));

    private final DataSource dataSource;

    public ProjectStateSchema(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the state, snapshot and transaction tables and their indexes if missing.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_STATE_TABLE_SQL);
            stmt.execute(CREATE_SNAPSHOT_TABLE_SQL);
            stmt.execute(CREATE_TRANSACTION_TABLE_SQL);
            for (String sql : INDEX_SQL) {
                stmt.execute(sql);
            }
            log.info("Project state tables '{}', '{}', '{}' ensured", STATE_TABLE, SNAPSHOT_TABLE, TRANSACTION_TABLE);
        }
    }
}
