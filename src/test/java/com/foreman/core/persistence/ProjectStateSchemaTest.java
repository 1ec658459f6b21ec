package com.foreman.core.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class ProjectStateSchemaTest {

    private static final String INSERT_STATE = """
            INSERT INTO project_state (project_id, current_phase, status, created_at, last_updated)
            VALUES ('%s', 'planning', '%s', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)""";

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() throws SQLException {
        DataSource dataSource = TestDataSources.h2();
        var schema = new ProjectStateSchema(dataSource);

        schema.createTables();
        assertDoesNotThrow(schema::createTables);
    }

    @Test
    @DisplayName("status check constraint rejects unknown values")
    void statusConstraint() throws SQLException {
        DataSource dataSource = TestDataSources.h2WithSchema();

        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(INSERT_STATE.formatted("ok", "paused"));
            assertThrows(SQLException.class, () -> stmt.execute(INSERT_STATE.formatted("bad", "archived")));
        }
    }

    @Test
    @DisplayName("deleting a project cascades to its snapshots and transactions")
    void cascadeDelete() throws SQLException {
        DataSource dataSource = TestDataSources.h2WithSchema();

        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(INSERT_STATE.formatted("P1", "active"));
            stmt.execute("""
                    INSERT INTO project_state_transactions (id, project_id, occurred_at, change_type)
                    VALUES ('tx1', 'P1', CURRENT_TIMESTAMP, 'update_state')""");
            stmt.execute("""
                    INSERT INTO project_state_snapshots (id, project_id, snapshot_at, state)
                    VALUES ('s1', 'P1', CURRENT_TIMESTAMP, '{}')""");

            stmt.execute("DELETE FROM project_state WHERE project_id = 'P1'");

            try (var rs = stmt.executeQuery("SELECT COUNT(*) FROM project_state_transactions")) {
                rs.next();
                assertEquals(0, rs.getInt(1));
            }
            try (var rs = stmt.executeQuery("SELECT COUNT(*) FROM project_state_snapshots")) {
                rs.next();
                assertEquals(0, rs.getInt(1));
            }
        }
    }
}
