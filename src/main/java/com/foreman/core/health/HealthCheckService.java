package com.foreman.core.health;

import com.foreman.core.lifecycle.AgentLifecycleManager;
import com.foreman.core.lifecycle.AgentLifecycleState;
import com.foreman.core.persistence.ProjectStateSchema;
import com.foreman.core.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the database, the project-state tables, the task queue and the agent registry.
 * Storage problems report DOWN; a missing in-memory service reports DEGRADED.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private static final String SCHEMA_CHECK_SQL =
            "SELECT 1 FROM " + ProjectStateSchema.STATE_TABLE + " WHERE 1 = 0";

    private final DataSource dataSource;
    private final TaskQueue taskQueue;
    private final AgentLifecycleManager lifecycleManager;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) TaskQueue taskQueue,
            @Autowired(required = false) AgentLifecycleManager lifecycleManager) {
        this.dataSource = dataSource;
        this.taskQueue = taskQueue;
        this.lifecycleManager = lifecycleManager;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkSchema());
        results.add(checkQueue());
        results.add(checkAgents());
        return results;
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.down("database", "No DataSource configured");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid");
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }

    private HealthStatus checkSchema() {
        if (dataSource == null) {
            return HealthStatus.down("schema", "No DataSource configured");
        }
        try (var conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SCHEMA_CHECK_SQL)) {
            stmt.executeQuery().close();
            return HealthStatus.up("schema", "Project state tables present");
        } catch (Exception e) {
            log.warn("Schema health check failed: {}", e.getMessage());
            return HealthStatus.down("schema", "Project state tables missing or unreadable: " + e.getMessage());
        }
    }

    private HealthStatus checkQueue() {
        if (taskQueue == null) {
            return HealthStatus.degraded("queue", "No TaskQueue configured");
        }
        int pending = taskQueue.getPendingCount();
        return HealthStatus.up("queue",
                pending + " pending task(s)", Map.of("pending", String.valueOf(pending)));
    }

    private HealthStatus checkAgents() {
        if (lifecycleManager == null) {
            return HealthStatus.degraded("agents", "No AgentLifecycleManager configured");
        }
        Map<AgentLifecycleState, Integer> counts = new EnumMap<>(AgentLifecycleState.class);
        for (String agentId : lifecycleManager.getRegisteredAgentIds()) {
            counts.merge(lifecycleManager.getAgentStatus(agentId).state(), 1, Integer::sum);
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        counts.forEach((state, count) -> metadata.put(state.name().toLowerCase(), String.valueOf(count)));
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return HealthStatus.up("agents",
                total + " registered agent(s)", metadata);
    }
}
