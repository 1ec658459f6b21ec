package com.foreman.dispatch.cli;

import com.foreman.core.health.HealthCheckService;
import com.foreman.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: foreman health
 * <p>
 * Runs the database, schema, queue and agent checks and prints one line per component.
 * Exits with 1 when any component is DOWN, so scripts can gate on it.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        long down = checks.stream().filter(c -> c.status() == HealthStatus.Status.DOWN).count();
        long degraded = checks.stream().filter(c -> c.status() == HealthStatus.Status.DEGRADED).count();

        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail() + details(check);
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (down == 0 && degraded == 0) {
            ConsoleOutput.success("Overall: all components up");
        } else {
            ConsoleOutput.error("Overall: " + down + " down, " + degraded + " degraded");
        }
        return down == 0 ? 0 : 1;
    }

    private static String details(HealthStatus check) {
        if (check.metadata().isEmpty()) {
            return "";
        }
        return check.metadata().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
