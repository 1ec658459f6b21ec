package com.foreman.dispatch.cli;

import com.foreman.core.state.ProjectProgress;
import com.foreman.core.state.ProjectState;
import com.foreman.core.state.StateSnapshot;
import com.foreman.core.state.StateTransaction;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Foreman CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FOREMAN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FOREMAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void state(ProjectState state) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Project " + state.projectId() + "|@ " + status(state.status().value())));
        System.out.println("  Phase:        " + state.currentPhase());
        System.out.println("  Active task:  " + orDash(state.activeTaskId()));
        System.out.println("  Active agent: " + orDash(state.activeAgentId()));
        System.out.println("  Completed:    " + list(state.completedTasks()));
        System.out.println("  Pending:      " + list(state.pendingTasks()));
        System.out.println("  Last action:  " + orDash(state.lastAction()));
        System.out.println("  Created:      " + state.createdAt());
        System.out.println("  Updated:      " + state.lastUpdated());
        if (!state.metadata().isEmpty()) {
            System.out.println("  Metadata keys: " + String.join(", ", state.metadata().keySet()));
        }
    }

    public static void progress(ProjectProgress progress) {
        int width = 30;
        int filled = (int) Math.round(progress.completionRatio() * width);
        String bar = "#".repeat(filled) + ".".repeat(width - filled);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  [@|fg(green) " + bar + "|@] " + Math.round(progress.completionRatio() * 100) + "%"));
        System.out.println("  " + progress.completedTasks() + " of " + progress.totalTasks()
                + " task(s) completed, " + progress.pendingTasks() + " pending");
        System.out.println("  Status: " + progress.status().value() + ", updated " + progress.lastUpdated());
    }

    public static void transaction(StateTransaction tx) {
        System.out.printf("  %-32s %-28s %-24s %s%n",
                tx.id(), tx.occurredAt(), tx.changeType(), orDash(tx.actor()));
    }

    public static void snapshot(StateSnapshot snapshot) {
        System.out.printf("  %-32s %-28s %-12s %s%n",
                snapshot.id(), snapshot.snapshotAt(), orDash(snapshot.takenBy()), orDash(snapshot.notes()));
    }

    private static String status(String value) {
        String color = switch (value) {
            case "active" -> "fg(green)";
            case "paused" -> "fg(yellow)";
            case "completed" -> "fg(cyan)";
            default -> "fg(red)";
        };
        return "@|" + color + " [" + value.toUpperCase() + "]|@";
    }

    private static String list(List<String> items) {
        return items.isEmpty() ? "-" : String.join(", ", items);
    }

    private static String orDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }
}
