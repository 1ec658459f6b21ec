package com.foreman.dispatch.cli;

import com.foreman.core.logging.MdcContext;
import com.foreman.core.state.ProjectStateException;
import com.foreman.core.state.ProjectStateManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: foreman state snapshot &lt;projectId&gt; [--list]
 * <p>
 * Takes a snapshot of the current state, or lists existing snapshots oldest first.
 * Snapshot ids can be passed to {@code foreman state rollback --snapshot}.
 */
@Command(name = "snapshot", mixinStandardHelpOptions = true, description = "Take a snapshot of a project's state")
@Component
public class SnapshotCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = "--by", description = "Who is taking the snapshot", defaultValue = "cli")
    private String takenBy;

    @Option(names = "--notes", description = "Free-form notes stored with the snapshot")
    private String notes;

    @Option(names = "--list", description = "List existing snapshots instead of taking one")
    private boolean list;

    private final ProjectStateManager stateManager;

    public SnapshotCommand(ProjectStateManager stateManager) {
        this.stateManager = stateManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        MdcContext.setProject(projectId);
        try {
            if (list) {
                var snapshots = stateManager.listSnapshots(projectId);
                if (snapshots.isEmpty()) {
                    ConsoleOutput.info("No snapshots found for project " + projectId + ".");
                    return;
                }
                ConsoleOutput.info("Snapshots (" + snapshots.size() + "):");
                System.out.println();
                System.out.printf("  %-32s %-28s %-12s %s%n", "SNAPSHOT ID", "TAKEN AT", "BY", "NOTES");
                System.out.println("  " + "-".repeat(96));
                snapshots.forEach(ConsoleOutput::snapshot);
                return;
            }
            String snapshotId = stateManager.createSnapshot(projectId, takenBy, notes);
            ConsoleOutput.success("Snapshot " + snapshotId + " created for project " + projectId);
        } catch (ProjectStateException e) {
            ConsoleOutput.error(e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }
}
