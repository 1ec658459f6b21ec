package com.foreman.dispatch.cli;

import com.foreman.core.logging.MdcContext;
import com.foreman.core.state.ProjectStateException;
import com.foreman.core.state.ProjectStateManager;
import com.foreman.core.state.RollbackTarget;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Instant;

/**
 * CLI command: foreman state rollback &lt;projectId&gt; (--transaction ID | --snapshot ID | --at INSTANT)
 */
@Command(name = "rollback", mixinStandardHelpOptions = true, description = "Roll a project back to an earlier state")
@Component
public class RollbackCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Selector selector;

    @Option(names = "--actor", description = "Who is rolling back", defaultValue = "cli")
    private String actor;

    static class Selector {
        @Option(names = "--transaction", description = "Restore the state captured before this transaction")
        String transactionId;

        @Option(names = "--snapshot", description = "Restore this snapshot")
        String snapshotId;

        @Option(names = "--at", description = "Restore the state just before this ISO-8601 instant")
        Instant restoreAt;
    }

    private final ProjectStateManager stateManager;

    public RollbackCommand(ProjectStateManager stateManager) {
        this.stateManager = stateManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        MdcContext.setProject(projectId);
        try {
            var target = new RollbackTarget(selector.transactionId, selector.snapshotId, selector.restoreAt);
            var restored = stateManager.rollbackState(projectId, target, actor);
            ConsoleOutput.success("Project " + projectId + " rolled back (" + target.selector() + ")");
            ConsoleOutput.state(restored);
        } catch (ProjectStateException e) {
            ConsoleOutput.error(e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }
}
