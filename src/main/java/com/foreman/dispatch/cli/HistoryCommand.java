package com.foreman.dispatch.cli;

import com.foreman.core.logging.MdcContext;
import com.foreman.core.state.ProjectStateException;
import com.foreman.core.state.ProjectStateManager;
import com.foreman.core.state.StateTransaction;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: foreman state history &lt;projectId&gt;
 * <p>
 * Lists the most recent entries of the project's transaction log, oldest first.
 * The ids shown can be passed to {@code foreman state rollback --transaction}.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List state transactions of a project")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final ProjectStateManager stateManager;

    public HistoryCommand(ProjectStateManager stateManager) {
        this.stateManager = stateManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        MdcContext.setProject(projectId);
        try {
            List<StateTransaction> transactions = stateManager.listTransactions(projectId);
            if (transactions.isEmpty()) {
                ConsoleOutput.info("No transactions found for project " + projectId + ".");
                return;
            }

            List<StateTransaction> display = transactions.size() > limit
                    ? transactions.subList(transactions.size() - limit, transactions.size())
                    : transactions;

            ConsoleOutput.info("Transactions (" + display.size() + " of " + transactions.size() + "):");
            System.out.println();
            System.out.printf("  %-32s %-28s %-24s %s%n", "TRANSACTION ID", "OCCURRED AT", "CHANGE", "ACTOR");
            System.out.println("  " + "-".repeat(96));
            display.forEach(ConsoleOutput::transaction);
        } catch (ProjectStateException e) {
            ConsoleOutput.error(e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }
}
