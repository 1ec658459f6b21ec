package com.foreman.dispatch.cli;

import com.foreman.core.logging.MdcContext;
import com.foreman.core.persistence.JsonColumns;
import com.foreman.core.state.ProjectStateException;
import com.foreman.core.state.ProjectStateManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: foreman state show &lt;projectId&gt;
 * <p>
 * Reads the project state straight from the database and prints it,
 * or dumps it as JSON with {@code --json}.
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show the current state of a project")
@Component
public class ShowCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = "--json", description = "Print the state as JSON")
    private boolean json;

    private final ProjectStateManager stateManager;
    private final JsonColumns jsonColumns;

    public ShowCommand(ProjectStateManager stateManager, JsonColumns jsonColumns) {
        this.stateManager = stateManager;
        this.jsonColumns = jsonColumns;
    }

    @Override
    public void run() {
        MdcContext.setProject(projectId);
        try {
            var state = stateManager.getState(projectId, false);
            if (json) {
                System.out.println(jsonColumns.objectMapper().writerWithDefaultPrettyPrinter()
                        .writeValueAsString(state));
                return;
            }
            ConsoleOutput.printBanner();
            ConsoleOutput.state(state);
        } catch (ProjectStateException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (Exception e) {
            ConsoleOutput.error("Failed to render project " + projectId + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }
}
