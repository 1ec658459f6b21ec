package com.foreman.dispatch.cli;

import com.foreman.core.logging.MdcContext;
import com.foreman.core.state.ProjectStateException;
import com.foreman.core.state.ProjectStateManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: foreman state progress &lt;projectId&gt;
 */
@Command(name = "progress", mixinStandardHelpOptions = true, description = "Show task completion for a project")
@Component
public class ProgressCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final ProjectStateManager stateManager;

    public ProgressCommand(ProjectStateManager stateManager) {
        this.stateManager = stateManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        MdcContext.setProject(projectId);
        try {
            ConsoleOutput.info("Progress of project " + projectId + ":");
            ConsoleOutput.progress(stateManager.getProgress(projectId));
        } catch (ProjectStateException e) {
            ConsoleOutput.error(e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }
}
