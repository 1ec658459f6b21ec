package com.foreman.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI command group: foreman state
 */
@Command(
        name = "state",
        mixinStandardHelpOptions = true,
        description = "Inspect, snapshot and roll back project state",
        subcommands = {
                ShowCommand.class,
                ProgressCommand.class,
                HistoryCommand.class,
                SnapshotCommand.class,
                RollbackCommand.class
        }
)
@Component
public class StateCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }
}
