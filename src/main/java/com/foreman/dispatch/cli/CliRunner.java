package com.foreman.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the Foreman command line once the Spring context is up and keeps picocli's
 * exit code for {@link com.foreman.ForemanApplication} to exit with.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final ForemanCommand foremanCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ForemanCommand foremanCommand, IFactory factory) {
        this.foremanCommand = foremanCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        var commandLine = new CommandLine(foremanCommand, factory);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        exitCode = commandLine.execute(args);
        if (exitCode != 0) {
            log.debug("Command {} exited with {}", String.join(" ", args), exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
