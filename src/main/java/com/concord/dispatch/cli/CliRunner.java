package com.concord.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once Spring is up and hands its exit code to
 * {@link org.springframework.boot.SpringApplication#exit}. Serve mode is left to the web server.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ConcordCommand concordCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ConcordCommand concordCommand, IFactory factory) {
        this.concordCommand = concordCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (!ServeCommand.requested(args)) {
            exitCode = new CommandLine(concordCommand, factory).execute(args);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
