package com.spindle.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and runs the {@link SpindleCommand}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SpindleCommand spindleCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SpindleCommand spindleCommand, IFactory factory) {
        this.spindleCommand = spindleCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(spindleCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
