package com.iterharness.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments, runs the command and
 * keeps its exit code for {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final HarnessCommand harnessCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(HarnessCommand harnessCommand, IFactory factory) {
        this.harnessCommand = harnessCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(harnessCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
