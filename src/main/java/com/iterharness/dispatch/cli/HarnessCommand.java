package com.iterharness.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to {@code probe} and {@code smoke}.
 */
@Command(
        name = "iter-harness",
        mixinStandardHelpOptions = true,
        version = "iter-harness 0.1.0",
        description = "Provisions iter-service test environments and checks them",
        subcommands = {
                ProbeCommand.class,
                SmokeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HarnessCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
