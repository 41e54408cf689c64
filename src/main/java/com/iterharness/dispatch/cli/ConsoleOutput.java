package com.iterharness.dispatch.cli;

import com.iterharness.core.health.HealthStatus;
import com.iterharness.core.model.TestSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the harness CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) ITER-HARNESS v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [HARNESS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void health(HealthStatus status) {
        String label = status.component() + ": " + status.status() + " (" + status.detail() + ")";
        switch (status.status()) {
            case UP -> success(label);
            case DEGRADED -> info(label);
            case DOWN -> error(label);
        }
    }

    public static void summary(TestSummary summary) {
        System.out.println(RULE);
        String result = switch (summary.outcome()) {
            case PASSED -> "@|fg(green),bold PASS|@";
            case FAILED -> "@|fg(red),bold FAIL|@";
            case SKIPPED -> "@|fg(yellow),bold SKIP|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                result + " " + summary.testName() + " (" + summary.duration() + ")"));
        if (summary.details() != null && !summary.details().isBlank()) {
            System.out.println("  " + summary.details());
        }
        for (String error : summary.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + error));
        }
    }
}
