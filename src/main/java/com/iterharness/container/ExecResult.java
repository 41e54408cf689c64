package com.iterharness.container;

/**
 * Outcome of a command executed inside a container.
 *
 * @param exitCode process exit code, -1 if it could not be determined
 * @param output   combined stdout and stderr
 */
public record ExecResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
