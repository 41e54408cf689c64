package com.iterharness.dispatch.cli;

import com.iterharness.core.error.HarnessException;
import com.iterharness.core.model.TestKind;
import com.iterharness.core.model.TestOutcome;
import com.iterharness.environment.TestEnvironment;
import com.iterharness.environment.TestSetup;
import com.iterharness.scenario.SmokeScenario;
import com.iterharness.scenario.UiScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: iter-harness smoke
 * <p>
 * Provisions an environment, runs the smoke scenario (or the browser scenario with
 * {@code --ui}), writes the summary and tears the environment down.
 * Exit code 0 for a pass, 2 for a skip, 1 otherwise.
 */
@Command(name = "smoke", mixinStandardHelpOptions = true, description = "Provision an environment and run smoke checks")
@Component
public class SmokeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SmokeCommand.class);

    static final int EXIT_SKIPPED = 2;

    private final TestSetup testSetup;
    private final SmokeScenario scenario;
    private final UiScenario uiScenario;

    @Option(names = "--kind", description = "Test kind: api, mcp, ui, service (default: ${DEFAULT-VALUE})", defaultValue = "service")
    String kind;

    @Option(names = "--name", description = "Test name (default: ${DEFAULT-VALUE})", defaultValue = "smoke")
    String name;

    @Option(names = "--containerized", description = "Run the service in Docker")
    boolean containerized;

    @Option(names = "--external-url", description = "Use an already-running service instead of starting one")
    String externalUrl;

    @Option(names = "--ui", description = "Run the browser scenario instead of the protocol checks")
    boolean ui;

    public SmokeCommand(TestSetup testSetup) {
        this.testSetup = testSetup;
        this.scenario = new SmokeScenario();
        this.uiScenario = new UiScenario();
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var props = testSetup.properties();
        if (containerized) {
            props.setContainerized(true);
        }
        if (externalUrl != null && !externalUrl.isBlank()) {
            props.setExternalUrl(externalUrl);
        }

        TestKind testKind = TestKind.fromString(kind);
        ConsoleOutput.info("Backend: " + testSetup.selectBackend() + ", results: "
                + props.resultsRootPath().resolve(testKind.directoryName()).resolve(name));

        try (TestEnvironment env = testSetup.create(testKind, name)) {
            try {
                env.start();
            } catch (HarnessException e) {
                log.warn("Environment start failed: {}", e.toString());
                var summary = e.kind().isSkip()
                        ? env.writeSkipped(e.getMessage())
                        : env.writeSummary(false, "Environment failed to start", e.toString());
                ConsoleOutput.summary(summary);
                return exitCode(summary.outcome());
            }
            ConsoleOutput.success("Service ready at " + env.baseUrl());
            var summary = ui ? uiScenario.run(env) : scenario.run(env);
            ConsoleOutput.summary(summary);
            return exitCode(summary.outcome());
        }
    }

    static int exitCode(TestOutcome outcome) {
        return switch (outcome) {
            case PASSED -> 0;
            case SKIPPED -> EXIT_SKIPPED;
            case FAILED -> 1;
        };
    }
}
