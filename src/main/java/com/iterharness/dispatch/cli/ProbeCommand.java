package com.iterharness.dispatch.cli;

import com.iterharness.core.health.HealthProbe;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: iter-harness probe &lt;url&gt;
 * <p>
 * Runs one health probe against a service and exits 0 only when it is UP.
 */
@Command(name = "probe", mixinStandardHelpOptions = true, description = "Check a service's /health endpoint once")
@Component
public class ProbeCommand implements Callable<Integer> {

    private final HealthProbe healthProbe;

    @Parameters(index = "0", description = "Base URL of the service, e.g. http://127.0.0.1:19000")
    String url;

    public ProbeCommand(HealthProbe healthProbe) {
        this.healthProbe = healthProbe;
    }

    @Override
    public Integer call() {
        var status = healthProbe.check(url);
        ConsoleOutput.health(status);
        return status.isUp() ? 0 : 1;
    }
}
