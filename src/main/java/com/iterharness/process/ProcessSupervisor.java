package com.iterharness.process;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.environment.HarnessProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the service as a local child process.
 *
 * <p>State machine: {@code NOT_STARTED -> STARTING -> READY -> STOPPING -> STOPPED}, with
 * {@code STARTING -> FAILED} on a launch error or readiness timeout. A failed start never
 * leaves the half-started process behind.
 *
 * <p>Shutdown is graceful first: the process gets a terminate signal and the shutdown grace
 * period to exit, then is force-killed. The supervisor then waits for the health endpoint to
 * stop answering so the next environment cannot collide with a socket still listening.
 */
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final ServiceLauncher launcher;
    private final ServiceConfigWriter configWriter;
    private final HealthProbe healthProbe;
    private final HarnessProperties.Timeouts timeouts;
    private final ProcessSpec spec;

    private SupervisorState state = SupervisorState.NOT_STARTED;
    private Process process;

    public ProcessSupervisor(ServiceLauncher launcher, ServiceConfigWriter configWriter,
                             HealthProbe healthProbe, HarnessProperties.Timeouts timeouts,
                             ProcessSpec spec) {
        this.launcher = launcher;
        this.configWriter = configWriter;
        this.healthProbe = healthProbe;
        this.timeouts = timeouts;
        this.spec = spec;
    }

    public synchronized SupervisorState state() {
        return state;
    }

    public synchronized boolean isAlive() {
        return process != null && process.isAlive();
    }

    /**
     * Writes the config, launches the service and blocks until {@code /health} answers 200.
     *
     * @throws IllegalStateException if already starting or running
     * @throws HarnessException SETUP_FATAL on launch failure, READINESS_TIMEOUT if the service
     *         never became healthy
     */
    public synchronized void start() {
        if (state == SupervisorState.STARTING || state == SupervisorState.READY) {
            throw new IllegalStateException("Service already started (state " + state + ")");
        }
        state = SupervisorState.STARTING;

        try {
            configWriter.write(spec.configPath(), spec.port(), spec.dataDir());
            List<String> command = launcher.command(spec.configPath());
            process = launch(command);
            log.info("Launched service pid {} on port {}: {}", process.pid(), spec.port(), command);
        } catch (RuntimeException e) {
            state = SupervisorState.FAILED;
            throw e;
        }

        try {
            healthProbe.awaitHealthy(spec.baseUrl(), timeouts.getReadiness(), timeouts.getPollInterval());
        } catch (HarnessException e) {
            String exitNote = process.isAlive() ? "" : " (process exited with code " + process.exitValue() + ")";
            log.warn("Service on port {} failed readiness{}, terminating", spec.port(), exitNote);
            terminate();
            state = SupervisorState.FAILED;
            throw new HarnessException(e.kind(), e.getMessage() + exitNote, e);
        }

        state = SupervisorState.READY;
        log.info("Service ready at {}", spec.baseUrl());
    }

    private Process launch(List<String> command) {
        var builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(spec.logFile().toFile()));
        builder.environment().put("ITER_CONFIG", spec.configPath().toString());
        builder.environment().put("ITER_DATA_DIR", spec.dataDir().toString());
        builder.environment().putAll(spec.environment());
        try {
            Files.createDirectories(spec.logFile().getParent());
            return builder.start();
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.SETUP_FATAL, "Failed to start service: " + command, e);
        }
    }

    /**
     * Stops the service. A no-op unless the supervisor is running or failed mid-start.
     */
    public synchronized void stop() {
        if (state != SupervisorState.READY && state != SupervisorState.FAILED) {
            return;
        }
        if (process == null) {
            state = SupervisorState.STOPPED;
            return;
        }
        state = SupervisorState.STOPPING;
        terminate();
        if (!healthProbe.awaitUnreachable(spec.baseUrl(), timeouts.getPortRelease(), timeouts.getPollInterval())) {
            log.warn("Port {} still answering after shutdown", spec.port());
        }
        state = SupervisorState.STOPPED;
        log.info("Service on port {} stopped", spec.port());
    }

    private void terminate() {
        if (process == null || !process.isAlive()) {
            return;
        }
        process.destroy();
        if (!waitForExit(timeouts.getShutdownGrace())) {
            log.warn("Service pid {} did not exit within {}ms, killing", process.pid(),
                    timeouts.getShutdownGrace().toMillis());
            process.destroyForcibly();
            waitForExit(timeouts.getShutdownGrace());
        }
    }

    private boolean waitForExit(Duration timeout) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }
}
