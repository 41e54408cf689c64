package com.iterharness.environment;

import com.iterharness.browser.BrowserCapture;
import com.iterharness.client.HttpTestClient;
import com.iterharness.client.rpc.ProtocolClient;
import com.iterharness.container.ContainerOrchestrator;
import com.iterharness.core.cleanup.CleanupSink;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.logging.MdcContext;
import com.iterharness.core.model.BackendType;
import com.iterharness.core.model.LifecycleState;
import com.iterharness.core.model.TestKind;
import com.iterharness.core.model.TestSummary;
import com.iterharness.core.results.ResultStore;
import com.iterharness.environment.backend.ContainerizedBackend;
import com.iterharness.environment.backend.LocalBackend;
import com.iterharness.environment.backend.ServiceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one test needs: a running service behind a {@link ServiceBackend}, a private
 * results directory, and clients bound to the service URL.
 *
 * <p>Lifecycle is {@code CREATED -> STARTED -> STOPPED}. {@link #close()} stops the backend and
 * any open browser through a {@link CleanupSink}, so it is safe in a {@code finally} block or
 * try-with-resources whether or not the start succeeded.
 */
public class TestEnvironment implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestEnvironment.class);

    public static final String CONFIG_FILE = "config.toml";
    public static final String SERVICE_LOG = "service.log";
    static final String TEST_PROJECTS_DIR = "test-projects";

    private final String name;
    private final TestKind kind;
    private final ResultStore results;
    private final ServiceBackend backend;
    private final HarnessProperties properties;
    private final Instant createdAt = Instant.now();
    private final CleanupSink cleanup = new CleanupSink();
    private final List<BrowserCapture> browsers = new ArrayList<>();

    private LifecycleState state = LifecycleState.CREATED;
    private boolean artifactsCollected;
    private HttpTestClient httpClient;
    private ProtocolClient protocolClient;

    TestEnvironment(String name, TestKind kind, ResultStore results, ServiceBackend backend,
                    HarnessProperties properties) {
        this.name = name;
        this.kind = kind;
        this.results = results;
        this.backend = backend;
        this.properties = properties;
    }

    // -- lifecycle --

    /**
     * Starts the backend and blocks until the service is ready. A failed start stops whatever
     * was partially acquired and leaves the environment STOPPED.
     */
    public synchronized void start() {
        transition(LifecycleState.STARTED);
        MdcContext.setBackend(kind.directoryName(), name, backend.type().name().toLowerCase());
        results.log("Starting {} environment", backend.type());
        try {
            backend.start();
        } catch (RuntimeException e) {
            results.log("Start failed: {}", e.getMessage());
            backend.stop(cleanup);
            state = LifecycleState.STOPPED;
            throw e;
        }
        results.log("Service ready at {}", backend.baseUrl());
    }

    /**
     * Stops the service and closes open browsers. Also releases what {@link TestSetup#create}
     * reserved when the environment was never started. Calling it again is a no-op.
     */
    public synchronized void stop() {
        if (state == LifecycleState.STOPPED) {
            return;
        }
        transition(LifecycleState.STOPPED);
        for (BrowserCapture browser : browsers) {
            cleanup.run("close browser", browser::close);
        }
        browsers.clear();
        backend.stop(cleanup);
        results.log("Environment stopped");
        if (!cleanup.isClean()) {
            log.warn("Environment {} stopped with {} cleanup failure(s)", name, cleanup.failures().size());
        }
        MdcContext.clear();
    }

    @Override
    public void close() {
        stop();
    }

    private void transition(LifecycleState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Environment " + name + " cannot go from " + state + " to " + next);
        }
        state = next;
    }

    // -- clients --

    public synchronized HttpTestClient httpClient() {
        requireStarted();
        if (httpClient == null) {
            httpClient = new HttpTestClient(backend.baseUrl(), results, properties.getTimeouts().getHttp());
        }
        return httpClient;
    }

    public synchronized ProtocolClient protocolClient() {
        if (protocolClient == null) {
            protocolClient = new ProtocolClient(httpClient(), results, properties.getTimeouts().getHttp());
        }
        return protocolClient;
    }

    /**
     * Launches a browser bound to the service URL. It is closed together with the environment.
     */
    public synchronized BrowserCapture browser() {
        requireStarted();
        var browser = BrowserCapture.launch(backend.baseUrl(), results, properties.getBrowser(),
                properties.getTimeouts().getBrowser());
        browsers.add(browser);
        return browser;
    }

    /**
     * @throws IllegalStateException if the backend is not containerized
     */
    public ContainerOrchestrator orchestrator() {
        if (backend instanceof ContainerizedBackend containerized) {
            return containerized.orchestrator();
        }
        throw new IllegalStateException("Environment " + name + " is not containerized");
    }

    private void requireStarted() {
        if (state != LifecycleState.STARTED) {
            throw new IllegalStateException("Environment " + name + " is " + state);
        }
    }

    // -- results --

    public void log(String format, Object... args) {
        results.log(format, args);
    }

    /**
     * Pulls service-side artifacts (the driver's results archive for a containerized backend)
     * into the results directory. Runs at most once, and only while STARTED. The summary
     * methods call it first so the summary stays the last artifact written.
     */
    public synchronized void collectArtifacts() {
        if (artifactsCollected || state != LifecycleState.STARTED) {
            return;
        }
        artifactsCollected = true;
        backend.collectArtifacts(cleanup);
    }

    public TestSummary writeSummary(boolean passed, String details, String... errors) {
        collectArtifacts();
        return results.writeSummary(passed, elapsed(), details, errors);
    }

    public TestSummary writeSkipped(String reason) {
        collectArtifacts();
        return results.writeSkipped(reason, elapsed());
    }

    public Duration elapsed() {
        return Duration.between(createdAt, Instant.now());
    }

    /**
     * Writes a small sample project under {@code data/test-projects/<name>} for the service to
     * register and index.
     *
     * @return the project directory
     */
    public Path createTestProject(String projectName) {
        Path dir = dataDir().resolve(TEST_PROJECTS_DIR).resolve(projectName);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve("main.go"), SAMPLE_SOURCE);
            Files.writeString(dir.resolve("go.mod"), "module " + projectName + "\n\ngo 1.21\n");
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.SETUP_FATAL, "Failed to create test project " + projectName, e);
        }
        results.log("Created test project {} at {}", projectName, dir);
        return dir;
    }

    private static final String SAMPLE_SOURCE = """
            package main

            import "fmt"

            // HelloWorld prints a greeting message.
            func HelloWorld() {
            \tfmt.Println("Hello, World!")
            }

            // Add adds two numbers together.
            func Add(a, b int) int {
            \treturn a + b
            }

            func main() {
            \tHelloWorld()
            \tfmt.Println(Add(1, 2))
            }
            """;

    // -- accessors --

    public String name() { return name; }
    public TestKind kind() { return kind; }
    public BackendType backendType() { return backend.type(); }
    public ServiceBackend backend() { return backend; }
    public ResultStore results() { return results; }
    public Path resultsDir() { return results.resultsDir(); }
    public Path dataDir() { return results.dataDir(); }
    public Path configPath() { return dataDir().resolve(CONFIG_FILE); }
    public String baseUrl() { return backend.baseUrl(); }
    public String internalBaseUrl() { return backend.internalBaseUrl(); }
    public synchronized LifecycleState state() { return state; }
    public List<String> cleanupFailures() { return cleanup.failures(); }

    /**
     * @return the allocated port for a local service, or -1 for other backends
     */
    public int port() {
        return backend instanceof LocalBackend local ? local.port() : -1;
    }
}
