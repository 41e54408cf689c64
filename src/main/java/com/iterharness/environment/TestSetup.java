package com.iterharness.environment;

import com.github.dockerjava.api.DockerClient;
import com.iterharness.container.ContainerOrchestrator;
import com.iterharness.container.DockerClients;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.core.logging.MdcContext;
import com.iterharness.core.model.BackendType;
import com.iterharness.core.model.TestKind;
import com.iterharness.core.port.PortAllocator;
import com.iterharness.core.results.ResultStore;
import com.iterharness.environment.backend.ContainerizedBackend;
import com.iterharness.environment.backend.ExternalBackend;
import com.iterharness.environment.backend.LocalBackend;
import com.iterharness.environment.backend.ServiceBackend;
import com.iterharness.process.BinaryServiceLauncher;
import com.iterharness.process.ProcessSpec;
import com.iterharness.process.ProcessSupervisor;
import com.iterharness.process.ServiceConfigWriter;
import com.iterharness.process.ServiceLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point for tests: builds a {@link TestEnvironment} on the right backend.
 *
 * <p>Backend precedence: an external URL wins, then containerized when requested, otherwise a
 * local child process. Tests outside a Spring context use {@link #fromEnvironment()}.
 */
public class TestSetup {

    private static final Logger log = LoggerFactory.getLogger(TestSetup.class);

    private final HarnessProperties properties;
    private final PortAllocator ports;
    private final HealthProbe healthProbe;
    private final ServiceLauncher launcher;
    private final Supplier<DockerClient> dockerClient;
    private final Map<String, String> environment;

    public TestSetup(HarnessProperties properties, PortAllocator ports, HealthProbe healthProbe,
                     ServiceLauncher launcher, Supplier<DockerClient> dockerClient,
                     Map<String, String> environment) {
        this.properties = properties;
        this.ports = ports;
        this.healthProbe = healthProbe;
        this.launcher = launcher;
        this.dockerClient = dockerClient;
        this.environment = Map.copyOf(environment);
    }

    /**
     * Configuration from {@code ITER_BASE_URL} and {@code TEST_DOCKER}, the process-wide port
     * allocator and the {@code iter-service} binary.
     */
    public static TestSetup fromEnvironment() {
        Map<String, String> env = System.getenv();
        var props = HarnessProperties.fromEnvironment(env);
        return new TestSetup(props,
                PortAllocator.shared(),
                new HealthProbe(props.getTimeouts().getProbe()),
                new BinaryServiceLauncher(props.getLocal().getBinary()),
                () -> DockerClients.create(env.get("DOCKER_HOST")),
                env);
    }

    public HarnessProperties properties() {
        return properties;
    }

    public BackendType selectBackend() {
        if (properties.isExternal()) {
            return BackendType.EXTERNAL;
        }
        return properties.isContainerized() ? BackendType.CONTAINERIZED : BackendType.LOCAL;
    }

    /**
     * Creates and starts an environment.
     */
    public TestEnvironment start(TestKind kind, String testName) {
        var env = create(kind, testName);
        env.start();
        return env;
    }

    /**
     * Creates an environment without starting it. Its results directory is fresh.
     */
    public TestEnvironment create(TestKind kind, String testName) {
        MdcContext.setTest(kind.directoryName(), testName);
        var results = ResultStore.create(properties.resultsRootPath(), kind, testName);
        BackendType type = selectBackend();
        log.info("Creating {} environment for {}/{}", type, kind.directoryName(), testName);
        ServiceBackend backend = switch (type) {
            case EXTERNAL -> new ExternalBackend(properties.getExternalUrl(), healthProbe,
                    properties.getTimeouts().getExternalReadiness(), properties.getTimeouts().getPollInterval());
            case CONTAINERIZED -> containerized(results);
            case LOCAL -> local(results);
        };
        return new TestEnvironment(testName, kind, results, backend, properties);
    }

    private ServiceBackend local(ResultStore results) {
        int port = ports.allocate();
        try {
            Path configPath = results.dataDir().resolve(TestEnvironment.CONFIG_FILE);
            var spec = new ProcessSpec("http://127.0.0.1:" + port, port, configPath, results.dataDir(),
                    results.resultsDir().resolve(TestEnvironment.SERVICE_LOG), forwardedCredentials());
            var supervisor = new ProcessSupervisor(launcher, configWriter(), healthProbe,
                    properties.getTimeouts(), spec);
            return new LocalBackend(ports, port, supervisor);
        } catch (RuntimeException e) {
            ports.release(port);
            throw e;
        }
    }

    private ServiceBackend containerized(ResultStore results) {
        var orchestrator = new ContainerOrchestrator(dockerClient.get(), healthProbe,
                properties.getContainer(), properties.getTimeouts(),
                ContainerOrchestrator.hostFromDockerHost(environment.get("DOCKER_HOST")));
        return new ContainerizedBackend(orchestrator, results, forwardedCredentials());
    }

    ServiceConfigWriter configWriter() {
        var local = properties.getLocal();
        Path extra = null;
        if (local.isIncludeExtraConfig() && local.getExtraConfigFile() != null && !local.getExtraConfigFile().isBlank()) {
            Path candidate = Path.of(local.getExtraConfigFile());
            if (Files.isRegularFile(candidate)) {
                extra = candidate;
            }
        }
        return new ServiceConfigWriter(local.getLogLevel(), extra);
    }

    Map<String, String> forwardedCredentials() {
        var forwarded = new HashMap<String, String>();
        String name = properties.getCredentialEnv();
        if (name != null && !name.isBlank()) {
            String value = environment.get(name);
            if (value != null && !value.isBlank()) {
                forwarded.put(name, value);
            }
        }
        return forwarded;
    }
}
