package com.iterharness.container;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PortBinding;
import com.github.dockerjava.api.model.Ports;
import com.iterharness.container.ContainerHandle.Role;
import com.iterharness.core.cleanup.CleanupSink;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.core.results.ResultStore;
import com.iterharness.core.timing.Deadline;
import com.iterharness.core.timing.Polling;
import com.iterharness.environment.HarnessProperties;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Docker topology for containerized tests: one bridge network, a primary container running
 * the service, and an optional driver container that reaches the service only by its network
 * alias. Both containers are created on that network alone, never on the engine's default
 * bridge, so concurrent topologies cannot see each other.
 *
 * <p>The primary's service port is published to a random host port so the test process can
 * reach it too. Drivers are kept alive with {@code tail -f /dev/null} and receive work through
 * {@link #exec}.
 *
 * <p>The topology lives at most as long as the suite timeout. Everything created is removed by
 * {@link #teardown}, including after a failed {@link #start}.
 */
public class ContainerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ContainerOrchestrator.class);

    public static final String RESULTS_ARCHIVE = "container-results.tar";
    private static final String[] DRIVER_KEEPALIVE = {"tail", "-f", "/dev/null"};

    private final DockerClient dockerClient;
    private final HealthProbe healthProbe;
    private final HarnessProperties.Container config;
    private final HarnessProperties.Timeouts timeouts;
    private final String dockerHostname;
    private final String runId;

    private String networkId;
    private ContainerHandle primary;
    private ContainerHandle driver;
    private String hostBaseUrl;
    private Deadline suiteDeadline;
    private final List<ContainerHandle> containers = new ArrayList<>();

    public ContainerOrchestrator(DockerClient dockerClient, HealthProbe healthProbe,
                                 HarnessProperties.Container config, HarnessProperties.Timeouts timeouts,
                                 String dockerHostname) {
        this.dockerClient = dockerClient;
        this.healthProbe = healthProbe;
        this.config = config;
        this.timeouts = timeouts;
        this.dockerHostname = dockerHostname != null ? dockerHostname : "localhost";
        this.runId = UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Host name under which published container ports are reachable, taken from a
     * {@code tcp://host:port} {@code DOCKER_HOST}; {@code localhost} for local sockets.
     */
    public static String hostFromDockerHost(String dockerHost) {
        if (dockerHost == null || !dockerHost.startsWith("tcp://")) {
            return "localhost";
        }
        String rest = dockerHost.substring("tcp://".length());
        int colon = rest.indexOf(':');
        String host = colon >= 0 ? rest.substring(0, colon) : rest;
        int slash = host.indexOf('/');
        if (slash >= 0) host = host.substring(0, slash);
        return host.isBlank() ? "localhost" : host;
    }

    // -- prerequisites --

    /**
     * @throws HarnessException ENVIRONMENT_SKIP if the Docker engine does not answer
     */
    public void ping() {
        try {
            dockerClient.pingCmd().exec();
        } catch (RuntimeException e) {
            throw HarnessException.skip("Docker engine not reachable: " + e.getMessage());
        }
    }

    /**
     * @throws HarnessException ENVIRONMENT_SKIP if the driver credentials file is absent
     */
    public Path requireCredentials() {
        Path file = Path.of(config.getCredentialsFile());
        if (!Files.isRegularFile(file)) {
            throw HarnessException.skip("Credentials file not found: " + file);
        }
        return file;
    }

    /**
     * Builds {@code tag} from {@code dockerfile} unless the image already exists locally.
     * A build is bounded by what is left of the suite lifetime.
     */
    public void ensureImage(String tag, Path dockerfile, Path context) {
        try {
            dockerClient.inspectImageCmd(tag).exec();
            log.debug("Image {} present", tag);
            return;
        } catch (NotFoundException e) {
            log.info("Image {} not found locally, building from {}", tag, dockerfile);
        }
        if (!Files.isRegularFile(dockerfile)) {
            throw new HarnessException(ErrorKind.SETUP_FATAL, "Dockerfile not found: " + dockerfile);
        }
        Duration budget = suiteDeadline != null ? suiteDeadline.remaining() : timeouts.getSuite();
        try {
            String imageId = dockerClient.buildImageCmd()
                    .withDockerfile(dockerfile.toFile())
                    .withBaseDirectory(context.toFile())
                    .withTags(Set.of(tag))
                    .exec(new BuildImageResultCallback())
                    .awaitImageId(budget.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Built image {} ({})", tag, imageId);
        } catch (DockerException | DockerClientException e) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE, "Failed to build image " + tag, e);
        }
    }

    // -- lifecycle --

    /**
     * Creates the network and starts the primary container, plus the driver when configured.
     * Blocks until the primary answers {@code /health} and the driver accepts execs. Image
     * preparation counts against the suite lifetime, the rest against the container startup
     * timeout.
     * On failure every resource created so far is removed before the exception propagates.
     *
     * @param serviceEnv extra environment for the primary container
     * @throws HarnessException CONTAINER_FAILURE, READINESS_TIMEOUT or TIMEOUT
     */
    public synchronized void start(Map<String, String> serviceEnv) {
        if (networkId != null) {
            throw new IllegalStateException("Topology already started");
        }
        suiteDeadline = Deadline.after(timeouts.getSuite());
        try {
            ping();
            if (config.isBuildImages()) {
                Path context = Path.of(config.getBuildContext());
                ensureImage(config.getServiceImage(), context.resolve(config.getServiceDockerfile()), context);
                if (config.isStartDriver()) {
                    ensureImage(config.getDriverImage(), context.resolve(config.getDriverDockerfile()), context);
                }
            }
            suiteDeadline.check("image preparation");
            Deadline startup = Deadline.after(timeouts.getContainerStartup());

            networkId = docker("create network", () -> dockerClient.createNetworkCmd()
                    .withName(networkName())
                    .withDriver("bridge")
                    .exec()
                    .getId());
            log.info("Created network {} ({})", networkName(), networkId);

            primary = startPrimary(serviceEnv);
            hostBaseUrl = "http://" + dockerHostname + ":" + hostPort(primary);
            healthProbe.awaitHealthy(hostBaseUrl, startup, timeouts.getPollInterval());
            log.info("Primary container {} healthy at {}", primary.name(), hostBaseUrl);

            if (config.isStartDriver()) {
                driver = startDriver();
                awaitDriver(driver);
            }
        } catch (RuntimeException e) {
            var sink = new CleanupSink();
            teardown(sink);
            throw e;
        }
    }

    private ContainerHandle startPrimary(Map<String, String> serviceEnv) {
        var port = ExposedPort.tcp(config.getServicePort());
        var env = new ArrayList<String>();
        serviceEnv.forEach((k, v) -> env.add(k + "=" + v));
        String name = containerName(config.getServiceAlias());

        String id = docker("create primary container", () -> dockerClient.createContainerCmd(config.getServiceImage())
                .withName(name)
                .withEnv(env)
                .withExposedPorts(port)
                .withHostConfig(HostConfig.newHostConfig()
                        .withNetworkMode(networkName())
                        .withPortBindings(new PortBinding(Ports.Binding.empty(), port)))
                .withAliases(config.getServiceAlias())
                .exec()
                .getId());
        var handle = new ContainerHandle(id, name, config.getServiceAlias(), Role.PRIMARY);
        containers.add(handle);
        startContainer(handle);
        return handle;
    }

    private ContainerHandle startDriver() {
        String name = containerName(config.getDriverAlias());
        String id = docker("create driver container", () -> dockerClient.createContainerCmd(config.getDriverImage())
                .withName(name)
                .withEnv("ITER_BASE_URL=" + config.internalBaseUrl(), "HOME=" + config.getDriverHome())
                .withCmd(DRIVER_KEEPALIVE)
                .withHostConfig(HostConfig.newHostConfig().withNetworkMode(networkName()))
                .withAliases(config.getDriverAlias())
                .exec()
                .getId());
        var handle = new ContainerHandle(id, name, config.getDriverAlias(), Role.DRIVER);
        containers.add(handle);
        startContainer(handle);
        return handle;
    }

    private void startContainer(ContainerHandle handle) {
        docker("start " + handle.name(), () -> {
            dockerClient.startContainerCmd(handle.id()).exec();
            return null;
        });
        log.info("Started {} container {} as '{}'", handle.role(), handle.name(), handle.alias());
    }

    private void awaitDriver(ContainerHandle handle) {
        Duration window = timeouts.getDriverStartup();
        boolean ready = Polling.until(window, timeouts.getPollInterval(), () -> {
            try {
                ExecResult r = exec(handle, List.of("echo", "ready"));
                return r.succeeded() && r.output().contains("ready");
            } catch (HarnessException e) {
                log.debug("Driver {} not ready yet: {}", handle.name(), e.getMessage());
                return false;
            }
        });
        if (!ready) {
            throw new HarnessException(ErrorKind.READINESS_TIMEOUT,
                    "Driver " + handle.name() + " not ready within " + window.toMillis() + "ms");
        }
        log.info("Driver container {} ready", handle.name());
    }

    private String hostPort(ContainerHandle handle) {
        InspectContainerResponse inspect = docker("inspect " + handle.name(),
                () -> dockerClient.inspectContainerCmd(handle.id()).exec());
        Ports.Binding[] bindings = inspect.getNetworkSettings().getPorts().getBindings()
                .get(ExposedPort.tcp(config.getServicePort()));
        if (bindings == null || bindings.length == 0 || bindings[0].getHostPortSpec() == null) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE,
                    "Port " + config.getServicePort() + " of " + handle.name() + " is not published");
        }
        return bindings[0].getHostPortSpec();
    }

    // -- accessors --

    public synchronized ContainerHandle primary() { return primary; }
    public synchronized ContainerHandle driver() { return driver; }
    public synchronized String networkId() { return networkId; }

    /** URL of the primary as seen from the test process. */
    public synchronized String hostBaseUrl() { return hostBaseUrl; }

    /** URL of the primary as seen from other containers on the network. */
    public String internalBaseUrl() { return config.internalBaseUrl(); }

    // -- exec --

    public ExecResult exec(ContainerHandle container, List<String> argv) {
        return exec(container, argv, null);
    }

    public ExecResult execBash(ContainerHandle container, String script) {
        return exec(container, List.of("bash", "-c", script));
    }

    /**
     * Runs {@code argv} in the container and collects stdout and stderr. Bounded by the exec
     * timeout and whatever is left of the suite lifetime.
     *
     * @throws HarnessException TIMEOUT if the command does not finish in time
     */
    public ExecResult exec(ContainerHandle container, List<String> argv, String user) {
        Duration timeout = suiteDeadline != null ? suiteDeadline.cap(timeouts.getExec()) : timeouts.getExec();
        var cmd = dockerClient.execCreateCmd(container.id())
                .withAttachStdout(true)
                .withAttachStderr(true)
                .withCmd(argv.toArray(new String[0]));
        if (user != null) {
            cmd = cmd.withUser(user);
        }
        var create = cmd;
        String execId = docker("exec create in " + container.name(), () -> create.exec().getId());

        var output = new StringBuilder();
        boolean completed;
        try {
            completed = dockerClient.execStartCmd(execId)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            synchronized (output) {
                                output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                            }
                        }
                    })
                    .awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE, "Interrupted during exec in " + container.name(), e);
        } catch (DockerException e) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE, "Exec failed in " + container.name() + ": " + argv, e);
        }
        if (!completed) {
            throw new HarnessException(ErrorKind.TIMEOUT,
                    "Exec in " + container.name() + " did not finish within " + timeout.toMillis() + "ms: " + argv);
        }

        Long exitCode = docker("exec inspect", () -> dockerClient.inspectExecCmd(execId).exec().getExitCodeLong());
        String text;
        synchronized (output) {
            text = output.toString();
        }
        log.debug("Exec in {} {} -> {}", container.name(), argv, exitCode);
        return new ExecResult(exitCode != null ? exitCode.intValue() : -1, text);
    }

    // -- files --

    /**
     * Copies {@code content} to {@code remotePath} inside the container, creating the parent
     * directory first. {@code mode} is the octal file mode, e.g. {@code 0600}.
     */
    public void copyFile(ContainerHandle container, byte[] content, String remotePath, int mode) {
        int slash = remotePath.lastIndexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("remotePath must be absolute with a parent directory: " + remotePath);
        }
        String dir = remotePath.substring(0, slash);
        String fileName = remotePath.substring(slash + 1);

        ExecResult mkdir = exec(container, List.of("mkdir", "-p", dir), "root");
        if (!mkdir.succeeded()) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE,
                    "mkdir -p " + dir + " failed in " + container.name() + ": " + mkdir.output());
        }

        byte[] tar = tar(fileName, content, mode);
        docker("copy " + remotePath + " to " + container.name(), () -> {
            dockerClient.copyArchiveToContainerCmd(container.id())
                    .withTarInputStream(new ByteArrayInputStream(tar))
                    .withRemotePath(dir)
                    .exec();
            return null;
        });
        log.debug("Copied {} bytes to {}:{}", content.length, container.name(), remotePath);
    }

    static byte[] tar(String entryName, byte[] content, int mode) {
        var buffer = new ByteArrayOutputStream();
        try (var out = new TarArchiveOutputStream(buffer)) {
            var entry = new TarArchiveEntry(entryName);
            entry.setSize(content.length);
            entry.setMode(mode);
            out.putArchiveEntry(entry);
            out.write(content);
            out.closeArchiveEntry();
            out.finish();
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE, "Failed to build tar for " + entryName, e);
        }
        return buffer.toByteArray();
    }

    /**
     * Returns a tar archive of {@code path} inside the container.
     */
    public byte[] copyFromContainer(ContainerHandle container, String path) {
        try (InputStream in = dockerClient.copyArchiveFromContainerCmd(container.id(), path).exec()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE,
                    "Failed to read " + path + " from " + container.name(), e);
        } catch (DockerException e) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE,
                    "Failed to copy " + path + " from " + container.name(), e);
        }
    }

    /**
     * Copies the host credentials file into the driver's home and hands it to the driver user.
     *
     * @throws HarnessException ENVIRONMENT_SKIP if the credentials file is absent
     */
    public void provisionCredentials(ContainerHandle container) {
        Path file = requireCredentials();
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.SETUP_FATAL, "Failed to read credentials " + file, e);
        }
        String dir = config.getDriverHome() + "/.claude";
        copyFile(container, content, dir + "/.credentials.json", 0600);
        String owner = config.getDriverUser() + ":" + config.getDriverUser();
        ExecResult chown = exec(container, List.of("chown", "-R", owner, dir), "root");
        if (!chown.succeeded()) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE,
                    "chown " + dir + " failed in " + container.name() + ": " + chown.output());
        }
        log.info("Provisioned credentials into {}", container.name());
    }

    // -- network checks --

    /**
     * Requests {@code http://{alias}:{servicePort}/health} from the driver. An unknown alias
     * yields a non-zero exit status.
     */
    public ExecResult probeAlias(String alias) {
        if (driver == null) {
            throw new IllegalStateException("No driver container running");
        }
        return execBash(driver, DriverCommands.probeAlias(alias, config.getServicePort()));
    }

    // -- teardown --

    /**
     * Saves a tar of the driver's results directory into {@code results} as
     * {@value #RESULTS_ARCHIVE}. Does nothing without a running driver.
     *
     * @return whether an archive was saved
     */
    public synchronized boolean archiveDriverResults(ResultStore results) {
        if (driver == null) {
            return false;
        }
        results.save(RESULTS_ARCHIVE, copyFromContainer(driver, config.getDriverResultsPath()));
        log.info("Archived driver results from {}", driver.name());
        return true;
    }

    /**
     * Removes every container and the network. Already-removed resources are tolerated.
     */
    public synchronized void teardown(CleanupSink sink) {
        for (int i = containers.size() - 1; i >= 0; i--) {
            ContainerHandle handle = containers.get(i);
            sink.run("stop " + handle.name(), () -> stopContainer(handle));
            sink.run("remove " + handle.name(), () -> removeContainer(handle));
        }
        containers.clear();
        if (networkId != null) {
            String id = networkId;
            sink.run("remove network " + networkName(), () -> removeNetwork(id));
            networkId = null;
        }
        primary = null;
        driver = null;
        hostBaseUrl = null;
    }

    private void stopContainer(ContainerHandle handle) {
        try {
            dockerClient.stopContainerCmd(handle.id())
                    .withTimeout((int) timeouts.getShutdownGrace().toSeconds())
                    .exec();
        } catch (NotFoundException | NotModifiedException e) {
            log.debug("Container {} already stopped: {}", handle.name(), e.getMessage());
        }
    }

    private void removeContainer(ContainerHandle handle) {
        try {
            dockerClient.removeContainerCmd(handle.id()).withForce(true).withRemoveVolumes(true).exec();
            log.info("Removed container {}", handle.name());
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", handle.name());
        }
    }

    private void removeNetwork(String id) {
        try {
            dockerClient.removeNetworkCmd(id).exec();
            log.info("Removed network {}", networkName());
        } catch (NotFoundException e) {
            log.debug("Network {} already removed", networkName());
        }
    }

    // -- helpers --

    String networkName() {
        return "iter-test-" + runId;
    }

    String containerName(String alias) {
        return "iter-test-" + runId + "-" + alias;
    }

    @FunctionalInterface
    private interface DockerCall<T> {
        T call();
    }

    private static <T> T docker(String action, DockerCall<T> call) {
        try {
            return call.call();
        } catch (DockerException e) {
            throw new HarnessException(ErrorKind.CONTAINER_FAILURE, "Docker " + action + " failed: " + e.getMessage(), e);
        }
    }
}
