package com.iterharness.environment;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "harness")
public class HarnessProperties {

    public static final String EXTERNAL_URL_ENV = "ITER_BASE_URL";
    public static final String CONTAINERIZED_ENV = "TEST_DOCKER";
    public static final String RESULTS_ROOT_ENV = "ITER_RESULTS_ROOT";
    public static final String SERVICE_BINARY_ENV = "ITER_SERVICE_BINARY";

    private String resultsRoot = "target/results";
    private String externalUrl = "";
    private boolean containerized = false;
    private int basePort = 19000;
    private String credentialEnv = "GOOGLE_GEMINI_API_KEY";

    private Local local = new Local();
    private Container container = new Container();
    private Browser browser = new Browser();
    private Timeouts timeouts = new Timeouts();

    /**
     * Builds properties for callers outside a Spring context, applying the same environment
     * overrides as {@code application.yml}: {@code ITER_BASE_URL}, {@code TEST_DOCKER},
     * {@code ITER_RESULTS_ROOT} and {@code ITER_SERVICE_BINARY}. Blank values are ignored.
     */
    public static HarnessProperties fromEnvironment(Map<String, String> env) {
        var props = new HarnessProperties();
        String external = env.get(EXTERNAL_URL_ENV);
        if (external != null && !external.isBlank()) {
            props.setExternalUrl(external.trim());
        }
        String docker = env.get(CONTAINERIZED_ENV);
        if (docker != null) {
            props.setContainerized("1".equals(docker.trim()) || "true".equalsIgnoreCase(docker.trim()));
        }
        String resultsRoot = env.get(RESULTS_ROOT_ENV);
        if (resultsRoot != null && !resultsRoot.isBlank()) {
            props.setResultsRoot(resultsRoot.trim());
        }
        String binary = env.get(SERVICE_BINARY_ENV);
        if (binary != null && !binary.isBlank()) {
            props.getLocal().setBinary(binary.trim());
        }
        return props;
    }

    public boolean isExternal() {
        return externalUrl != null && !externalUrl.isBlank();
    }

    public Path resultsRootPath() {
        return Path.of(resultsRoot);
    }

    public String getResultsRoot() { return resultsRoot; }
    public void setResultsRoot(String resultsRoot) { this.resultsRoot = resultsRoot; }
    public String getExternalUrl() { return externalUrl; }
    public void setExternalUrl(String externalUrl) { this.externalUrl = externalUrl; }
    public boolean isContainerized() { return containerized; }
    public void setContainerized(boolean containerized) { this.containerized = containerized; }
    public int getBasePort() { return basePort; }
    public void setBasePort(int basePort) { this.basePort = basePort; }
    public String getCredentialEnv() { return credentialEnv; }
    public void setCredentialEnv(String credentialEnv) { this.credentialEnv = credentialEnv; }

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }
    public Container getContainer() { return container; }
    public void setContainer(Container container) { this.container = container; }
    public Browser getBrowser() { return browser; }
    public void setBrowser(Browser browser) { this.browser = browser; }
    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }

    public static class Local {
        private String binary = "";
        private String extraConfigFile = "tests/config/config.toml";
        private boolean includeExtraConfig = true;
        private String logLevel = "debug";

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getExtraConfigFile() { return extraConfigFile; }
        public void setExtraConfigFile(String extraConfigFile) { this.extraConfigFile = extraConfigFile; }
        public boolean isIncludeExtraConfig() { return includeExtraConfig; }
        public void setIncludeExtraConfig(boolean includeExtraConfig) { this.includeExtraConfig = includeExtraConfig; }
        public String getLogLevel() { return logLevel; }
        public void setLogLevel(String logLevel) { this.logLevel = logLevel; }
    }

    public static class Container {
        private String serviceImage = "iter-test:latest";
        private String driverImage = "claude-test:latest";
        private String serviceAlias = "iter";
        private String driverAlias = "claude";
        private int servicePort = 19000;
        private String serviceDockerfile = "tests/docker/Dockerfile.iter";
        private String driverDockerfile = "tests/docker/Dockerfile.claude";
        private String buildContext = ".";
        private boolean buildImages = false;
        private boolean startDriver = true;
        private String credentialsFile = System.getProperty("user.home") + "/.claude/.credentials.json";
        private String driverUser = "testuser";
        private String driverHome = "/home/testuser";
        private String driverResultsPath = "/home/testuser/results";

        public String getServiceImage() { return serviceImage; }
        public void setServiceImage(String serviceImage) { this.serviceImage = serviceImage; }
        public String getDriverImage() { return driverImage; }
        public void setDriverImage(String driverImage) { this.driverImage = driverImage; }
        public String getServiceAlias() { return serviceAlias; }
        public void setServiceAlias(String serviceAlias) { this.serviceAlias = serviceAlias; }
        public String getDriverAlias() { return driverAlias; }
        public void setDriverAlias(String driverAlias) { this.driverAlias = driverAlias; }
        public int getServicePort() { return servicePort; }
        public void setServicePort(int servicePort) { this.servicePort = servicePort; }
        public String getServiceDockerfile() { return serviceDockerfile; }
        public void setServiceDockerfile(String serviceDockerfile) { this.serviceDockerfile = serviceDockerfile; }
        public String getDriverDockerfile() { return driverDockerfile; }
        public void setDriverDockerfile(String driverDockerfile) { this.driverDockerfile = driverDockerfile; }
        public String getBuildContext() { return buildContext; }
        public void setBuildContext(String buildContext) { this.buildContext = buildContext; }
        public boolean isBuildImages() { return buildImages; }
        public void setBuildImages(boolean buildImages) { this.buildImages = buildImages; }
        public boolean isStartDriver() { return startDriver; }
        public void setStartDriver(boolean startDriver) { this.startDriver = startDriver; }
        public String getCredentialsFile() { return credentialsFile; }
        public void setCredentialsFile(String credentialsFile) { this.credentialsFile = credentialsFile; }
        public String getDriverUser() { return driverUser; }
        public void setDriverUser(String driverUser) { this.driverUser = driverUser; }
        public String getDriverHome() { return driverHome; }
        public void setDriverHome(String driverHome) { this.driverHome = driverHome; }
        public String getDriverResultsPath() { return driverResultsPath; }
        public void setDriverResultsPath(String driverResultsPath) { this.driverResultsPath = driverResultsPath; }

        /** URL drivers use to reach the service over the container network. */
        public String internalBaseUrl() {
            return "http://" + serviceAlias + ":" + servicePort;
        }
    }

    public static class Browser {
        private boolean headless = true;
        private int width = 1280;
        private int height = 800;

        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }
        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }
        public int getHeight() { return height; }
        public void setHeight(int height) { this.height = height; }
    }

    /**
     * Every bound the harness waits on. Defaults match the documented behavior of each component.
     */
    public static class Timeouts {
        private Duration readiness = Duration.ofSeconds(30);
        private Duration externalReadiness = Duration.ofSeconds(10);
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private Duration portRelease = Duration.ofSeconds(5);
        private Duration containerStartup = Duration.ofSeconds(60);
        private Duration driverStartup = Duration.ofSeconds(30);
        private Duration suite = Duration.ofMinutes(10);
        private Duration exec = Duration.ofMinutes(5);
        private Duration browser = Duration.ofSeconds(60);
        private Duration http = Duration.ofSeconds(30);
        private Duration probe = Duration.ofSeconds(2);
        private Duration pollInterval = Duration.ofMillis(100);

        public Duration getReadiness() { return readiness; }
        public void setReadiness(Duration readiness) { this.readiness = readiness; }
        public Duration getExternalReadiness() { return externalReadiness; }
        public void setExternalReadiness(Duration externalReadiness) { this.externalReadiness = externalReadiness; }
        public Duration getShutdownGrace() { return shutdownGrace; }
        public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
        public Duration getPortRelease() { return portRelease; }
        public void setPortRelease(Duration portRelease) { this.portRelease = portRelease; }
        public Duration getContainerStartup() { return containerStartup; }
        public void setContainerStartup(Duration containerStartup) { this.containerStartup = containerStartup; }
        public Duration getDriverStartup() { return driverStartup; }
        public void setDriverStartup(Duration driverStartup) { this.driverStartup = driverStartup; }
        public Duration getSuite() { return suite; }
        public void setSuite(Duration suite) { this.suite = suite; }
        public Duration getExec() { return exec; }
        public void setExec(Duration exec) { this.exec = exec; }
        public Duration getBrowser() { return browser; }
        public void setBrowser(Duration browser) { this.browser = browser; }
        public Duration getHttp() { return http; }
        public void setHttp(Duration http) { this.http = http; }
        public Duration getProbe() { return probe; }
        public void setProbe(Duration probe) { this.probe = probe; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }
}
