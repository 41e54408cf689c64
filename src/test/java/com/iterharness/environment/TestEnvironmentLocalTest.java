package com.iterharness.environment;

import com.fasterxml.jackson.databind.JsonNode;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.core.model.BackendType;
import com.iterharness.core.model.LifecycleState;
import com.iterharness.core.model.TestKind;
import com.iterharness.core.model.TestOutcome;
import com.iterharness.core.port.PortAllocator;
import com.iterharness.core.results.ResultStore;
import com.iterharness.process.ServiceLauncher;
import com.iterharness.browser.BrowserCapture;
import com.iterharness.scenario.SmokeScenario;
import com.iterharness.scenario.UiScenario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests of the local backend against {@link FakeIterService} running as a real child
 * process on an allocated port.
 */
class TestEnvironmentLocalTest {

    @TempDir
    Path root;

    private PortAllocator ports;
    private HealthProbe probe;
    private TestSetup setup;

    @BeforeEach
    void setUp() {
        var props = new HarnessProperties();
        props.setResultsRoot(root.toString());
        props.getLocal().setIncludeExtraConfig(false);
        props.getTimeouts().setReadiness(Duration.ofSeconds(30));
        ports = new PortAllocator(39200);
        probe = new HealthProbe(Duration.ofSeconds(1));
        setup = new TestSetup(props, ports, probe, fakeService(),
                () -> { throw new AssertionError("docker not used"); }, Map.of());
    }

    static ServiceLauncher fakeService() {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        String classpath = System.getProperty("java.class.path");
        return configPath -> List.of(java, "-cp", classpath, FakeIterService.class.getName(),
                "serve", "--config", configPath.toString());
    }

    // ── lifecycle ──────────────────────────────────────────────────────

    @Test
    @DisplayName("start serves /health, stop frees the port")
    void startAndStop() throws Exception {
        var env = setup.start(TestKind.SERVICE, "lifecycle");
        String baseUrl = env.baseUrl();
        int port = env.port();
        try {
            assertEquals(BackendType.LOCAL, env.backendType());
            assertEquals(LifecycleState.STARTED, env.state());
            assertTrue(ports.isLeased(port));
            var health = env.httpClient().get("/health");
            assertEquals(200, health.status());
            assertEquals("ok", health.json().path("status").asText());
            assertTrue(Files.readString(env.configPath()).contains("port = " + port));
        } finally {
            env.stop();
        }

        assertEquals(LifecycleState.STOPPED, env.state());
        assertTrue(env.cleanupFailures().isEmpty(), env.cleanupFailures().toString());
        assertTrue(probe.check(baseUrl).isUnreachable());
        assertFalse(ports.isLeased(port));
        assertTrue(Files.isRegularFile(env.resultsDir().resolve(TestEnvironment.SERVICE_LOG)));
    }

    @Test
    @DisplayName("concurrent environments get distinct ports and directories")
    void concurrentEnvironmentsAreIsolated() {
        var first = CompletableFuture.supplyAsync(() -> setup.start(TestKind.API, "first"));
        var second = CompletableFuture.supplyAsync(() -> setup.start(TestKind.API, "second"));
        try (var a = first.join(); var b = second.join()) {
            assertNotEquals(a.port(), b.port());
            assertNotEquals(a.dataDir(), b.dataDir());
            assertEquals(200, a.httpClient().get("/health").status());
            assertEquals(200, b.httpClient().get("/health").status());
        }
    }

    // ── service behavior ───────────────────────────────────────────────

    @Test
    @DisplayName("a registered and indexed project is searchable")
    void registerIndexSearch() {
        try (var env = setup.start(TestKind.API, "search")) {
            Path project = env.createTestProject("sample");
            var http = env.httpClient();

            var created = http.post("/projects", Map.of("path", project.toString()));
            assertEquals(201, created.status());
            String id = created.json().path("id").asText();
            assertEquals(200, http.post("/projects/" + id + "/index", "{}").status());

            var search = http.post("/projects/" + id + "/search", Map.of("query", "HelloWorld greeting", "limit", 5));
            assertEquals(200, search.status());
            JsonNode results = search.json().path("results");
            assertTrue(results.isArray());
            assertFalse(results.isEmpty());
            assertEquals(id, results.get(0).path("project").asText());

            var unknown = http.post("/projects/nonexistent-id-12345/search", Map.of("query", "HelloWorld"));
            assertEquals(404, unknown.status());
        }
    }

    @Test
    @DisplayName("the smoke scenario passes against a healthy service")
    void smokeScenarioPasses() {
        try (var env = setup.start(TestKind.MCP, "smoke")) {
            var summary = new SmokeScenario().run(env);

            assertEquals(TestOutcome.PASSED, summary.outcome(), summary.errors().toString());
            assertTrue(Files.isRegularFile(env.resultsDir().resolve(ResultStore.SUMMARY_JSON)));
            assertTrue(Files.isRegularFile(env.resultsDir().resolve(ResultStore.SUMMARY_MD)));
        }
    }

    @Test
    @DisplayName("the UI scenario passes when both screenshots are captured")
    void uiScenarioPasses() {
        try (var env = setup.start(TestKind.UI, "home")) {
            var browser = recordingBrowser(env, true);

            var summary = new UiScenario().run(env, browser);

            assertEquals(TestOutcome.PASSED, summary.outcome(), summary.errors().toString());
            assertEquals(List.of("01-before.png", "02-after.png"), summary.screenshots());
            verify(browser).navigateAndScreenshot("/web/", "01-before");
        }
    }

    @Test
    @DisplayName("a missing required screenshot fails the UI scenario")
    void uiScenarioFailsWithoutAfterScreenshot() {
        try (var env = setup.start(TestKind.UI, "missing")) {
            var browser = recordingBrowser(env, false);

            var summary = new UiScenario().run(env, browser);

            assertEquals(TestOutcome.FAILED, summary.outcome());
            assertTrue(summary.errors().stream().anyMatch(e -> e.contains("02-after")), summary.errors().toString());
        }
    }

    /**
     * Browser double that writes placeholder PNGs through the environment's result store.
     */
    private static BrowserCapture recordingBrowser(TestEnvironment env, boolean captureAfter) {
        var browser = mock(BrowserCapture.class);
        when(browser.navigateAndScreenshot(anyString(), anyString()))
                .thenAnswer(inv -> env.results().save(inv.getArgument(1) + ".png", new byte[]{1}));
        when(browser.fullPageScreenshot(anyString())).thenAnswer(inv -> captureAfter
                ? env.results().save(inv.getArgument(0) + ".png", new byte[]{1})
                : null);
        return browser;
    }
}
