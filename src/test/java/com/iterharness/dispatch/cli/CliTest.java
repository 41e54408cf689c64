package com.iterharness.dispatch.cli;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.core.health.HealthStatus;
import com.iterharness.core.model.BackendType;
import com.iterharness.core.model.TestKind;
import com.iterharness.core.model.TestOutcome;
import com.iterharness.core.model.TestSummary;
import com.iterharness.environment.HarnessProperties;
import com.iterharness.environment.TestEnvironment;
import com.iterharness.environment.TestSetup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the harness CLI command structure.
 * Commands are built through a picocli factory with mocked collaborators, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private HealthProbe healthProbe = mock(HealthProbe.class);
    private TestSetup testSetup = mock(TestSetup.class);
    private final HarnessProperties properties = new HarnessProperties();

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ProbeCommand.class) {
                    return (K) new ProbeCommand(healthProbe);
                }
                if (cls == SmokeCommand.class) {
                    return (K) new SmokeCommand(testSetup);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new HarnessCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static TestSummary summary(TestOutcome outcome, String details, String... errors) {
        return new TestSummary("smoke", outcome == TestOutcome.PASSED, outcome, "0.100s",
                "2026-01-01T00:00:00Z", List.of(), List.of("test.log"), details, List.of(errors));
    }

    // ── help ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("probe"));
            assertTrue(result.output().contains("smoke"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("iter-harness 0.1.0"));
        }

        @Test
        void smokeHelpShowsOptions() {
            CliResult result = execute("smoke", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--containerized"));
            assertTrue(result.output().contains("--external-url"));
        }
    }

    // ── probe ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("probe")
    class ProbeTests {

        @Test
        void healthyServiceExitsZero() {
            when(healthProbe.check("http://127.0.0.1:19000"))
                    .thenReturn(new HealthStatus("health", HealthStatus.Status.UP, "HTTP 200", Map.of()));

            CliResult result = execute("probe", "http://127.0.0.1:19000");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("UP"));
        }

        @Test
        void unreachableServiceExitsOne() {
            when(healthProbe.check(anyString()))
                    .thenReturn(new HealthStatus("health", HealthStatus.Status.DOWN, "Connection refused", Map.of()));

            CliResult result = execute("probe", "http://127.0.0.1:1");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Connection refused"));
        }
    }

    // ── smoke ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("smoke")
    class SmokeTests {

        private TestEnvironment env = mock(TestEnvironment.class);

        private void wire() {
            when(testSetup.properties()).thenReturn(properties);
            when(testSetup.selectBackend()).thenAnswer(inv -> properties.isExternal()
                    ? BackendType.EXTERNAL : BackendType.LOCAL);
            when(testSetup.create(any(TestKind.class), anyString())).thenReturn(env);
        }

        @Test
        @DisplayName("a skipped start exits 2 and still writes a summary")
        void skippedStart() {
            wire();
            doThrow(HarnessException.skip("Docker engine not reachable")).when(env).start();
            when(env.writeSkipped(anyString())).thenReturn(summary(TestOutcome.SKIPPED, "Skipped: Docker engine not reachable"));

            CliResult result = execute("smoke", "--containerized");

            assertEquals(SmokeCommand.EXIT_SKIPPED, result.exitCode());
            assertTrue(properties.isContainerized());
            assertTrue(result.output().contains("SKIP"));
            verify(env).close();
        }

        @Test
        void failedStartExitsOne() {
            wire();
            doThrow(new HarnessException(ErrorKind.READINESS_TIMEOUT, "not healthy")).when(env).start();
            when(env.writeSummary(eq(false), anyString(), any(String[].class)))
                    .thenReturn(summary(TestOutcome.FAILED, "Environment failed to start", "not healthy"));

            CliResult result = execute("smoke", "--kind", "api", "--name", "boot");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("FAIL"));
            verify(testSetup).create(TestKind.API, "boot");
            verify(env).close();
        }

        @Test
        void externalUrlSelectsExternalBackend() {
            wire();
            doThrow(HarnessException.skip("unreachable")).when(env).start();
            when(env.writeSkipped(anyString())).thenReturn(summary(TestOutcome.SKIPPED, "Skipped: unreachable"));

            CliResult result = execute("smoke", "--external-url", "http://staging:19000");

            assertEquals("http://staging:19000", properties.getExternalUrl());
            assertTrue(result.output().contains("EXTERNAL"));
        }
    }

    @Test
    void exitCodes() {
        assertEquals(0, SmokeCommand.exitCode(TestOutcome.PASSED));
        assertEquals(1, SmokeCommand.exitCode(TestOutcome.FAILED));
        assertEquals(2, SmokeCommand.exitCode(TestOutcome.SKIPPED));
    }
}
