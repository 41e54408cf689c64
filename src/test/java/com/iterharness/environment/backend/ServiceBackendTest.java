package com.iterharness.environment.backend;

import com.iterharness.container.ContainerOrchestrator;
import com.iterharness.core.cleanup.CleanupSink;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.core.port.PortAllocator;
import com.iterharness.core.results.ResultStore;
import com.iterharness.process.ProcessSupervisor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the local, external and containerized backends.
 */
class ServiceBackendTest {

    // ── external ───────────────────────────────────────────────────────

    @Test
    void externalWaitsForHealthAndNeverStops() {
        var probe = mock(HealthProbe.class);
        var backend = new ExternalBackend("http://staging:19000/", probe, Duration.ofSeconds(10), Duration.ofMillis(100));

        backend.start();
        var sink = new CleanupSink();
        backend.stop(sink);

        assertEquals("http://staging:19000", backend.baseUrl());
        assertEquals(backend.baseUrl(), backend.internalBaseUrl());
        verify(probe).awaitHealthy("http://staging:19000", Duration.ofSeconds(10), Duration.ofMillis(100));
        verifyNoMoreInteractions(probe);
        assertTrue(sink.isClean());
    }

    @Test
    @DisplayName("an unhealthy external service fails the start")
    void externalReadinessTimeout() {
        var probe = mock(HealthProbe.class);
        when(probe.awaitHealthy(eq("http://staging:19000"), any(Duration.class), any(Duration.class)))
                .thenThrow(new HarnessException(ErrorKind.READINESS_TIMEOUT, "not healthy"));
        var backend = new ExternalBackend("http://staging:19000", probe, Duration.ofSeconds(10), Duration.ofMillis(100));

        var ex = assertThrows(HarnessException.class, backend::start);
        assertEquals(ErrorKind.READINESS_TIMEOUT, ex.kind());
    }

    // ── local ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("local stop releases the port even when the supervisor fails")
    void localStopAlwaysReleasesPort() {
        var ports = new PortAllocator(39600);
        int port = ports.allocate();
        var supervisor = mock(ProcessSupervisor.class);
        doThrow(new IllegalStateException("boom")).when(supervisor).stop();
        var backend = new LocalBackend(ports, port, supervisor);

        var sink = new CleanupSink();
        backend.stop(sink);

        assertFalse(ports.isLeased(port));
        assertEquals(1, sink.failures().size());
        assertEquals("http://127.0.0.1:" + port, backend.baseUrl());
    }

    // ── containerized ──────────────────────────────────────────────────

    @Test
    @DisplayName("artifact collection archives driver results and reports failures to the sink")
    void containerizedCollectsArtifactsBestEffort() {
        var orchestrator = mock(ContainerOrchestrator.class);
        var results = mock(ResultStore.class);
        var backend = new ContainerizedBackend(orchestrator, results, Map.of());
        when(orchestrator.archiveDriverResults(results))
                .thenReturn(true)
                .thenThrow(new HarnessException(ErrorKind.CONTAINER_FAILURE, "no such path"));

        var sink = new CleanupSink();
        backend.collectArtifacts(sink);
        assertTrue(sink.isClean());

        backend.collectArtifacts(sink);
        assertEquals(1, sink.failures().size());
        verify(orchestrator, never()).teardown(any(CleanupSink.class));
    }
}
