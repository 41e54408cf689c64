package com.iterharness.core.health;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HealthProbeTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicInteger calls = new AtomicInteger();
    private final HealthProbe probe = new HealthProbe(Duration.ofSeconds(1));

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/health", exchange -> {
            calls.incrementAndGet();
            byte[] body = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) server.stop(0);
    }

    @Test
    @DisplayName("200 is UP")
    void upOn200() {
        var result = probe.check(baseUrl);
        assertEquals(HealthStatus.Status.UP, result.status());
        assertEquals("{\"status\":\"ok\"}", result.detail());
        assertEquals("200", result.metadata().get("statusCode"));
    }

    @Test
    @DisplayName("any other status is DEGRADED")
    void degradedOnError() {
        status.set(503);
        var result = probe.check(baseUrl);
        assertEquals(HealthStatus.Status.DEGRADED, result.status());
        assertFalse(result.isUnreachable());
    }

    @Test
    @DisplayName("nothing listening is DOWN")
    void downWhenNothingListens() throws IOException {
        int port;
        try (var socket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        var result = probe.check("http://127.0.0.1:" + port);
        assertTrue(result.isUnreachable());
    }

    @Test
    @DisplayName("awaitHealthy keeps polling until the service answers 200")
    void awaitHealthyPolls() {
        status.set(503);
        new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            status.set(200);
        }).start();

        var result = probe.awaitHealthy(baseUrl, Duration.ofSeconds(5), Duration.ofMillis(20));

        assertTrue(result.isUp());
        assertTrue(calls.get() > 1);
    }

    @Test
    @DisplayName("awaitHealthy raises READINESS_TIMEOUT with the last probe result")
    void awaitHealthyTimesOut() {
        status.set(500);
        var ex = assertThrows(HarnessException.class,
                () -> probe.awaitHealthy(baseUrl, Duration.ofMillis(300), Duration.ofMillis(50)));
        assertEquals(ErrorKind.READINESS_TIMEOUT, ex.kind());
        assertTrue(ex.getMessage().contains("DEGRADED"), ex.getMessage());
        assertTrue(ex.getMessage().contains("ms"));
    }

    @Test
    @DisplayName("awaitUnreachable is true once the server is gone")
    void awaitUnreachableAfterStop() {
        assertFalse(probe.awaitUnreachable(baseUrl, Duration.ofMillis(200), Duration.ofMillis(50)));
        server.stop(0);
        server = null;
        assertTrue(probe.awaitUnreachable(baseUrl, Duration.ofSeconds(3), Duration.ofMillis(50)));
    }
}
