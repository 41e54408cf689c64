package com.iterharness.core.health;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.timing.Deadline;
import com.iterharness.core.timing.Polling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls a service's {@code GET /health} endpoint.
 *
 * <p>Used by the process supervisor (readiness and port release), the container
 * orchestrator (primary container wait strategy) and the external backend.
 */
public class HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    public static final String HEALTH_PATH = "/health";

    private final HttpClient httpClient;
    private final Duration probeTimeout;

    public HealthProbe(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(probeTimeout)
                .build();
    }

    /**
     * Issues a single health request against {@code baseUrl}.
     */
    public HealthStatus check(String baseUrl) {
        String url = baseUrl + HEALTH_PATH;
        try {
            var request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(probeTimeout)
                    .GET()
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            var status = response.statusCode() == 200
                    ? HealthStatus.Status.UP
                    : HealthStatus.Status.DEGRADED;
            return new HealthStatus(url, status, response.body(),
                    Map.of("statusCode", String.valueOf(response.statusCode())));
        } catch (HttpTimeoutException e) {
            return new HealthStatus(url, HealthStatus.Status.DOWN,
                    "timeout: " + e.getMessage(), Map.of("error", "timeout"));
        } catch (ConnectException e) {
            return new HealthStatus(url, HealthStatus.Status.DOWN,
                    "connection refused", Map.of("error", "refused"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthStatus(url, HealthStatus.Status.DOWN,
                    "interrupted", Map.of("error", "interrupted"));
        } catch (Exception e) {
            return new HealthStatus(url, HealthStatus.Status.DOWN,
                    String.valueOf(e.getMessage()), Map.of("error", e.getClass().getSimpleName()));
        }
    }

    /**
     * Polls until the endpoint answers 200.
     *
     * @throws HarnessException READINESS_TIMEOUT, describing elapsed time and the last probe result
     */
    public HealthStatus awaitHealthy(String baseUrl, Duration timeout, Duration interval) {
        return awaitHealthy(baseUrl, Deadline.after(timeout), interval);
    }

    public HealthStatus awaitHealthy(String baseUrl, Deadline deadline, Duration interval) {
        long startNanos = System.nanoTime();
        var last = new AtomicReference<HealthStatus>();
        boolean healthy = Polling.until(deadline.remaining(), interval, () -> {
            var status = check(baseUrl);
            last.set(status);
            return status.isUp();
        });
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        if (!healthy) {
            var lastStatus = last.get();
            String lastError = lastStatus != null ? lastStatus.status() + " " + lastStatus.detail() : "no probe ran";
            throw new HarnessException(ErrorKind.READINESS_TIMEOUT,
                    "Service at " + baseUrl + " not healthy after " + elapsedMs + "ms (last probe: " + lastError + ")");
        }
        log.debug("Service at {} healthy after {}ms", baseUrl, elapsedMs);
        return last.get();
    }

    /**
     * Polls until nothing answers at {@code baseUrl}, proving the port was released.
     *
     * @return true if the endpoint went away before the timeout
     */
    public boolean awaitUnreachable(String baseUrl, Duration timeout, Duration interval) {
        boolean released = Polling.until(timeout, interval, () -> check(baseUrl).isUnreachable());
        if (!released) {
            log.warn("Service at {} still answering after {}ms", baseUrl, timeout.toMillis());
        }
        return released;
    }
}
