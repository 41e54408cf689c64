package com.iterharness.environment.backend;

import com.iterharness.core.cleanup.CleanupSink;
import com.iterharness.core.health.HealthProbe;
import com.iterharness.core.model.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * An already-running service at a caller-supplied URL. The harness only waits for it to be
 * healthy and never starts or stops it.
 */
public class ExternalBackend implements ServiceBackend {

    private static final Logger log = LoggerFactory.getLogger(ExternalBackend.class);

    private final String baseUrl;
    private final HealthProbe healthProbe;
    private final Duration readiness;
    private final Duration pollInterval;

    public ExternalBackend(String baseUrl, HealthProbe healthProbe, Duration readiness, Duration pollInterval) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.healthProbe = healthProbe;
        this.readiness = readiness;
        this.pollInterval = pollInterval;
    }

    @Override
    public BackendType type() {
        return BackendType.EXTERNAL;
    }

    @Override
    public void start() {
        log.info("Using external service at {}", baseUrl);
        healthProbe.awaitHealthy(baseUrl, readiness, pollInterval);
    }

    @Override
    public void stop(CleanupSink sink) {
        // not ours to stop
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }
}
