package com.iterharness.environment.backend;

import com.iterharness.core.cleanup.CleanupSink;
import com.iterharness.core.model.BackendType;

/**
 * One way of providing a running service to a test.
 */
public interface ServiceBackend {

    BackendType type();

    /**
     * Provisions the service and blocks until it is ready to serve.
     */
    void start();

    /**
     * Releases everything {@link #start()} acquired. Failures go to {@code sink}, never up.
     */
    void stop(CleanupSink sink);

    /**
     * Copies artifacts the service side produced into the test's results. Runs before the
     * summary is written; failures go to {@code sink}.
     */
    default void collectArtifacts(CleanupSink sink) {
    }

    /** URL the test process uses to reach the service. */
    String baseUrl();

    /** URL other containers use to reach the service. Same as {@link #baseUrl()} outside Docker. */
    default String internalBaseUrl() {
        return baseUrl();
    }
}
