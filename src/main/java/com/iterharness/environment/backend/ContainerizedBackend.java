package com.iterharness.environment.backend;

import com.iterharness.container.ContainerOrchestrator;
import com.iterharness.core.cleanup.CleanupSink;
import com.iterharness.core.model.BackendType;
import com.iterharness.core.results.ResultStore;

import java.util.Map;

/**
 * The service in a Docker container, with an optional driver container on the same network.
 */
public class ContainerizedBackend implements ServiceBackend {

    private final ContainerOrchestrator orchestrator;
    private final ResultStore results;
    private final Map<String, String> serviceEnv;

    public ContainerizedBackend(ContainerOrchestrator orchestrator, ResultStore results, Map<String, String> serviceEnv) {
        this.orchestrator = orchestrator;
        this.results = results;
        this.serviceEnv = Map.copyOf(serviceEnv);
    }

    @Override
    public BackendType type() {
        return BackendType.CONTAINERIZED;
    }

    @Override
    public void start() {
        orchestrator.start(serviceEnv);
    }

    @Override
    public void stop(CleanupSink sink) {
        orchestrator.teardown(sink);
    }

    @Override
    public void collectArtifacts(CleanupSink sink) {
        sink.run("archive driver results", () -> orchestrator.archiveDriverResults(results));
    }

    @Override
    public String baseUrl() {
        return orchestrator.hostBaseUrl();
    }

    @Override
    public String internalBaseUrl() {
        return orchestrator.internalBaseUrl();
    }

    public ContainerOrchestrator orchestrator() {
        return orchestrator;
    }
}
