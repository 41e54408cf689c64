package com.iterharness.environment.backend;

import com.iterharness.core.cleanup.CleanupSink;
import com.iterharness.core.model.BackendType;
import com.iterharness.core.port.PortAllocator;
import com.iterharness.process.ProcessSupervisor;

/**
 * The service as a child process on an allocated loopback port. The port goes back to the
 * allocator once the process is down.
 */
public class LocalBackend implements ServiceBackend {

    private final PortAllocator ports;
    private final int port;
    private final ProcessSupervisor supervisor;

    public LocalBackend(PortAllocator ports, int port, ProcessSupervisor supervisor) {
        this.ports = ports;
        this.port = port;
        this.supervisor = supervisor;
    }

    @Override
    public BackendType type() {
        return BackendType.LOCAL;
    }

    @Override
    public void start() {
        supervisor.start();
    }

    @Override
    public void stop(CleanupSink sink) {
        sink.run("stop service on port " + port, supervisor::stop);
        sink.run("release port " + port, () -> ports.release(port));
    }

    @Override
    public String baseUrl() {
        return "http://127.0.0.1:" + port;
    }

    public int port() {
        return port;
    }

    public ProcessSupervisor supervisor() {
        return supervisor;
    }
}
