package com.iterharness.core.port;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out loopback TCP ports to concurrently running test environments.
 *
 * <p>Allocation runs entirely inside one critical section: the counter advances, the candidate
 * is probed with a bind-then-release, and the winner is recorded as leased before the lock is
 * dropped. A leased port is never returned again until {@link #release(int)} is called, even
 * after the counter wraps around.
 *
 * <p>If no candidate within {@link #MAX_PROBE_ATTEMPTS} is bindable, the next counter value is
 * returned unchecked so callers always make forward progress.
 */
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    public static final int DEFAULT_BASE_PORT = 19000;
    static final int MAX_PROBE_ATTEMPTS = 100;
    private static final int MAX_PORT = 65535;

    private static final PortAllocator SHARED = new PortAllocator(DEFAULT_BASE_PORT);

    private final Object lock = new Object();
    private final int basePort;
    private final Set<Integer> leased = new HashSet<>();
    private int counter;

    public PortAllocator(int basePort) {
        if (basePort < 1024 || basePort >= MAX_PORT) {
            throw new IllegalArgumentException("Base port out of range: " + basePort);
        }
        this.basePort = basePort;
        this.counter = basePort;
    }

    /** Process-wide allocator for callers that do not inject their own. */
    public static PortAllocator shared() {
        return SHARED;
    }

    /**
     * Returns a port that was bindable on loopback at the instant of return.
     */
    public int allocate() {
        synchronized (lock) {
            for (int i = 0; i < MAX_PROBE_ATTEMPTS; i++) {
                int candidate = advance();
                if (leased.contains(candidate)) {
                    continue;
                }
                if (isAvailable(candidate)) {
                    leased.add(candidate);
                    log.debug("Allocated port {}", candidate);
                    return candidate;
                }
            }
            int fallback = advance();
            leased.add(fallback);
            log.warn("No bindable port found in {} attempts, returning {} unchecked",
                    MAX_PROBE_ATTEMPTS, fallback);
            return fallback;
        }
    }

    /**
     * Returns a port to the pool. Releasing a port that is not leased is a no-op.
     */
    public void release(int port) {
        synchronized (lock) {
            if (leased.remove(port)) {
                log.debug("Released port {}", port);
            }
        }
    }

    public boolean isLeased(int port) {
        synchronized (lock) {
            return leased.contains(port);
        }
    }

    private int advance() {
        counter++;
        if (counter > MAX_PORT) {
            counter = basePort + 1;
        }
        return counter;
    }

    /**
     * Checks whether a port can be bound on 127.0.0.1 right now.
     */
    static boolean isAvailable(int port) {
        try (var socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
