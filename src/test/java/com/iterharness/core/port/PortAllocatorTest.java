package com.iterharness.core.port;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PortAllocatorTest {

    @Test
    @DisplayName("allocate returns ports above the base")
    void allocateAboveBase() {
        var allocator = new PortAllocator(41000);
        int port = allocator.allocate();
        assertTrue(port > 41000);
        assertTrue(allocator.isLeased(port));
    }

    @Test
    @DisplayName("allocated port is bindable at the instant of return")
    void allocatedPortIsBindable() throws Exception {
        var allocator = new PortAllocator(41200);
        int port = allocator.allocate();
        try (var socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
            assertTrue(socket.isBound());
        }
    }

    @Test
    @DisplayName("ports held by another listener are skipped")
    void skipsBoundPorts() throws Exception {
        var allocator = new PortAllocator(41400);
        try (var blocker = new ServerSocket()) {
            blocker.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 41401));
            int port = allocator.allocate();
            assertNotEquals(41401, port);
        }
    }

    @Test
    @DisplayName("50 concurrent callers receive 50 distinct ports")
    void concurrentAllocationsAreUnique() throws Exception {
        var allocator = new PortAllocator(42000);
        int callers = 50;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<Integer>>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return allocator.allocate();
                }));
            }
            start.countDown();
            Set<Integer> ports = Collections.synchronizedSet(new HashSet<>());
            for (Future<Integer> f : futures) {
                ports.add(f.get(30, TimeUnit.SECONDS));
            }
            assertEquals(callers, ports.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("release drops the lease")
    void releaseDropsLease() {
        var allocator = new PortAllocator(42500);
        int port = allocator.allocate();
        allocator.release(port);
        assertFalse(allocator.isLeased(port));
        // releasing twice is harmless
        allocator.release(port);
    }

    @Test
    @DisplayName("leased ports are not handed out again after the counter wraps")
    void wrapAroundSkipsLeasedPorts() {
        var allocator = new PortAllocator(65525);
        var leased = new ArrayList<Integer>();
        for (int i = 0; i < 10; i++) {
            leased.add(allocator.allocate());
        }
        int freed = leased.remove(0);
        allocator.release(freed);

        int port = allocator.allocate();

        assertFalse(leased.contains(port), "port " + port + " handed out twice");
        assertTrue(port > 65525 && port <= 65535);
    }

    @Test
    @DisplayName("base ports outside the unprivileged range are rejected")
    void rejectsInvalidBase() {
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(80));
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(65535));
    }

    @Test
    @DisplayName("shared returns one process-wide instance")
    void sharedIsSingleton() {
        assertSame(PortAllocator.shared(), PortAllocator.shared());
    }

    @Test
    void isAvailableDetectsBoundPort() throws Exception {
        try (var socket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            assertFalse(PortAllocator.isAvailable(socket.getLocalPort()));
        }
    }
}
