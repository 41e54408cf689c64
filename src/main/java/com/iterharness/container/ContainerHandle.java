package com.iterharness.container;

/**
 * A running container in the test topology.
 *
 * @param id    Docker container ID
 * @param name  container name
 * @param alias DNS alias on the test network
 * @param role  primary service or driver
 */
public record ContainerHandle(String id, String name, String alias, Role role) {

    public enum Role { PRIMARY, DRIVER }
}
