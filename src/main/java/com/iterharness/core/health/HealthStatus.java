package com.iterharness.core.health;

import java.util.Map;

/**
 * Result of one health probe.
 *
 * <p>{@code UP} means the endpoint answered 200, {@code DEGRADED} means it answered with any
 * other status, {@code DOWN} means nothing answered at all.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public boolean isUp() {
        return status == Status.UP;
    }

    /** True when nothing is listening any more (connection refused, reset or timed out). */
    public boolean isUnreachable() {
        return status == Status.DOWN;
    }
}
