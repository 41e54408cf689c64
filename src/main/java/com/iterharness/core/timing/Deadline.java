package com.iterharness.core.timing;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A fixed point in time that bounds a provisioning phase. Sub-operations take
 * {@link #remaining()} as their own timeout so none of them outlives the phase.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration timeout) {
        return after(Clock.systemUTC(), timeout);
    }

    public static Deadline after(Clock clock, Duration timeout) {
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * The smaller of {@code timeout} and the time left on this deadline.
     */
    public Duration cap(Duration timeout) {
        Duration left = remaining();
        return timeout.compareTo(left) < 0 ? timeout : left;
    }

    /**
     * @throws HarnessException of kind TIMEOUT when the deadline has passed
     */
    public void check(String phase) {
        if (isExpired()) {
            throw new HarnessException(ErrorKind.TIMEOUT, "Deadline exceeded during " + phase);
        }
    }
}
