package com.iterharness.core.timing;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Bounded polling. Retries belong here and in readiness probing only.
 */
public final class Polling {

    private Polling() {}

    /**
     * Evaluates {@code condition} every {@code interval} until it holds or {@code timeout} elapses.
     *
     * @return true if the condition held before the timeout
     */
    public static boolean until(Duration timeout, Duration interval, BooleanSupplier condition) {
        var deadline = Deadline.after(timeout);
        while (true) {
            if (condition.getAsBoolean()) {
                return true;
            }
            if (deadline.isExpired()) {
                return false;
            }
            if (!sleep(deadline.cap(interval))) {
                return false;
            }
        }
    }

    /**
     * @return false if the thread was interrupted
     */
    static boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
