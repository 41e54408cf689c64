package com.iterharness.core.cleanup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects failures from best-effort cleanup steps without ever raising them.
 *
 * <p>Every action handed to {@link #run} must be idempotent and must not depend on the
 * outcome of another cleanup action: a container that is already gone, a port that is
 * already released or a file that is already closed is logged and skipped.
 */
public class CleanupSink {

    private static final Logger log = LoggerFactory.getLogger(CleanupSink.class);

    @FunctionalInterface
    public interface CleanupAction {
        void run() throws Exception;
    }

    private final List<String> failures = Collections.synchronizedList(new ArrayList<>());

    public void run(String description, CleanupAction action) {
        try {
            action.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record(description, e);
        } catch (Exception e) {
            record(description, e);
        }
    }

    private void record(String description, Exception e) {
        String message = description + ": " + e.getMessage();
        failures.add(message);
        log.warn("Cleanup step failed (ignored) - {}", message);
    }

    public List<String> failures() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
