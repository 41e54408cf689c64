package com.iterharness.core.results;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.model.TestKind;
import com.iterharness.core.model.TestOutcome;
import com.iterharness.core.model.TestSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Owns the results directory of one test: {@code {root}/{kind}/{testName}/}.
 *
 * <p>The directory is purged and recreated when the store is created, so a rerun of the
 * same test never sees artifacts from a previous run. Layout:
 * <ul>
 *   <li>{@code data/} isolated scratch space and the generated service config</li>
 *   <li>{@code test.log} timestamped harness log</li>
 *   <li>named artifacts saved by the test body</li>
 *   <li>{@code summary.json} and {@code SUMMARY.md}, written once at the end</li>
 * </ul>
 *
 * <p>Logging never fails a test: filesystem errors in {@link #log} are swallowed. Errors while
 * creating the directory or writing the summary are fatal.
 */
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);
    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    public static final String DATA_DIR = "data";
    public static final String TEST_LOG = "test.log";
    public static final String SUMMARY_JSON = "summary.json";
    public static final String SUMMARY_MD = "SUMMARY.md";

    private final String testName;
    private final Path resultsDir;
    private final Path dataDir;
    private final ObjectMapper objectMapper;
    private final Set<String> requiredScreenshots = new LinkedHashSet<>();
    private volatile TestSummary summary;

    private ResultStore(String testName, Path resultsDir, Path dataDir) {
        this.testName = testName;
        this.resultsDir = resultsDir;
        this.dataDir = dataDir;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Creates a fresh results directory, deleting whatever a previous run left there.
     *
     * @throws HarnessException SETUP_FATAL if the directory cannot be recreated
     */
    public static ResultStore create(Path root, TestKind kind, String testName) {
        if (testName == null || testName.isBlank()) {
            throw new IllegalArgumentException("testName must not be blank");
        }
        Path resultsDir = root.resolve(kind.directoryName()).resolve(testName).toAbsolutePath().normalize();
        try {
            deleteRecursively(resultsDir);
            Files.createDirectories(resultsDir);
            Path dataDir = Files.createDirectories(resultsDir.resolve(DATA_DIR));
            return new ResultStore(testName, resultsDir, dataDir);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.SETUP_FATAL,
                    "Failed to create results directory " + resultsDir, e);
        }
    }

    public String testName() { return testName; }
    public Path resultsDir() { return resultsDir; }
    public Path dataDir() { return dataDir; }

    // -- artifacts --

    public Path save(String name, byte[] data) {
        Path target = resolveArtifact(name);
        try {
            Files.write(target, data);
            return target;
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.ARTIFACT_WRITE, "Failed to save artifact " + name, e);
        }
    }

    public Path saveText(String name, String text) {
        return save(name, text.getBytes(StandardCharsets.UTF_8));
    }

    public Path saveJson(String name, Object value) {
        try {
            return save(name, objectMapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.ARTIFACT_WRITE, "Failed to serialize artifact " + name, e);
        }
    }

    private Path resolveArtifact(String name) {
        Path target = resultsDir.resolve(name).normalize();
        if (!target.startsWith(resultsDir) || target.equals(resultsDir)) {
            throw new HarnessException(ErrorKind.ARTIFACT_WRITE, "Artifact name escapes results directory: " + name);
        }
        return target;
    }

    // -- logging --

    /**
     * Appends a timestamped line to {@code test.log} and forwards it to the SLF4J logger.
     * Uses SLF4J {@code {}} placeholders.
     */
    public void log(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        String line = "[" + LocalTime.now().format(LOG_TIME) + "] " + message + "\n";
        try {
            Files.writeString(resultsDir.resolve(TEST_LOG), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.debug("Could not append to {}: {}", TEST_LOG, e.getMessage());
        }
        log.info("[{}] {}", testName, message);
    }

    // -- screenshots --

    /**
     * Registers screenshots that must exist when the summary is written. Names are given
     * without the {@code .png} extension.
     */
    public void requireScreenshots(String... names) {
        synchronized (requiredScreenshots) {
            requiredScreenshots.addAll(Arrays.asList(names));
        }
    }

    public List<String> missingScreenshots(List<String> names) {
        var missing = new ArrayList<String>();
        for (String name : names) {
            if (!Files.isRegularFile(resultsDir.resolve(name + ".png"))) {
                missing.add(name);
            }
        }
        return missing;
    }

    // -- summary --

    /**
     * Scans the results directory and writes {@code summary.json} and {@code SUMMARY.md}.
     * Must be the last artifact-producing call of a test. A missing required screenshot
     * turns a passing summary into a failing one.
     *
     * @throws HarnessException ARTIFACT_WRITE if the summary cannot be written
     * @throws IllegalStateException if a summary was already written
     */
    public TestSummary writeSummary(boolean passed, Duration duration, String details, String... errors) {
        var allErrors = new ArrayList<>(Arrays.asList(errors));
        List<String> required;
        synchronized (requiredScreenshots) {
            required = List.copyOf(requiredScreenshots);
        }
        var missing = missingScreenshots(required);
        if (!missing.isEmpty()) {
            allErrors.add("Missing required screenshots: " + missing);
        }
        boolean effectivePassed = passed && missing.isEmpty();
        return write(effectivePassed ? TestOutcome.PASSED : TestOutcome.FAILED, duration, details, allErrors);
    }

    /**
     * Writes a summary for a test that skipped itself because a prerequisite was absent.
     */
    public TestSummary writeSkipped(String reason, Duration duration) {
        return write(TestOutcome.SKIPPED, duration, "Skipped: " + reason, List.of());
    }

    public TestSummary summary() {
        return summary;
    }

    private synchronized TestSummary write(TestOutcome outcome, Duration duration, String details, List<String> errors) {
        if (summary != null) {
            throw new IllegalStateException("Summary already written for " + testName);
        }
        var built = new TestSummary(
                testName,
                outcome == TestOutcome.PASSED,
                outcome,
                formatDuration(duration),
                OffsetDateTime.now().withNano(0).toString(),
                collect(".png"),
                collect(".log"),
                details,
                errors);
        try {
            Files.write(resultsDir.resolve(SUMMARY_JSON), objectMapper.writeValueAsBytes(built));
            Files.writeString(resultsDir.resolve(SUMMARY_MD), built.toMarkdown(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new HarnessException(ErrorKind.ARTIFACT_WRITE, "Failed to write summary for " + testName, e);
        }
        summary = built;
        log.info("[{}] summary written: {}", testName, outcome);
        return built;
    }

    private List<String> collect(String suffix) {
        try (Stream<Path> entries = Files.list(resultsDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(suffix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            return List.of();
        }
    }

    static String formatDuration(Duration duration) {
        if (duration == null) return "0s";
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        return String.format("%d.%03ds", ms / 1000, ms % 1000);
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
