package com.iterharness.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Structured result of one test, written once when the test completes.
 *
 * @param testName    name of the test (last segment of the results directory)
 * @param passed      whether the test passed; false for failed and skipped tests
 * @param outcome     terminal outcome
 * @param duration    human-readable wall-clock duration, e.g. "1.250s"
 * @param timestamp   ISO-8601 completion time
 * @param screenshots PNG files found in the results directory
 * @param logs        log files found in the results directory
 * @param details     free-form description of what the test verified
 * @param errors      every mismatch or failure recorded by the test
 */
@JsonPropertyOrder({"test_name", "passed", "outcome", "duration", "timestamp",
        "screenshots", "logs", "details", "errors"})
public record TestSummary(
    @JsonProperty("test_name") String testName,
    @JsonProperty("passed") boolean passed,
    @JsonProperty("outcome") TestOutcome outcome,
    @JsonProperty("duration") String duration,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("screenshots") List<String> screenshots,
    @JsonProperty("logs") List<String> logs,
    @JsonProperty("details") String details,
    @JsonProperty("errors") List<String> errors
) {
    public TestSummary {
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
        logs = logs == null ? List.of() : List.copyOf(logs);
        errors = errors == null ? List.of() : List.copyOf(errors);
        details = details == null ? "" : details;
    }

    /**
     * Renders the human-readable SUMMARY.md form.
     */
    public String toMarkdown() {
        var sb = new StringBuilder();
        String result = switch (outcome) {
            case PASSED -> "PASS";
            case FAILED -> "FAIL";
            case SKIPPED -> "SKIP";
        };
        sb.append("# Test: ").append(testName).append("\n\n");
        sb.append("**Result:** ").append(result).append('\n');
        sb.append("**Duration:** ").append(duration).append('\n');
        sb.append("**Timestamp:** ").append(timestamp).append("\n\n");

        sb.append("## Screenshots\n");
        appendList(sb, screenshots, "- None captured\n");
        sb.append('\n');

        sb.append("## Logs\n");
        appendList(sb, logs, "- None captured\n");
        sb.append('\n');

        sb.append("## Details\n");
        sb.append(details).append("\n\n");

        sb.append("## Errors\n");
        appendList(sb, errors, "None\n");
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, List<String> items, String empty) {
        if (items.isEmpty()) {
            sb.append(empty);
            return;
        }
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
    }
}
