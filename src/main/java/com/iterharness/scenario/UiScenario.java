package com.iterharness.scenario;

import com.iterharness.browser.BrowserCapture;
import com.iterharness.client.ResponseChecks;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.model.TestSummary;
import com.iterharness.environment.TestEnvironment;

import java.util.List;

/**
 * Loads the web UI home page in a browser, checks its markup over HTTP and captures
 * {@code 01-before} and {@code 02-after}. Both screenshots are required: a summary written
 * without them fails.
 */
public class UiScenario {

    static final String HOME = "/web/";
    static final String BEFORE = "01-before";
    static final String AFTER = "02-after";
    static final List<String> EXPECTED_CONTENT = List.of("iter-service", "Projects");

    public TestSummary run(TestEnvironment env) {
        BrowserCapture browser;
        try {
            browser = env.browser();
        } catch (HarnessException e) {
            return env.writeSummary(false, "Browser failed to launch", e.toString());
        }
        return run(env, browser);
    }

    public TestSummary run(TestEnvironment env, BrowserCapture browser) {
        var checks = new ResponseChecks();
        env.results().requireScreenshots(BEFORE, AFTER);
        try {
            browser.navigateAndScreenshot(HOME, BEFORE);

            String html = env.httpClient().getHtml(HOME);
            for (String expected : EXPECTED_CONTENT) {
                checks.contains(html, expected);
            }

            browser.fullPageScreenshot(AFTER);
        } catch (HarnessException e) {
            if (e.kind().isSkip()) {
                return env.writeSkipped(e.getMessage());
            }
            checks.check(false, e.toString());
        }
        String details = checks.passed() ? "Home page loaded with all expected elements"
                : checks.errors().size() + " check(s) failed";
        return env.writeSummary(checks.passed(), details, checks.errors().toArray(new String[0]));
    }
}
