package com.iterharness.browser;

import com.iterharness.core.error.ErrorKind;
import com.iterharness.core.error.HarnessException;
import com.iterharness.core.results.ResultStore;
import com.iterharness.environment.HarnessProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Headless Chromium session bound to one test's results directory.
 *
 * <p>Every interaction is bounded by the browser operation timeout. Playwright timeouts are
 * raised as {@link ErrorKind#TIMEOUT}, every other browser failure as
 * {@link ErrorKind#BROWSER_FAILURE}. Screenshots are written through the {@link ResultStore}
 * as {@code <name>.png}.
 */
public class BrowserCapture implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserCapture.class);

    static final List<String> LAUNCH_ARGS = List.of("--no-sandbox", "--disable-gpu", "--disable-dev-shm-usage");

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final String baseUrl;
    private final ResultStore results;
    private final double timeoutMs;
    private boolean closed;

    BrowserCapture(Playwright playwright, Browser browser, BrowserContext context, Page page,
                   String baseUrl, ResultStore results, Duration timeout) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.baseUrl = baseUrl;
        this.results = results;
        this.timeoutMs = timeout.toMillis();
    }

    /**
     * Launches Chromium with the configured viewport.
     *
     * @throws HarnessException BROWSER_FAILURE if the browser cannot start
     */
    public static BrowserCapture launch(String baseUrl, ResultStore results,
                                        HarnessProperties.Browser settings, Duration timeout) {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(settings.isHeadless())
                    .setArgs(LAUNCH_ARGS)
                    .setTimeout(timeout.toMillis()));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setViewportSize(settings.getWidth(), settings.getHeight()));
            context.setDefaultTimeout(timeout.toMillis());
            Page page = context.newPage();
            log.info("Browser launched ({}x{}, headless={})", settings.getWidth(), settings.getHeight(), settings.isHeadless());
            return new BrowserCapture(playwright, browser, context, page, baseUrl, results, timeout);
        } catch (PlaywrightException e) {
            if (playwright != null) {
                playwright.close();
            }
            throw new HarnessException(ErrorKind.BROWSER_FAILURE, "Failed to launch browser: " + e.getMessage(), e);
        }
    }

    public Page page() {
        return page;
    }

    // -- navigation --

    public void navigate(String path) {
        navigateAbsolute(baseUrl + path);
    }

    /**
     * Loads {@code url} and waits until the document body is attached.
     */
    public void navigateAbsolute(String url) {
        results.log("Navigate: {}", url);
        run("navigate to " + url, () -> {
            page.navigate(url, new Page.NavigateOptions().setTimeout(timeoutMs));
            page.waitForSelector("body", new Page.WaitForSelectorOptions()
                    .setState(WaitForSelectorState.ATTACHED)
                    .setTimeout(timeoutMs));
            return null;
        });
    }

    // -- screenshots --

    public Path screenshot(String name) {
        return capture(name, false);
    }

    public Path fullPageScreenshot(String name) {
        return capture(name, true);
    }

    public Path navigateAndScreenshot(String path, String name) {
        navigate(path);
        return fullPageScreenshot(name);
    }

    private Path capture(String name, boolean fullPage) {
        byte[] png = run("screenshot " + name, () ->
                page.screenshot(new Page.ScreenshotOptions().setFullPage(fullPage).setTimeout(timeoutMs)));
        Path saved = results.save(name + ".png", png);
        results.log("Screenshot saved: {}.png", name);
        return saved;
    }

    // -- interaction --

    public void click(String selector) {
        run("click " + selector, () -> {
            page.click(selector, new Page.ClickOptions().setTimeout(timeoutMs));
            return null;
        });
    }

    public void fill(String selector, String value) {
        run("fill " + selector, () -> {
            page.fill(selector, value, new Page.FillOptions().setTimeout(timeoutMs));
            return null;
        });
    }

    public String text(String selector) {
        return run("read text of " + selector, () ->
                page.textContent(selector, new Page.TextContentOptions().setTimeout(timeoutMs)));
    }

    public String html() {
        return run("read page content", page::content);
    }

    public void waitVisible(String selector) {
        run("wait for " + selector, () -> {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(timeoutMs));
            return null;
        });
    }

    public Object evaluate(String expression) {
        return run("evaluate script", () -> page.evaluate(expression));
    }

    private <T> T run(String action, Supplier<T> step) {
        if (closed) {
            throw new IllegalStateException("Browser already closed");
        }
        try {
            return step.get();
        } catch (TimeoutError e) {
            throw new HarnessException(ErrorKind.TIMEOUT,
                    "Browser timed out after " + (long) timeoutMs + "ms: " + action, e);
        } catch (PlaywrightException e) {
            throw new HarnessException(ErrorKind.BROWSER_FAILURE, "Browser failed to " + action + ": " + e.getMessage(), e);
        }
    }

    /**
     * Closes the page, context, browser and driver. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("Error closing browser: {}", e.getMessage());
        } finally {
            if (playwright != null) {
                playwright.close();
            }
        }
    }
}
