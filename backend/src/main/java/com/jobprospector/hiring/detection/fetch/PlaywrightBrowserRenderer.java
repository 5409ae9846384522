package com.jobprospector.hiring.detection.fetch;

import com.jobprospector.hiring.config.HiringProperties;
import com.jobprospector.hiring.detection.http.UserAgentRotator;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Headless Chromium through Playwright. Playwright handles are confined to the thread that created them,
 * so every render opens its own driver on the browser executor and closes it before returning.
 */
@Component
public class PlaywrightBrowserRenderer implements BrowserRenderer {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserRenderer.class);
    private static final long RENDER_GRACE_SECONDS = 10;

    private final HiringProperties.Fetch config;
    private final ExecutorService browserExecutor;
    private final Semaphore browserSlots;
    private final UserAgentRotator userAgents;
    private final Supplier<Playwright> playwrightFactory;
    private final AtomicBoolean disabled = new AtomicBoolean(false);

    @Autowired
    public PlaywrightBrowserRenderer(
        HiringProperties properties,
        @Qualifier("browserExecutor") ExecutorService browserExecutor,
        UserAgentRotator userAgents
    ) {
        this(properties, browserExecutor, userAgents, Playwright::create);
    }

    PlaywrightBrowserRenderer(
        HiringProperties properties,
        ExecutorService browserExecutor,
        UserAgentRotator userAgents,
        Supplier<Playwright> playwrightFactory
    ) {
        this.config = properties.getFetch();
        this.browserExecutor = browserExecutor;
        this.browserSlots = new Semaphore(config.getMaxConcurrentBrowsers());
        this.userAgents = userAgents;
        this.playwrightFactory = playwrightFactory;
        if (!config.isBrowserEnabled()) {
            disabled.set(true);
            log.info("Browser rendering disabled by configuration");
        }
    }

    @Override
    public boolean isAvailable() {
        return !disabled.get();
    }

    @Override
    public String render(String url, String waitSelector) {
        if (disabled.get() || url == null || url.isBlank()) {
            return null;
        }
        boolean acquired = false;
        Future<String> future = null;
        try {
            browserSlots.acquire();
            acquired = true;
            future = browserExecutor.submit(() -> renderOnCurrentThread(url, waitSelector));
            long budget = config.getRenderTimeoutSeconds() + config.getSelectorTimeoutSeconds() + RENDER_GRACE_SECONDS;
            return future.get(budget, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Browser render timed out for {}", url);
            future.cancel(true);
            return null;
        } catch (ExecutionException e) {
            log.warn("Browser render failed for {}: {}", url, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return null;
        } finally {
            if (acquired) {
                browserSlots.release();
            }
        }
    }

    private String renderOnCurrentThread(String url, String waitSelector) {
        Playwright playwright;
        try {
            playwright = playwrightFactory.get();
        } catch (RuntimeException e) {
            disable("Playwright could not start", e);
            return null;
        }
        try (playwright) {
            Browser browser;
            try {
                browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
            } catch (PlaywrightException e) {
                disable("Chromium could not launch", e);
                return null;
            }
            log.info("Launched browser for {}", url);
            try (browser;
                 BrowserContext context = browser.newContext(new Browser.NewContextOptions().setUserAgent(userAgents.next()))) {
                Page page = context.newPage();
                page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(TimeUnit.SECONDS.toMillis(config.getRenderTimeoutSeconds())));
                if (waitSelector != null && !waitSelector.isBlank()) {
                    try {
                        page.waitForSelector(waitSelector, new Page.WaitForSelectorOptions()
                            .setTimeout(TimeUnit.SECONDS.toMillis(config.getSelectorTimeoutSeconds())));
                    } catch (PlaywrightException e) {
                        log.warn("Selector {} not found on {}", waitSelector, url);
                    }
                }
                String content = page.content();
                log.info("Rendered {} characters from {}", content.length(), url);
                return content;
            }
        }
    }

    // Stays off for the rest of the run.
    private void disable(String reason, RuntimeException e) {
        if (disabled.compareAndSet(false, true)) {
            log.warn("{}; browser rendering disabled: {}", reason, e.getMessage());
        }
    }
}
