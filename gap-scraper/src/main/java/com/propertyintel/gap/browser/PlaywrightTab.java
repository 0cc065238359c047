package com.propertyintel.gap.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Mouse;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import com.propertyintel.gap.navigation.PixelPoint;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * {@link BrowserTab} over a Playwright page. Playwright errors stop here and
 * come back as false/empty results.
 *
 * Not thread-safe: a tab must be driven by one thread at a time, which the
 * worker pool guarantees.
 */
@Slf4j
public class PlaywrightTab implements BrowserTab {

    private final Page page;
    private final long navigationTimeoutMs;
    private final AutoCloseable owner;

    /**
     * @param owner closed after the page; the context, browser and driver the
     *              tab exclusively owns, or null if shared
     */
    public PlaywrightTab(Page page, long navigationTimeoutMs, AutoCloseable owner) {
        this.page = page;
        this.navigationTimeoutMs = navigationTimeoutMs;
        this.owner = owner;
    }

    @Override
    public boolean navigate(String url) {
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(navigationTimeoutMs));
            return true;
        } catch (PlaywrightException e) {
            log.debug("Navigation to {} failed: {}", url, firstLine(e));
            return false;
        }
    }

    @Override
    public String currentUrl() {
        try {
            return page.url();
        } catch (PlaywrightException e) {
            return "";
        }
    }

    @Override
    public void drag(PixelPoint from, PixelPoint to, int steps) {
        try {
            Mouse mouse = page.mouse();
            mouse.move(from.x(), from.y());
            mouse.down();
            mouse.move(to.x(), to.y(), new Mouse.MoveOptions().setSteps(Math.max(1, steps)));
            mouse.up();
        } catch (PlaywrightException e) {
            log.debug("Drag failed: {}", firstLine(e));
        }
    }

    @Override
    public void wheel(PixelPoint at, double deltaY) {
        try {
            page.mouse().move(at.x(), at.y());
            page.mouse().wheel(0, deltaY);
        } catch (PlaywrightException e) {
            log.debug("Wheel failed: {}", firstLine(e));
        }
    }

    @Override
    public Optional<String> clickFirst(List<String> labels, long timeoutMs) {
        for (String label : labels) {
            try {
                page.locator("text=" + label).first().click(new Locator.ClickOptions().setTimeout(timeoutMs));
                return Optional.of(label);
            } catch (PlaywrightException e) {
                log.trace("No clickable '{}': {}", label, firstLine(e));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> bodyText() {
        try {
            return Optional.ofNullable(page.innerText("body"));
        } catch (PlaywrightException e) {
            log.debug("Could not read body text: {}", firstLine(e));
            return Optional.empty();
        }
    }

    @Override
    public boolean waitForSelector(String selector, long timeoutMs) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(timeoutMs));
            return true;
        } catch (PlaywrightException e) {
            return false;
        }
    }

    @Override
    public boolean awaitResponse(Predicate<String> urlMatcher, long timeoutMs) {
        try {
            page.waitForResponse(r -> urlMatcher.test(r.url()),
                    new Page.WaitForResponseOptions().setTimeout(timeoutMs),
                    () -> { });
            return true;
        } catch (PlaywrightException e) {
            return false;
        }
    }

    @Override
    public void onResponse(Consumer<CapturedResponse> listener) {
        page.onResponse(response -> listener.accept(new CapturedResponse(response.url(), response::text)));
    }

    @Override
    public void close() {
        try {
            page.close();
        } catch (PlaywrightException e) {
            log.debug("Page close failed: {}", firstLine(e));
        }
        if (owner != null) {
            try {
                owner.close();
            } catch (Exception e) {
                log.warn("Failed to release browser resources: {}", e.getMessage());
            }
        }
    }

    private static String firstLine(PlaywrightException e) {
        String msg = e.getMessage();
        if (msg == null) return e.getClass().getSimpleName();
        int nl = msg.indexOf('\n');
        return nl < 0 ? msg : msg.substring(0, nl);
    }
}
