package com.propertyintel.gap.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.propertyintel.gap.config.GapScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Starts the browsers for one run.
 *
 * Playwright objects may only be used by one thread at a time, so every tab
 * gets its own driver, browser and context. The map tab is driven by the
 * caller's thread; each detail tab is used by whichever worker holds it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BrowserLauncher {

    private static final String HIDE_WEBDRIVER =
            "Object.defineProperty(navigator, 'webdriver', {get: () => undefined});";
    private static final String SAME_TAB_POPUPS =
            "window.open = (u) => { location.href = u; };";

    // iPhone 14 Pro Max class device
    private static final int MOBILE_WIDTH = 430;
    private static final int MOBILE_HEIGHT = 932;
    private static final double MOBILE_SCALE = 3.0;

    private final GapScraperProperties properties;

    public BrowserSession launch() {
        GapScraperProperties.Browser cfg = properties.getBrowser();
        int workers = cfg.isUseMobileDetail() ? Math.max(1, properties.getCollection().getWorkers()) : 1;
        log.info("Launching browser (headless={}, mobileDetail={}, {} detail tabs)...",
                cfg.isHeadless(), cfg.isUseMobileDetail(), workers);

        PlaywrightTab mapTab = openTab(desktopContext(), HIDE_WEBDRIVER);
        List<PlaywrightTab> detailTabs = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                Browser.NewContextOptions options = cfg.isUseMobileDetail() ? mobileContext() : desktopContext();
                detailTabs.add(openTab(options, HIDE_WEBDRIVER + "\n" + SAME_TAB_POPUPS));
            }
        } catch (RuntimeException e) {
            detailTabs.forEach(PlaywrightTab::close);
            mapTab.close();
            throw e;
        }
        return new BrowserSession(mapTab, detailTabs);
    }

    private PlaywrightTab openTab(Browser.NewContextOptions options, String initScript) {
        GapScraperProperties.Browser cfg = properties.getBrowser();
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(cfg.isHeadless()));
            BrowserContext context = browser.newContext(options);
            if (cfg.isBlockHeavyResources()) {
                ResourceBlocking.apply(context, Set.copyOf(cfg.getBlockedResourceTypes()));
            }
            Page page = context.newPage();
            page.addInitScript(initScript);
            // Closing the driver tears down its browser and context with it
            return new PlaywrightTab(page, cfg.getNavigationTimeoutMs(), playwright);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    private Browser.NewContextOptions desktopContext() {
        GapScraperProperties.Navigation nav = properties.getNavigation();
        return new Browser.NewContextOptions()
                .setViewportSize(nav.getViewportWidth(), nav.getViewportHeight())
                .setUserAgent(properties.getBrowser().getDesktopUserAgent());
    }

    private Browser.NewContextOptions mobileContext() {
        GapScraperProperties.Browser cfg = properties.getBrowser();
        return new Browser.NewContextOptions()
                .setViewportSize(MOBILE_WIDTH, MOBILE_HEIGHT)
                .setDeviceScaleFactor(MOBILE_SCALE)
                .setIsMobile(true)
                .setHasTouch(true)
                .setUserAgent(cfg.getMobileUserAgent())
                .setLocale(cfg.getLocale())
                .setExtraHTTPHeaders(Map.of(
                        "referer", cfg.getMobileReferer(),
                        "accept-language", cfg.getAcceptLanguage()));
    }
}
