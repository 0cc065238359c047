package com.propertyintel.gap.service;

import com.propertyintel.gap.browser.BrowserTab;
import com.propertyintel.gap.browser.Pacer;
import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.model.DetailRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.OptionalLong;

/**
 * Opens a listing's detail page on a worker tab and extracts broker contact
 * and lease facts.
 *
 * The previous-lease amount is read first. When it is required and missing,
 * the listing is skipped before any tab switching or further parsing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DetailExtractor {

    private static final String ID_PLACEHOLDER = "{id}";

    private final GapScraperProperties properties;
    private final DetailTextParser textParser;
    private final Pacer pacer;

    public DetailOutcome extract(BrowserTab tab, String listingId) {
        GapScraperProperties.Browser browser = properties.getBrowser();
        try {
            boolean redirected = open(tab, primaryUrl(listingId), listingId);
            String body = tab.bodyText().orElse("");

            if (looksEmpty(body)) {
                log.debug("Listing {}: primary page empty or not found, trying alternate", listingId);
                open(tab, fill(browser.getMobileAlternateUrl(), listingId), listingId);
                body = tab.bodyText().orElse("");
                redirected = true;
            }

            OptionalLong previousLease = textParser.previousLease(body);
            if (properties.getCollection().isRequirePreviousLease() && previousLease.isEmpty()) {
                return DetailOutcome.skipped(redirected);
            }

            body = switchToLeaseHistory(tab, body);

            DetailRecord record = textParser.parse(body, previousLease);
            return DetailOutcome.extracted(record, redirected);

        } catch (RuntimeException e) {
            log.debug("Listing {}: detail fetch failed: {}", listingId, e.getMessage());
            return DetailOutcome.failed(e.getMessage());
        }
    }

    String primaryUrl(String listingId) {
        GapScraperProperties.Browser browser = properties.getBrowser();
        String template = browser.isUseMobileDetail() ? browser.getMobileDetailUrl() : browser.getDesktopDetailUrl();
        return fill(template, listingId);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Navigates to {@code url}. If the site bounces to the unrelated redirect
     * host, loads the mobile info page for the listing once.
     *
     * @return true if the redirect recovery was needed
     */
    private boolean open(BrowserTab tab, String url, String listingId) {
        GapScraperProperties.Browser browser = properties.getBrowser();
        tab.navigate(url);
        pacer.pause(browser.getPageSettleMs());

        String landed = tab.currentUrl();
        if (landed != null && landed.contains(browser.getRedirectHost())) {
            log.debug("Listing {}: redirected to {}, reloading", listingId, landed);
            tab.navigate(fill(browser.getMobileDetailUrl(), listingId));
            pacer.pause(browser.getPageSettleMs());
            return true;
        }
        return false;
    }

    /**
     * Opens the price-history tab and its lease view. Either click failing
     * leaves the text as it was.
     */
    private String switchToLeaseHistory(BrowserTab tab, String body) {
        GapScraperProperties.Labels labels = properties.getLabels();
        GapScraperProperties.Browser browser = properties.getBrowser();
        long timeout = browser.getClickTimeoutMs();

        if (tab.clickFirst(labels.getPriceHistoryTab(), timeout).isEmpty()) return body;
        pacer.pause(browser.getHistoryTabSettleMs());
        if (tab.clickFirst(labels.getLeaseTab(), timeout).isEmpty()) return body;
        pacer.pause(browser.getLeaseTabSettleMs());

        return tab.bodyText().orElse(body);
    }

    private boolean looksEmpty(String body) {
        GapScraperProperties.Browser browser = properties.getBrowser();
        return body.contains(browser.getNotFoundMarker()) || body.strip().length() < browser.getMinBodyLength();
    }

    private static String fill(String template, String listingId) {
        return template.replace(ID_PLACEHOLDER, listingId);
    }
}
