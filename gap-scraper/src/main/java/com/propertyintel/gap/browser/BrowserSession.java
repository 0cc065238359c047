package com.propertyintel.gap.browser;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * The tabs one collection run works with: a single desktop map tab driven by
 * the coordinating thread, and the detail tabs handed to the worker pool.
 */
@Slf4j
@Getter
public class BrowserSession implements AutoCloseable {

    private final BrowserTab mapTab;
    private final List<BrowserTab> detailTabs;

    public BrowserSession(BrowserTab mapTab, List<? extends BrowserTab> detailTabs) {
        this.mapTab = mapTab;
        this.detailTabs = List.copyOf(detailTabs);
    }

    @Override
    public void close() {
        List<BrowserTab> all = new ArrayList<>(detailTabs);
        all.add(mapTab);
        for (BrowserTab tab : all) {
            try {
                tab.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close tab: {}", e.getMessage());
            }
        }
        log.info("Browser session closed ({} tabs)", all.size());
    }
}
