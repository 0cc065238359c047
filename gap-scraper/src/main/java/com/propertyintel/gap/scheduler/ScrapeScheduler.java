package com.propertyintel.gap.scheduler;

import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.service.GapCollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup collection runs at the configured start
 * coordinates.
 *
 * The cron run is disabled by default ("-"). Override with the
 * gap-scraper.scheduling.cron property, e.g. "0 0 6 * * MON-FRI".
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final GapCollectionService collectionService;
    private final GapScraperProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, starting collection");
            new Thread(this::runSafely, "startup-collection").start();
        } else {
            log.info("Collector ready. Schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${gap-scraper.scheduling.cron:-}", zone = "Asia/Seoul")
    public void scheduledCollection() {
        log.info("Scheduled collection triggered");
        runSafely();
    }

    private void runSafely() {
        try {
            collectionService.collectDefault();
        } catch (Exception e) {
            log.error("Collection failed: {}", e.getMessage(), e);
        }
    }
}
