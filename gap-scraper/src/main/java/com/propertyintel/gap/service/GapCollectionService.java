package com.propertyintel.gap.service;

import com.propertyintel.gap.browser.BrowserLauncher;
import com.propertyintel.gap.browser.BrowserSession;
import com.propertyintel.gap.browser.BrowserTab;
import com.propertyintel.gap.browser.Pacer;
import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.ingest.CollectionSession;
import com.propertyintel.gap.ingest.ResponseIngestor;
import com.propertyintel.gap.model.AssetType;
import com.propertyintel.gap.model.Candidate;
import com.propertyintel.gap.model.ListingSummary;
import com.propertyintel.gap.model.ScrapeRun;
import com.propertyintel.gap.navigation.CoordinateTransform;
import com.propertyintel.gap.navigation.GeoPoint;
import com.propertyintel.gap.navigation.NavigationController;
import com.propertyintel.gap.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates one collection run.
 *
 * Phases: per asset type, load the map, recenter, switch to listing pins and
 * grid-sweep with capture on; then visit promising complexes; then fetch
 * listing details on the worker tabs; finally rank and export the gap
 * candidates. Only one run is active at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GapCollectionService {

    private final GapScraperProperties properties;
    private final BrowserLauncher launcher;
    private final MapPageLoader mapPageLoader;
    private final NavigationController navigation;
    private final ResponseIngestor ingestor;
    private final ComplexVisitor complexVisitor;
    private final DetailExtractor detailExtractor;
    private final CollectionScheduler scheduler;
    private final GapAnalyzer gapAnalyzer;
    private final OutputRouter outputRouter;
    private final Pacer pacer;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScrapeRun lastRun;

    /**
     * Runs the configured start coordinates.
     */
    public ScrapeRun collectDefault() {
        GapScraperProperties.Start start = properties.getStart();
        return collect(start.getLatitude(), start.getLongitude(), start.getZoom());
    }

    public ScrapeRun collect(double latitude, double longitude, int zoom) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Collection already running, request for ({}, {}) z{} skipped", latitude, longitude, zoom);
            return ScrapeRun.builder()
                    .runId(UUID.randomUUID().toString())
                    .latitude(latitude)
                    .longitude(longitude)
                    .zoom(zoom)
                    .startedAt(LocalDateTime.now())
                    .completedAt(LocalDateTime.now())
                    .status("SKIPPED")
                    .errorMessage("another run is in progress")
                    .build();
        }
        try {
            return execute(latitude, longitude, zoom);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<ScrapeRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ScrapeRun execute(double latitude, double longitude, int zoom) {
        ScrapeRun run = newRun(latitude, longitude, zoom);
        lastRun = run;
        log.info("Collection {} started at ({}, {}) z{}", run.getRunId(), run.getLatitude(), run.getLongitude(), run.getZoom());

        try (BrowserSession browser = launcher.launch()) {
            runOn(browser, run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Collection {} interrupted", run.getRunId());
            run.setStatus("FAILED");
            run.setErrorMessage("interrupted");
        } catch (Exception e) {
            log.error("Collection {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            logSummary(run);
        }
        return run;
    }

    ScrapeRun newRun(double latitude, double longitude, int zoom) {
        GapScraperProperties.Navigation nav = properties.getNavigation();
        GeoPoint center = CoordinateTransform.clampToRegion(latitude, longitude, properties.getRegion().toBounds());
        int clampedZoom = Math.max(nav.getZoomMin(), Math.min(nav.getZoomMax(), zoom));

        return ScrapeRun.builder()
                .runId(UUID.randomUUID().toString())
                .latitude(center.latitude())
                .longitude(center.longitude())
                .zoom(clampedZoom)
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();
    }

    /**
     * All phases against an already open browser session. Updates {@code run}
     * in place and sets SUCCESS on completion.
     */
    List<Candidate> runOn(BrowserSession browser, ScrapeRun run) throws InterruptedException {
        CollectionSession session = new CollectionSession();
        BrowserTab map = browser.getMapTab();
        map.onResponse(ingestor.listenerFor(session));

        GeoPoint center = new GeoPoint(run.getLatitude(), run.getLongitude());
        for (AssetType type : properties.getCollection().getAssetTypes()) {
            sweepScenario(map, session, type, center, run.getZoom());
        }
        log.info("Navigation done: {} markers, {} listings, {} trades",
                session.markerCount(), session.listingCount(), session.tradeCount());

        run.setComplexesVisited(complexVisitor.visit(map, session));
        session.stopCapture();

        run.setMarkersFound(session.markerCount());
        run.setListingsFound(session.listingCount());
        run.setTradesFound(session.tradeCount());
        log.info("Collected {} markers, {} sale listings after visiting {} complexes",
                session.markerCount(), session.listingCount(), run.getComplexesVisited());

        List<Candidate> candidates = detailPhase(browser.getDetailTabs(), session.listings(), run);
        run.setMalformedResponses(session.getMalformedResponses());
        run.setCandidates(candidates.size());

        outputRouter.write(candidates).map(Path::toString).ifPresent(run::setOutputFile);
        logPreview(candidates);

        run.setStatus("SUCCESS");
        return candidates;
    }

    private void sweepScenario(BrowserTab map, CollectionSession session, AssetType type, GeoPoint center, int zoom) {
        GapScraperProperties.Navigation nav = properties.getNavigation();
        log.info("Scenario {}: loading map", type);
        try {
            mapPageLoader.open(map, type, center, zoom);
        } catch (MapLoadException e) {
            log.warn("Scenario {} skipped: {}", type, e.getMessage());
            return;
        }

        navigation.recenter(map, center.latitude(), center.longitude(), zoom);
        navigation.switchToListingMarkers(map);
        navigation.wheelToZoom(map, Math.max(nav.getZoomMin(), zoom));

        session.startCapture();
        navigation.nudge(map, nav.getCaptureNudgeDelta());
        pacer.pause(nav.getCaptureSettleMs());

        int points = navigation.gridSweep(map, center, zoom, nav.getGridRings(), nav.getGridStepPx(), nav.getSweepDwellMs());
        log.info("Scenario {}: swept {} points, {} markers and {} listings so far",
                type, points, session.markerCount(), session.listingCount());
    }

    /**
     * Fetches details for the listing backlog on the worker tabs and keeps the
     * listings the gap policy accepts, ranked.
     */
    List<Candidate> detailPhase(List<BrowserTab> tabs, List<ListingSummary> listings, ScrapeRun run)
            throws InterruptedException {
        GapScraperProperties.Collection cfg = properties.getCollection();
        List<ListingSummary> backlog = cfg.isSortBySalePrice() ? gapAnalyzer.prioritise(listings) : listings;
        if (backlog.isEmpty()) {
            log.info("No listings to fetch details for");
            return List.of();
        }

        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        ResourcePool<BrowserTab> pool = new ResourcePool<>(tabs);
        log.info("Fetching details for {} listings (cap {}) on {} tabs", backlog.size(), cfg.getMaxListings(), pool.capacity());

        CollectionScheduler.Report<Candidate> report = scheduler.run(backlog, cfg.getMaxListings(), pool,
                (tab, listing) -> {
                    DetailOutcome outcome = detailExtractor.extract(tab, listing.getId());
                    switch (outcome.kind()) {
                        case SKIPPED_NO_PREVIOUS_LEASE -> skipped.incrementAndGet();
                        case FAILED -> failed.incrementAndGet();
                        case EXTRACTED -> { }
                    }
                    return outcome.usable()
                            ? gapAnalyzer.evaluate(listing, outcome.record())
                            : Optional.<Candidate>empty();
                });

        run.setDetailsAttempted(report.submitted());
        run.setDetailsSkipped(skipped.get());
        run.setDetailsFailed(failed.get() + report.failed());
        log.info("Details done: {} attempted, {} skipped (no previous lease), {} failed, {} kept",
                report.submitted(), skipped.get(), run.getDetailsFailed(), report.results().size());

        return gapAnalyzer.rank(report.results());
    }

    private void logPreview(List<Candidate> candidates) {
        int size = Math.min(candidates.size(), Math.max(0, properties.getOutput().getPreviewSize()));
        for (int i = 0; i < size; i++) {
            Candidate c = candidates.get(i);
            log.info("#{} {} [{}] sale={} previousLease={} gap={} ratio={}", i + 1,
                    c.getListing().getName(), c.getListing().getId(), c.getSaleWon(),
                    c.getDetail().getPreviousLeaseWon(), c.getGapAmountWon(), c.getGapRatio());
        }
    }

    private void logSummary(ScrapeRun run) {
        log.info("Collection {} {}: markers={} listings={} details={} skipped={} failed={} candidates={} file={}",
                run.getRunId(), run.getStatus(), run.getMarkersFound(), run.getListingsFound(),
                run.getDetailsAttempted(), run.getDetailsSkipped(), run.getDetailsFailed(),
                run.getCandidates(), run.getOutputFile());
    }
}
