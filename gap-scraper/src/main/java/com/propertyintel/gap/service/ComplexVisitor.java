package com.propertyintel.gap.service;

import com.propertyintel.gap.browser.BrowserTab;
import com.propertyintel.gap.browser.Pacer;
import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.ingest.CollectionSession;
import com.propertyintel.gap.model.Marker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Opens each promising complex on the map tab and clicks its sale tab, which
 * makes the site fetch the complex's listing list for the ingestor to pick up.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComplexVisitor {

    private final GapScraperProperties properties;
    private final Pacer pacer;

    /**
     * Markers with at least the minimum listing count, optionally busiest
     * first. If none qualify, the first 2×cap markers by count instead.
     * Truncated to the complex cap either way.
     */
    public List<Marker> selectTargets(CollectionSession session) {
        GapScraperProperties.Collection cfg = properties.getCollection();
        int cap = Math.max(0, cfg.getMaxComplexes());
        Comparator<Marker> busiestFirst = Comparator.comparingInt(Marker::getReportedCount).reversed();

        List<Marker> targets = new ArrayList<>();
        for (Marker m : session.markers()) {
            if (m.getReportedCount() >= cfg.getMinListingCount()) {
                targets.add(m);
            }
        }
        if (cfg.isPrioritizeByCount()) {
            targets.sort(busiestFirst);
        }

        if (targets.isEmpty() && session.markerCount() > 0) {
            log.warn("No complex has ≥{} listings, falling back to the busiest markers", cfg.getMinListingCount());
            session.markers().stream().limit(2L * cap).forEach(targets::add);
            targets.sort(busiestFirst);
        }

        return targets.size() > cap ? new ArrayList<>(targets.subList(0, cap)) : targets;
    }

    /**
     * @return number of complexes opened
     */
    public int visit(BrowserTab tab, CollectionSession session) {
        List<Marker> targets = selectTargets(session);
        if (targets.isEmpty()) {
            log.info("No complexes to visit");
            return 0;
        }

        GapScraperProperties.Collection cfg = properties.getCollection();
        String base = properties.getBrowser().getMapBaseUrl();
        long clickTimeout = properties.getBrowser().getClickTimeoutMs();
        log.info("Visiting {} complexes", targets.size());

        int visited = 0;
        for (Marker marker : targets) {
            visited++;
            log.info("[{}/{}] {} ({}, {} listings)", visited, targets.size(),
                    marker.getDisplayName(), marker.getAssetType(), marker.getReportedCount());

            if (!tab.navigate(base + "/" + marker.getAssetType().family() + "/" + marker.getId())) {
                log.debug("Complex {} page did not load", marker.getId());
                continue;
            }
            pacer.pause(cfg.getComplexVisitDelayMs());

            if (tab.clickFirst(properties.getLabels().getSaleTab(), clickTimeout).isPresent()) {
                pacer.pause(cfg.getSaleTabDelayMs());
            }
        }
        return visited;
    }
}
