package com.propertyintel.gap.navigation;

import com.propertyintel.gap.browser.BrowserTab;
import com.propertyintel.gap.browser.Pacer;
import com.propertyintel.gap.config.GapScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Moves the map viewport the way a person would: zoom out for context, drag
 * roughly into place, zoom in, then correct.
 *
 * The map encodes its state in the {@code ms=lat,lon,zoom} query parameter,
 * which is the only read-back channel. Every loop here is capped and gives up
 * quietly; a viewport that ends up close but not exact still produces markers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NavigationController {

    private final GapScraperProperties properties;
    private final Pacer pacer;
    private final Random random;

    // ── Recenter ─────────────────────────────────────────────────────────────

    /**
     * Zoom out to a random coarse level, drag toward the target, zoom in to
     * {@code targetZoom} and drag again to fix the coarse-level error.
     */
    public void recenter(BrowserTab tab, double targetLat, double targetLon, int targetZoom) {
        GapScraperProperties.Navigation nav = properties.getNavigation();
        GeoPoint target = CoordinateTransform.clampToRegion(targetLat, targetLon, properties.getRegion().toBounds());

        int coarseZoom = nav.getCoarseZoomMin()
                + random.nextInt(Math.max(1, nav.getCoarseZoomMax() - nav.getCoarseZoomMin() + 1));
        log.debug("Recentering on ({}, {}) z{} via coarse z{}",
                target.latitude(), target.longitude(), targetZoom, coarseZoom);

        wheelToZoom(tab, coarseZoom);
        dragToTarget(tab, target, nav.getDragTolerancePx());
        wheelToZoom(tab, targetZoom);
        dragToTarget(tab, target, nav.getDragTolerancePx());
    }

    /**
     * Scrolls one notch at a time until the map reports {@code targetZoom}.
     *
     * @return true if the target zoom was reached within the iteration cap
     */
    public boolean wheelToZoom(BrowserTab tab, int targetZoom) {
        GapScraperProperties.Navigation nav = properties.getNavigation();

        for (int i = 0; i < nav.getWheelIterationCap(); i++) {
            Optional<MapState> state = readState(tab);
            if (state.isEmpty()) {
                pacer.pause(nav.getUnreadableRetryMs());
                continue;
            }
            int current = state.get().zoomLevel();
            if (current == targetZoom) {
                return true;
            }
            double delta = targetZoom > current ? -nav.getWheelDelta() : nav.getWheelDelta();
            tab.wheel(viewportCenter(), delta);
            pacer.pause(nav.getWheelStepDelayMs());
        }

        log.debug("Gave up zooming to z{} after {} attempts", targetZoom, nav.getWheelIterationCap());
        return false;
    }

    /**
     * Drags the map in capped, smoothed steps until the viewport centre is
     * within {@code tolerancePx} of the target at the current zoom.
     *
     * @return true if converged within the iteration cap
     */
    public boolean dragToTarget(BrowserTab tab, GeoPoint target, double tolerancePx) {
        GapScraperProperties.Navigation nav = properties.getNavigation();
        PixelPoint center = viewportCenter();

        for (int i = 0; i < nav.getDragIterationCap(); i++) {
            Optional<MapState> state = readState(tab);
            if (state.isEmpty()) {
                pacer.pause(nav.getUnreadableRetryMs());
                continue;
            }

            double zoom = state.get().zoom();
            PixelPoint here = CoordinateTransform.project(state.get().position(), zoom);
            PixelPoint there = CoordinateTransform.project(target, zoom);
            double dx = there.x() - here.x();
            double dy = there.y() - here.y();
            double distance = Math.hypot(dx, dy);
            if (distance <= tolerancePx) {
                return true;
            }

            double step = Math.min(nav.getMaxStepPx(), distance);
            double mx = dx / distance * step;
            double my = dy / distance * step;

            // Content follows the pointer, so pull the map the opposite way.
            tab.drag(center, new PixelPoint(center.x() - mx, center.y() - my), nav.getDragSteps());
            pacer.pause(nav.getDragSettleMs());
        }

        log.debug("Drag toward ({}, {}) did not converge", target.latitude(), target.longitude());
        return false;
    }

    // ── Grid sweep ───────────────────────────────────────────────────────────

    /**
     * Sample points around {@code center}: for each ring r, the top and bottom
     * rows (dy = ±r) from dx = -r..r. Interior rows are skipped, so ring r adds
     * 2(2r + 1) points.
     */
    public List<GeoPoint> planSweep(GeoPoint center, int zoom, int rings, int stepPx) {
        PixelPoint c = CoordinateTransform.project(center, zoom);
        List<GeoPoint> points = new ArrayList<>();

        for (int r = 1; r <= rings; r++) {
            for (int dx = -r; dx <= r; dx++) {
                for (int dy : new int[]{-r, r}) {
                    points.add(CoordinateTransform.unproject(c.x() + dx * stepPx, c.y() + dy * stepPx, zoom));
                }
            }
        }
        return points;
    }

    /**
     * Visits every sweep point, nudging the wheel at each so the map refreshes
     * its markers, and dwells long enough for backend calls to land.
     *
     * @return number of points visited
     */
    public int gridSweep(BrowserTab tab, GeoPoint center, int zoom, int rings, int stepPx, long dwellMs) {
        GapScraperProperties.Navigation nav = properties.getNavigation();
        List<GeoPoint> points = planSweep(center, zoom, rings, stepPx);

        int visited = 0;
        for (GeoPoint p : points) {
            visited++;
            GeoPoint target = CoordinateTransform.clampToRegion(p.latitude(), p.longitude(),
                    properties.getRegion().toBounds());
            log.debug("Sweep {}/{} → ({}, {})", visited, points.size(), target.latitude(), target.longitude());

            dragToTarget(tab, target, nav.getDragTolerancePx());
            tab.wheel(viewportCenter(), nav.getSweepNudgeDelta());
            pacer.pause(dwellMs);
        }
        return visited;
    }

    // ── Map UI ───────────────────────────────────────────────────────────────

    /**
     * Switches the map from complex pins to listing pins. Tries the direct
     * labels first, then the two-step dropdown.
     */
    public boolean switchToListingMarkers(BrowserTab tab) {
        GapScraperProperties.Labels labels = properties.getLabels();
        long timeout = properties.getBrowser().getClickTimeoutMs();
        long settle = properties.getNavigation().getLabelClickDelayMs();

        Optional<String> clicked = tab.clickFirst(labels.getListingMode(), timeout);
        if (clicked.isPresent()) {
            log.debug("Listing mode via '{}'", clicked.get());
            pacer.pause(settle);
            return true;
        }

        List<String> steps = labels.getListingModeFallback();
        for (String label : steps) {
            if (tab.clickFirst(List.of(label), timeout).isEmpty()) {
                log.debug("Listing mode fallback stopped at '{}'", label);
                return false;
            }
            pacer.pause(settle);
        }
        return !steps.isEmpty();
    }

    /**
     * Nudges the wheel at the viewport centre so the map reloads its markers.
     */
    public void nudge(BrowserTab tab, double deltaY) {
        tab.wheel(viewportCenter(), deltaY);
    }

    public Optional<MapState> readState(BrowserTab tab) {
        return parseMapState(tab.currentUrl());
    }

    static Optional<MapState> parseMapState(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        try {
            String ms = UriComponentsBuilder.fromUriString(url).build().getQueryParams().getFirst("ms");
            if (ms == null) return Optional.empty();

            String[] parts = URLDecoder.decode(ms, StandardCharsets.UTF_8).split(",");
            if (parts.length != 3) return Optional.empty();
            return Optional.of(new MapState(
                    Double.parseDouble(parts[0].trim()),
                    Double.parseDouble(parts[1].trim()),
                    Double.parseDouble(parts[2].trim())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private PixelPoint viewportCenter() {
        GapScraperProperties.Navigation nav = properties.getNavigation();
        return new PixelPoint(nav.getViewportWidth() / 2.0, nav.getViewportHeight() / 2.0);
    }
}
