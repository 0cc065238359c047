package com.propertyintel.gap.service;

import com.propertyintel.gap.browser.BrowserTab;
import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.model.AssetType;
import com.propertyintel.gap.navigation.GeoPoint;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Loads the map page for one asset type and waits for it to come alive.
 *
 * A failed navigation throws {@link MapLoadException} so Resilience4j can
 * retry it (instance "mapNavigation"). Waiting for the canvas and the first
 * data response is best effort: a timeout is logged and the run carries on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MapPageLoader {

    private final GapScraperProperties properties;

    public String scenarioUrl(AssetType type, GeoPoint center, int zoom) {
        return UriComponentsBuilder
                .fromHttpUrl(properties.getBrowser().getMapBaseUrl() + "/" + type.family())
                .queryParam("ms", center.latitude() + "," + center.longitude() + "," + zoom)
                .queryParam("a", type.name())
                .queryParam("b", "A1")
                .toUriString();
    }

    @Retry(name = "mapNavigation")
    public void open(BrowserTab tab, AssetType type, GeoPoint center, int zoom) {
        String url = scenarioUrl(type, center, zoom);
        log.debug("Opening map: {}", url);
        if (!tab.navigate(url)) {
            throw new MapLoadException("Map page did not load: " + url);
        }

        long timeout = properties.getBrowser().getResponseWaitTimeoutMs();
        if (!tab.waitForSelector("canvas", timeout)) {
            log.warn("Map canvas not ready after {} ms, continuing", timeout);
        }
        if (!tab.awaitResponse(u -> isFirstDataResponse(type, u), timeout)) {
            log.warn("No map data response after {} ms, continuing", timeout);
        }
    }

    static boolean isFirstDataResponse(AssetType type, String url) {
        return url.contains(type.markerEndpoint())
                || AssetType.ofListingUrl(url).isPresent()
                || url.contains("/api/map/");
    }
}
