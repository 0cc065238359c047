package com.propertyintel.gap.config;

import com.propertyintel.gap.model.ScrapeRun;
import com.propertyintel.gap.service.GapCollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final GapCollectionService collectionService;
    private final GapScraperProperties properties;

    /**
     * Start a collection run in the background.
     *
     * POST /scrape/trigger?lat=37.5608&lon=126.9888&zoom=15
     *
     * Missing parameters fall back to the configured start coordinates.
     */
    @PostMapping("/scrape/trigger")
    public ResponseEntity<Map<String, Object>> trigger(
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lon,
            @RequestParam(required = false) Integer zoom) {
        if (collectionService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "a collection run is already active"));
        }

        GapScraperProperties.Start start = properties.getStart();
        double latitude = lat != null ? lat : start.getLatitude();
        double longitude = lon != null ? lon : start.getLongitude();
        int level = zoom != null ? zoom : start.getZoom();

        new Thread(() -> collectionService.collect(latitude, longitude, level), "manual-collection").start();
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "latitude", latitude,
                "longitude", longitude,
                "zoom", level));
    }

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "property-intel-gap-scraper");
        body.put("version", "1.0.0");
        body.put("running", collectionService.isRunning());
        body.put("assetTypes", properties.getCollection().getAssetTypes());
        ScrapeRun last = collectionService.getLastRun().orElse(null);
        body.put("lastRun", last);
        return ResponseEntity.ok(body);
    }
}
