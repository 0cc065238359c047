package com.propertyintel.gap.ingest;

import com.propertyintel.gap.model.AssetType;
import com.propertyintel.gap.model.LeaseHistoryRecord;
import com.propertyintel.gap.model.ListingSummary;
import com.propertyintel.gap.model.Marker;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Buffers owned by one collection run: markers, listings and trade history
 * seen so far, plus the capture switch.
 *
 * Identity sets only grow. Entries keep first-seen order so the detail phase
 * is reproducible for a given sequence of responses.
 */
public class CollectionSession {

    private final Map<String, Marker> markers = new LinkedHashMap<>();
    private final Map<String, ListingSummary> listings = new LinkedHashMap<>();
    private final Set<LeaseHistoryRecord> trades = new LinkedHashSet<>();

    private volatile boolean captureActive;

    @Getter
    private int malformedResponses;

    // ── Capture flag ─────────────────────────────────────────────────────────

    public boolean isCaptureActive() {
        return captureActive;
    }

    public void startCapture() {
        captureActive = true;
    }

    public void stopCapture() {
        captureActive = false;
    }

    // ── Mutators ─────────────────────────────────────────────────────────────

    /**
     * Records a marker sighting: inserts on first sight, otherwise keeps the
     * larger count and any non-blank name.
     *
     * @return true if the marker was new
     */
    public boolean observeMarker(String id, AssetType type, String name, int count) {
        Marker existing = markers.get(id);
        if (existing == null) {
            markers.put(id, new Marker(id, type, name, count));
            return true;
        }
        existing.rename(name);
        existing.raiseCount(count);
        return false;
    }

    /**
     * @return true if the listing id was new
     */
    public boolean addListing(ListingSummary listing) {
        return listings.putIfAbsent(listing.getId(), listing) == null;
    }

    public boolean hasListing(String id) {
        return listings.containsKey(id);
    }

    /**
     * @return true if the (date, area, floor, price) tuple was new
     */
    public boolean addTrade(LeaseHistoryRecord trade) {
        return trades.add(trade);
    }

    void recordMalformed() {
        malformedResponses++;
    }

    // ── Views ────────────────────────────────────────────────────────────────

    public Collection<Marker> markers() {
        return Collections.unmodifiableCollection(markers.values());
    }

    public Marker marker(String id) {
        return markers.get(id);
    }

    public List<ListingSummary> listings() {
        return new ArrayList<>(listings.values());
    }

    public int markerCount() {
        return markers.size();
    }

    public int listingCount() {
        return listings.size();
    }

    public int tradeCount() {
        return trades.size();
    }
}
