package com.propertyintel.gap.browser;

import com.propertyintel.gap.navigation.CoordinateTransform;
import com.propertyintel.gap.navigation.GeoPoint;
import com.propertyintel.gap.navigation.PixelPoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory map surface. Keeps a viewport that responds to drags and wheel
 * pulses the way the real map does, reports it through the {@code ms} query
 * parameter, and replays canned backend responses to listeners.
 */
public class FakeMapTab implements BrowserTab {

    private static final String BASE = "https://new.land.naver.com/complexes";

    private double latitude;
    private double longitude;
    private double zoom;

    private final Set<String> clickable = new LinkedHashSet<>();
    private final List<String> clicked = new ArrayList<>();
    private final List<String> navigations = new ArrayList<>();
    private final List<Consumer<CapturedResponse>> listeners = new ArrayList<>();
    private final List<CapturedResponse> onWheel = new ArrayList<>();
    private final Map<String, List<CapturedResponse>> onNavigate = new LinkedHashMap<>();

    private boolean readable = true;
    private int wheels;
    private int drags;
    private boolean closed;

    public FakeMapTab(double latitude, double longitude, double zoom) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.zoom = zoom;
    }

    // ── Setup ────────────────────────────────────────────────────────────────

    public FakeMapTab clickable(String... labels) {
        clickable.addAll(List.of(labels));
        return this;
    }

    /** Emitted after every wheel pulse. */
    public FakeMapTab respondOnWheel(String url, String body) {
        onWheel.add(CapturedResponse.of(url, body));
        return this;
    }

    /** Emitted when a navigated URL contains {@code urlPart}. */
    public FakeMapTab respondOnNavigate(String urlPart, String url, String body) {
        onNavigate.computeIfAbsent(urlPart, k -> new ArrayList<>()).add(CapturedResponse.of(url, body));
        return this;
    }

    public FakeMapTab unreadable() {
        readable = false;
        return this;
    }

    // ── BrowserTab ───────────────────────────────────────────────────────────

    @Override
    public boolean navigate(String url) {
        navigations.add(url);
        int ms = url.indexOf("ms=");
        if (ms >= 0) {
            String[] parts = url.substring(ms + 3).split("&")[0].split(",");
            latitude = Double.parseDouble(parts[0]);
            longitude = Double.parseDouble(parts[1]);
            zoom = Double.parseDouble(parts[2]);
        }
        onNavigate.forEach((part, responses) -> {
            if (url.contains(part)) responses.forEach(this::emit);
        });
        return true;
    }

    @Override
    public String currentUrl() {
        if (!readable) return BASE;
        return BASE + "?ms=" + latitude + "," + longitude + "," + zoom + "&a=APT&b=A1";
    }

    @Override
    public void drag(PixelPoint from, PixelPoint to, int steps) {
        drags++;
        PixelPoint here = CoordinateTransform.project(latitude, longitude, zoom);
        GeoPoint moved = CoordinateTransform.unproject(
                here.x() + (from.x() - to.x()), here.y() + (from.y() - to.y()), zoom);
        latitude = moved.latitude();
        longitude = moved.longitude();
    }

    @Override
    public void wheel(PixelPoint at, double deltaY) {
        wheels++;
        if (deltaY <= -100) {
            zoom += 1;
        } else if (deltaY >= 100) {
            zoom -= 1;
        }
        onWheel.forEach(this::emit);
    }

    @Override
    public Optional<String> clickFirst(List<String> labels, long timeoutMs) {
        for (String label : labels) {
            if (clickable.contains(label)) {
                clicked.add(label);
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> bodyText() {
        return Optional.empty();
    }

    @Override
    public boolean waitForSelector(String selector, long timeoutMs) {
        return true;
    }

    @Override
    public boolean awaitResponse(Predicate<String> urlMatcher, long timeoutMs) {
        return true;
    }

    @Override
    public void onResponse(Consumer<CapturedResponse> listener) {
        listeners.add(listener);
    }

    @Override
    public void close() {
        closed = true;
    }

    private void emit(CapturedResponse response) {
        listeners.forEach(l -> l.accept(response));
    }

    // ── Inspection ───────────────────────────────────────────────────────────

    public GeoPoint position() {
        return new GeoPoint(latitude, longitude);
    }

    public double zoom() {
        return zoom;
    }

    public int wheels() {
        return wheels;
    }

    public int drags() {
        return drags;
    }

    public List<String> clicked() {
        return clicked;
    }

    public List<String> navigations() {
        return navigations;
    }

    public boolean isClosed() {
        return closed;
    }
}
