package com.propertyintel.gap.browser;

import com.propertyintel.gap.navigation.PixelPoint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Detail-page tab serving canned body text per URL. A URL can be set to
 * redirect elsewhere once; clicking a label can swap in a different body.
 */
public class FakeDetailTab implements BrowserTab {

    private final Map<String, String> bodies = new HashMap<>();
    private final Map<String, String> redirects = new HashMap<>();
    private final Map<String, String> afterClick = new HashMap<>();
    private final Set<String> clickable = new LinkedHashSet<>();
    private final List<String> navigations = new ArrayList<>();
    private final List<String> clicks = new ArrayList<>();

    private String current = "about:blank";
    private String body = "";
    private boolean failNavigation;

    public FakeDetailTab page(String url, String text) {
        bodies.put(url, text);
        return this;
    }

    public FakeDetailTab redirect(String from, String to) {
        redirects.put(from, to);
        return this;
    }

    /** Clicking {@code label} replaces the current body with {@code text}. */
    public FakeDetailTab onClick(String label, String text) {
        clickable.add(label);
        afterClick.put(label, text);
        return this;
    }

    public FakeDetailTab clickable(String label) {
        clickable.add(label);
        return this;
    }

    public FakeDetailTab failingNavigation() {
        failNavigation = true;
        return this;
    }

    @Override
    public synchronized boolean navigate(String url) {
        if (failNavigation) {
            throw new IllegalStateException("tab crashed");
        }
        navigations.add(url);
        String target = redirects.remove(url);
        current = target != null ? target : url;
        body = bodies.getOrDefault(current, "");
        return true;
    }

    @Override
    public synchronized String currentUrl() {
        return current;
    }

    @Override
    public void drag(PixelPoint from, PixelPoint to, int steps) {
    }

    @Override
    public void wheel(PixelPoint at, double deltaY) {
    }

    @Override
    public synchronized Optional<String> clickFirst(List<String> labels, long timeoutMs) {
        for (String label : labels) {
            if (clickable.contains(label)) {
                clicks.add(label);
                if (afterClick.containsKey(label)) {
                    body = afterClick.get(label);
                }
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<String> bodyText() {
        return Optional.of(body);
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
    }

    @Override
    public void close() {
    }

    public synchronized List<String> clicks() {
        return new ArrayList<>(clicks);
    }

    public synchronized List<String> navigations() {
        return new ArrayList<>(navigations);
    }
}
