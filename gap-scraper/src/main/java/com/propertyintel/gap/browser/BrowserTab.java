package com.propertyintel.gap.browser;

import com.propertyintel.gap.navigation.PixelPoint;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * The capabilities the collector needs from a browser tab.
 *
 * Implementations translate driver failures into the return values below;
 * none of these methods throws for an ordinary page-level problem.
 */
public interface BrowserTab extends AutoCloseable {

    /**
     * @return false if the page could not be loaded (timeout, net error)
     */
    boolean navigate(String url);

    String currentUrl();

    /**
     * Press at {@code from}, move to {@code to} through {@code steps}
     * intermediate waypoints, release.
     */
    void drag(PixelPoint from, PixelPoint to, int steps);

    /**
     * Move the pointer to {@code at} and scroll vertically. Negative deltas
     * zoom the map in.
     */
    void wheel(PixelPoint at, double deltaY);

    /**
     * Clicks the first element whose visible text matches one of
     * {@code labels}, trying them in order.
     *
     * @return the label that was clicked, or empty if none was found
     */
    Optional<String> clickFirst(List<String> labels, long timeoutMs);

    /**
     * @return the visible text of the page body, or empty if it could not be read
     */
    Optional<String> bodyText();

    boolean waitForSelector(String selector, long timeoutMs);

    /**
     * Blocks until a response whose URL matches arrives.
     *
     * @return false on timeout
     */
    boolean awaitResponse(Predicate<String> urlMatcher, long timeoutMs);

    void onResponse(Consumer<CapturedResponse> listener);

    @Override
    void close();
}
