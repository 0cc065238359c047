package com.propertyintel.gap.navigation;

/**
 * A position on the web-Mercator pixel plane of a given zoom level.
 */
public record PixelPoint(double x, double y) {

    public double distanceTo(PixelPoint other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
