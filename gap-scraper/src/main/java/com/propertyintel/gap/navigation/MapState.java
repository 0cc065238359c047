package com.propertyintel.gap.navigation;

/**
 * Viewport state as read back from the map surface.
 *
 * The surface reports a fractional zoom while an animation is in flight,
 * so {@link #zoomLevel()} rounds to the integer level of detail.
 */
public record MapState(double latitude, double longitude, double zoom) {

    public int zoomLevel() {
        return (int) Math.round(zoom);
    }

    public GeoPoint position() {
        return new GeoPoint(latitude, longitude);
    }
}
