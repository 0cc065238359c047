package com.propertyintel.gap.navigation;

/**
 * A latitude/longitude pair in degrees.
 */
public record GeoPoint(double latitude, double longitude) {}
