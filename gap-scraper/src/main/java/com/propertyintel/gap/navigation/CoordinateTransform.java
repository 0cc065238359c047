package com.propertyintel.gap.navigation;

/**
 * Web-Mercator projection between geographic coordinates and the pixel plane
 * the map surface renders at a given zoom.
 *
 * The plane is {@code 256 * 2^zoom} pixels wide and high; (0, 0) is the
 * north-west corner at longitude -180.
 */
public final class CoordinateTransform {

    private static final double TILE_SIZE = 256.0;

    private CoordinateTransform() {
    }

    public static double scale(double zoom) {
        return TILE_SIZE * Math.pow(2.0, zoom);
    }

    public static PixelPoint project(double lat, double lon, double zoom) {
        double scale = scale(zoom);
        double x = (lon + 180.0) / 360.0 * scale;
        double sinLat = Math.sin(Math.toRadians(lat));
        double y = (0.5 - Math.log((1 + sinLat) / (1 - sinLat)) / (4 * Math.PI)) * scale;
        return new PixelPoint(x, y);
    }

    public static PixelPoint project(GeoPoint point, double zoom) {
        return project(point.latitude(), point.longitude(), zoom);
    }

    /**
     * Inverse of {@link #project}, using the inverse Gudermannian for latitude.
     */
    public static GeoPoint unproject(double x, double y, double zoom) {
        double scale = scale(zoom);
        double lon = x / scale * 360.0 - 180.0;
        double n = Math.PI - 2.0 * Math.PI * y / scale;
        double lat = Math.toDegrees(Math.atan(Math.sinh(n)));
        return new GeoPoint(lat, lon);
    }

    /**
     * Clamps each axis independently into {@code bounds}.
     */
    public static GeoPoint clampToRegion(double lat, double lon, RegionBounds bounds) {
        double clampedLat = Math.max(bounds.minLat(), Math.min(lat, bounds.maxLat()));
        double clampedLon = Math.max(bounds.minLon(), Math.min(lon, bounds.maxLon()));
        return new GeoPoint(clampedLat, clampedLon);
    }
}
