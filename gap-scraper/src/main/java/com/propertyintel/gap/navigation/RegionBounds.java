package com.propertyintel.gap.navigation;

/**
 * Fixed rectangle every navigation target is clamped into.
 */
public record RegionBounds(double minLat, double maxLat, double minLon, double maxLon) {

    public RegionBounds {
        if (minLat > maxLat || minLon > maxLon) {
            throw new IllegalArgumentException("Region bounds are inverted: "
                    + minLat + ".." + maxLat + ", " + minLon + ".." + maxLon);
        }
    }

    public boolean contains(GeoPoint p) {
        return p.latitude() >= minLat && p.latitude() <= maxLat
                && p.longitude() >= minLon && p.longitude() <= maxLon;
    }
}
