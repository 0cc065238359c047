package com.propertyintel.gap.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Asset families the map can be filtered to. Each family has its own marker
 * and listing endpoints on the backend.
 */
public enum AssetType {

    /** Apartment complexes, served by the {@code complexes} endpoints. */
    APT("complexes", "articles/complex"),

    /** Villas and row houses, served by the {@code houses} endpoints. */
    VL("houses", "articles/house");

    private final String family;
    private final String listingPath;

    AssetType(String family, String listingPath) {
        this.family = family;
        this.listingPath = listingPath;
    }

    public String family() {
        return family;
    }

    public String listingPath() {
        return listingPath;
    }

    /** URL fragment of the marker endpoint, e.g. {@code houses/single-markers}. */
    public String markerEndpoint() {
        return family + "/single-markers";
    }

    /** URL prefix of the per-complex listing endpoint, e.g. {@code /api/articles/house/}. */
    public String listingEndpoint() {
        return "/api/" + listingPath + "/";
    }

    public static Optional<AssetType> ofMarkerUrl(String url) {
        return Arrays.stream(values()).filter(t -> url.contains(t.markerEndpoint())).findFirst();
    }

    public static Optional<AssetType> ofListingUrl(String url) {
        return Arrays.stream(values()).filter(t -> url.contains(t.listingEndpoint())).findFirst();
    }

    /** Whether the endpoint family returns mixed types that must be filtered by tag. */
    public boolean typeRestricted() {
        return this == VL;
    }
}
