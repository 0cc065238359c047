package com.propertyintel.gap.ingest;

import com.propertyintel.gap.model.AssetType;

/**
 * Backend response families the map page produces, told apart by URL shape.
 */
public enum ResponseChannel {

    /** {@code .../complexes/single-markers} and {@code .../houses/single-markers} */
    MARKER,

    /** {@code /api/articles/complex/{id}} and {@code /api/articles/house/{id}} */
    LISTING_LIST,

    /** {@code /api/complexes/{id}/prices...} */
    PRICE_HISTORY,

    /** Any other {@code /api/} call; scanned for embedded listings. */
    GENERIC,

    /** Not a data endpoint. */
    NONE;

    public static ResponseChannel classify(String url) {
        if (url == null) return NONE;

        if (AssetType.ofMarkerUrl(url).isPresent()) {
            return MARKER;
        }
        if (AssetType.ofListingUrl(url).isPresent()) {
            return LISTING_LIST;
        }
        if (url.contains("/api/complexes/") && url.contains("/prices")) {
            return PRICE_HISTORY;
        }
        if (url.contains("/api/")) {
            return GENERIC;
        }
        return NONE;
    }
}
