package com.propertyintel.gap.model;

import lombok.Builder;
import lombok.Value;

/**
 * One advertised unit as it appeared in a listing-list response.
 * First sighting wins; later copies of the same id are dropped.
 */
@Value
@Builder
public class ListingSummary {

    String id;
    String name;
    String parentMarkerId;

    // ── Trade ───────────────────────────────────────────────────────────────
    String tradeTypeName;
    /** Price as displayed, e.g. "매매 3억 8,000" */
    String rawPriceText;

    // ── Structure ───────────────────────────────────────────────────────────
    String floorInfo;
    String grossArea;
    String netArea;
    String direction;
    String featureText;
    String registrationDate;
}
