package com.propertyintel.gap.model;

/**
 * A historical transaction from the price-history endpoint. Value equality on
 * all four fields is the dedup key.
 */
public record LeaseHistoryRecord(String dealDate, String area, String floor, String dealPrice) {}
