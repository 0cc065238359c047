package com.propertyintel.gap.service;

/**
 * Decides whether a listing is worth reporting given its sale price and the
 * deposit of the lease already on it. Either amount may be null.
 */
@FunctionalInterface
public interface GapPolicy {

    boolean accepts(Long saleWon, Long previousLeaseWon);

    /**
     * Keeps listings whose existing lease deposit covers the whole sale price,
     * i.e. gap amount ≤ 0. Unknown amounts are rejected.
     */
    static GapPolicy previousLeaseCoversSale() {
        return (sale, lease) -> sale != null && lease != null && lease >= sale;
    }

    static GapPolicy acceptAll() {
        return (sale, lease) -> true;
    }
}
