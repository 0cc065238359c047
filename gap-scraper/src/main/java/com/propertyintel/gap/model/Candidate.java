package com.propertyintel.gap.model;

import lombok.Builder;
import lombok.Value;

/**
 * A listing joined with its detail facts and the sale-vs-lease gap.
 *
 * gapAmountWon = saleWon - previousLeaseWon; gapRatio = gapAmountWon / saleWon.
 * Either may be null when an input amount is unknown.
 */
@Value
@Builder
public class Candidate {

    ListingSummary listing;
    DetailRecord detail;

    Long saleWon;
    Long gapAmountWon;
    Double gapRatio;
}
