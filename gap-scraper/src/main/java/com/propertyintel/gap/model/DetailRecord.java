package com.propertyintel.gap.model;

import lombok.Builder;
import lombok.Value;

/**
 * Facts pulled from a listing's detail page. Amounts are in won.
 */
@Value
@Builder
public class DetailRecord {

    String agencyName;
    String agentName;
    String phone1;
    String phone2;

    Integer leasePeriodYears;
    Long leaseMaxWon;
    Long leaseMinWon;

    /** Deposit of the lease currently attached to the unit (기전세금). */
    Long previousLeaseWon;

    /** Set when the page had no previous-lease amount and nothing else was parsed. */
    boolean skip;

    public static DetailRecord skipped() {
        return DetailRecord.builder().skip(true).build();
    }
}
