package com.propertyintel.gap.service;

import com.propertyintel.gap.model.DetailRecord;

/**
 * Result of fetching one listing's detail page.
 *
 * @param redirected the primary URL bounced or came back empty and the
 *                   alternate URL was used
 */
public record DetailOutcome(Kind kind, DetailRecord record, boolean redirected, String error) {

    public enum Kind {
        EXTRACTED,
        SKIPPED_NO_PREVIOUS_LEASE,
        FAILED
    }

    public static DetailOutcome extracted(DetailRecord record, boolean redirected) {
        return new DetailOutcome(Kind.EXTRACTED, record, redirected, null);
    }

    public static DetailOutcome skipped(boolean redirected) {
        return new DetailOutcome(Kind.SKIPPED_NO_PREVIOUS_LEASE, DetailRecord.skipped(), redirected, null);
    }

    public static DetailOutcome failed(String error) {
        return new DetailOutcome(Kind.FAILED, null, false, error);
    }

    public boolean usable() {
        return kind == Kind.EXTRACTED && record != null && !record.isSkip();
    }
}
