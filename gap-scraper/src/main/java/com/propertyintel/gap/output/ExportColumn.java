package com.propertyintel.gap.output;

import com.propertyintel.gap.model.Candidate;
import com.propertyintel.gap.model.DetailRecord;
import com.propertyintel.gap.model.ListingSummary;

import java.util.function.Function;

/**
 * Export schema, in column order, with a header label per locale.
 */
public enum ExportColumn {

    LISTING_NAME("매물명", "Listing Name", c -> listing(c).getName()),
    LISTING_ID("매물번호", "Listing ID", c -> listing(c).getId()),
    TRADE_TYPE("거래유형", "Trade Type", c -> listing(c).getTradeTypeName()),
    SALE_AMOUNT("매매 금액(원)", "Sale Price (KRW)", Candidate::getSaleWon),
    FLOOR("층수", "Floor", c -> listing(c).getFloorInfo()),
    GROSS_AREA("면적(㎡)", "Gross Area (㎡)", c -> listing(c).getGrossArea()),
    NET_AREA("전용면적", "Net Area (㎡)", c -> listing(c).getNetArea()),
    DIRECTION("방향", "Direction", c -> listing(c).getDirection()),
    FEATURES("특징", "Features", c -> listing(c).getFeatureText()),
    REGISTERED("등록일", "Registered", c -> listing(c).getRegistrationDate()),
    AGENCY("부동산상호", "Agency", c -> detail(c).getAgencyName()),
    AGENT("중개사이름", "Agent", c -> detail(c).getAgentName()),
    PHONE_1("전화1", "Phone 1", c -> detail(c).getPhone1()),
    PHONE_2("전화2", "Phone 2", c -> detail(c).getPhone2()),
    LEASE_PERIOD_YEARS("전세_기간(년)", "Lease Period (Years)", c -> detail(c).getLeasePeriodYears()),
    LEASE_MAX("전세_기간내_최고(원)", "Lease Max in Period (KRW)", c -> detail(c).getLeaseMaxWon()),
    LEASE_MIN("전세_기간내_최저(원)", "Lease Min in Period (KRW)", c -> detail(c).getLeaseMinWon()),
    PREVIOUS_LEASE("기전세금(원)", "Previous Lease (KRW)", c -> detail(c).getPreviousLeaseWon()),
    GAP_AMOUNT("갭금액(원)", "Gap Amount (KRW)", Candidate::getGapAmountWon),
    GAP_RATIO("갭비율", "Gap Ratio", Candidate::getGapRatio);

    private static final ListingSummary NO_LISTING = ListingSummary.builder().build();
    private static final DetailRecord NO_DETAIL = DetailRecord.builder().build();

    private final String korean;
    private final String english;
    private final Function<Candidate, Object> extractor;

    ExportColumn(String korean, String english, Function<Candidate, Object> extractor) {
        this.korean = korean;
        this.english = english;
        this.extractor = extractor;
    }

    public String label(LabelLocale locale) {
        return locale == LabelLocale.EN ? english : korean;
    }

    /**
     * Raw cell value; null when the fact is unknown.
     */
    public Object value(Candidate candidate) {
        return extractor.apply(candidate);
    }

    public static String[] headers(LabelLocale locale) {
        ExportColumn[] columns = values();
        String[] headers = new String[columns.length];
        for (int i = 0; i < columns.length; i++) {
            headers[i] = columns[i].label(locale);
        }
        return headers;
    }

    private static ListingSummary listing(Candidate c) {
        return c.getListing() == null ? NO_LISTING : c.getListing();
    }

    private static DetailRecord detail(Candidate c) {
        return c.getDetail() == null ? NO_DETAIL : c.getDetail();
    }
}
