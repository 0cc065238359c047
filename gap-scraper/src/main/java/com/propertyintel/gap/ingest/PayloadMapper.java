package com.propertyintel.gap.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.gap.model.LeaseHistoryRecord;
import com.propertyintel.gap.model.ListingSummary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads marker, listing and trade fields out of raw backend JSON.
 *
 * The desktop and mobile APIs name the same field differently
 * (articleNo / atclNo, floorInfo / flrInfo, ...), so each field is looked up
 * under every known name in priority order.
 */
@Component
public class PayloadMapper {

    private static final String SALE_CODE = "A1";
    private static final List<String> SALE_NAMES = List.of("매매", "SALE");
    private static final String VILLA_CODE = "VL";
    private static final List<String> VILLA_WORDS = List.of("빌라", "연립", "다세대");

    // ── Markers ──────────────────────────────────────────────────────────────

    public String markerId(JsonNode marker) {
        return text(marker, "markerId", "complexNo", "houseNo");
    }

    public String markerName(JsonNode marker) {
        return text(marker, "complexName", "houseName");
    }

    public int markerCount(JsonNode marker) {
        return integer(marker, "articleCount", "dealCount", "totalCount", "cnt");
    }

    /**
     * Villa test for records from a type-restricted endpoint: trust the type
     * code when present, otherwise look for villa words in the type name.
     */
    public boolean isVilla(JsonNode record) {
        String code = text(record, "realEstateTypeCode", "estateType", "rletTpCd").toUpperCase();
        if (!code.isEmpty()) {
            return VILLA_CODE.equals(code);
        }
        String name = text(record, "realEstateTypeName", "estateTypeName", "rletTpNm");
        return VILLA_WORDS.stream().anyMatch(name::contains);
    }

    // ── Listings ─────────────────────────────────────────────────────────────

    public String listingId(JsonNode listing) {
        return text(listing, "articleNo", "atclNo");
    }

    public boolean isSale(JsonNode listing) {
        String code = text(listing, "tradeType", "tradTp").toUpperCase();
        String name = text(listing, "tradeTypeName").trim();
        return SALE_CODE.equals(code) || SALE_NAMES.contains(name);
    }

    public ListingSummary toListing(JsonNode listing, String parentMarkerId) {
        return ListingSummary.builder()
                .id(listingId(listing))
                .name(text(listing, "articleName", "atclNm"))
                .parentMarkerId(parentMarkerId)
                .tradeTypeName(text(listing, "tradeTypeName", "tradTpNm"))
                .rawPriceText(text(listing, "dealOrWarrantPrc", "hanPrc", "prc"))
                .floorInfo(text(listing, "floorInfo", "flrInfo"))
                .grossArea(text(listing, "area1", "spc1"))
                .netArea(text(listing, "area2", "spc2"))
                .direction(text(listing, "direction"))
                .featureText(text(listing, "articleFeatureDesc", "atclFetrDesc"))
                .registrationDate(text(listing, "articleConfirmYmd", "atclCfmYmd"))
                .build();
    }

    // ── Trades ───────────────────────────────────────────────────────────────

    public LeaseHistoryRecord toTrade(JsonNode trade) {
        return new LeaseHistoryRecord(
                text(trade, "dealDate"),
                text(trade, "area"),
                text(trade, "floor"),
                text(trade, "dealPrice"));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * First non-blank scalar among {@code names}, as text. Never null.
     */
    static String text(JsonNode node, String... names) {
        if (node == null || !node.isObject()) return "";
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && v.isValueNode() && !v.isNull()) {
                String s = v.asText();
                if (!s.isBlank()) return s.trim();
            }
        }
        return "";
    }

    /**
     * First positive integer among {@code names}; 0 if none.
     */
    static int integer(JsonNode node, String... names) {
        if (node == null || !node.isObject()) return 0;
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v == null || v.isNull()) continue;
            int n = v.isNumber() ? v.asInt() : parseInt(v.asText());
            if (n > 0) return n;
        }
        return 0;
    }

    private static int parseInt(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
