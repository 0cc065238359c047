package com.propertyintel.gap.service;

import com.propertyintel.gap.model.DetailRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls broker and lease facts out of the visible text of a listing page.
 *
 * Each field is found independently; a miss leaves that field null or empty
 * and does not affect the others.
 */
@Component
@RequiredArgsConstructor
public class DetailTextParser {

    /** Amount text: digits, separators, unit words and horizontal space (no line breaks). */
    private static final String AMOUNT = "([\\d,억천만\\h]+)";

    private static final Pattern PREVIOUS_LEASE = Pattern.compile("기전세금\\s*" + AMOUNT);
    private static final Pattern LEASE_HIGH = Pattern.compile("(\\d+)\\s*년\\s*내\\s*최고\\s*" + AMOUNT);
    private static final Pattern LEASE_LOW = Pattern.compile("(\\d+)\\s*년\\s*내\\s*최저\\s*" + AMOUNT);
    private static final Pattern PHONE = Pattern.compile("0\\d{1,2}-\\d{3,4}-\\d{4}");

    private static final Pattern BROKER_NAME = Pattern.compile("[가-힣]{2,4}");
    private static final Set<String> BROKER_STOPLIST = Set.of("이미지", "상세보기", "중개사", "중개소");
    private static final List<String> BROKER_CONTEXT = List.of("중개사", "프로필", "중개소");
    private static final int CONTEXT_BEFORE = 3;
    private static final int CONTEXT_AFTER = 1;

    private static final Pattern AGENCY = Pattern.compile("공인중개사|부동산");
    private static final List<String> AGENCY_EXCLUDE = List.of("상세보기", "전화");
    private static final int AGENCY_LOOKAHEAD = 5;
    private static final Pattern AGENCY_LABELLED = Pattern.compile("중개소\\s+([^\\n]+)");
    private static final String IMAGE_WORD = "이미지";

    private final CurrencyParser currencyParser;

    /**
     * The deposit of the lease already attached to the unit. Zero counts as absent.
     */
    public OptionalLong previousLease(String text) {
        if (text == null) return OptionalLong.empty();
        Matcher m = PREVIOUS_LEASE.matcher(text);
        if (!m.find()) return OptionalLong.empty();

        OptionalLong amount = currencyParser.parseAmount(m.group(1).trim());
        return amount.isPresent() && amount.getAsLong() > 0 ? amount : OptionalLong.empty();
    }

    public DetailRecord parse(String text, OptionalLong previousLease) {
        String body = text == null ? "" : text;
        List<String> lines = lines(body);

        int brokerIdx = findBroker(lines);
        String agentName = brokerIdx >= 0 ? lines.get(brokerIdx) : "";
        String agency = findAgency(lines, brokerIdx, body);

        Matcher high = LEASE_HIGH.matcher(body);
        Matcher low = LEASE_LOW.matcher(body);
        boolean hasHigh = high.find();
        boolean hasLow = low.find();

        Integer periodYears = null;
        if (hasHigh) {
            periodYears = years(high.group(1));
        } else if (hasLow) {
            periodYears = years(low.group(1));
        }

        List<String> phones = phones(body);

        return DetailRecord.builder()
                .agencyName(agency)
                .agentName(agentName)
                .phone1(phones.size() >= 1 ? phones.get(0) : "")
                .phone2(phones.size() >= 2 ? phones.get(1) : "")
                .leasePeriodYears(periodYears)
                .leaseMaxWon(hasHigh ? amount(high.group(2)) : null)
                .leaseMinWon(hasLow ? amount(low.group(2)) : null)
                .previousLeaseWon(previousLease.isPresent() ? previousLease.getAsLong() : null)
                .skip(false)
                .build();
    }

    // ── Fields ───────────────────────────────────────────────────────────────

    /**
     * Index of the first 2-4 syllable line with a broker keyword in the three
     * lines above or the line below it; -1 if none.
     */
    int findBroker(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!BROKER_NAME.matcher(line).matches() || BROKER_STOPLIST.contains(line)) continue;

            String context = String.join("\n",
                    lines.subList(Math.max(0, i - CONTEXT_BEFORE), Math.min(lines.size(), i + CONTEXT_AFTER + 1)));
            if (BROKER_CONTEXT.stream().anyMatch(context::contains)) {
                return i;
            }
        }
        return -1;
    }

    String findAgency(List<String> lines, int brokerIdx, String body) {
        if (brokerIdx >= 0) {
            int end = Math.min(lines.size(), brokerIdx + 1 + AGENCY_LOOKAHEAD);
            for (String line : lines.subList(brokerIdx + 1, end)) {
                if (AGENCY.matcher(line).find() && AGENCY_EXCLUDE.stream().noneMatch(line::contains)) {
                    return line;
                }
            }
        }

        Matcher labelled = AGENCY_LABELLED.matcher(body);
        if (labelled.find()) {
            String candidate = labelled.group(1).trim();
            if (!candidate.contains(IMAGE_WORD)) {
                return candidate;
            }
        }
        return "";
    }

    private List<String> phones(String body) {
        List<String> found = new ArrayList<>();
        Matcher m = PHONE.matcher(body);
        while (m.find() && found.size() < 2) {
            found.add(m.group());
        }
        return found;
    }

    private static Integer years(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Long amount(String text) {
        OptionalLong parsed = currencyParser.parseAmount(text.trim());
        return parsed.isPresent() ? parsed.getAsLong() : null;
    }

    private static List<String> lines(String body) {
        return Arrays.stream(body.split("\\R"))
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .toList();
    }
}
