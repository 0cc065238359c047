package com.propertyintel.gap.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts Korean price notation into whole won.
 *
 * Handled forms:
 *   "3억 8,000만원"  → 380,000,000
 *   "7.5억"          → 750,000,000
 *   "3억2천"         → 320,000,000  (천 after 억 counts thousands of 만)
 *   "8,500"          → 85,000,000   (bare number without 원 is in 만)
 *   "320000000원"    → 320,000,000  (bare number with 원 is already won)
 *
 * Anything else yields an empty result; callers treat that as an unknown amount.
 */
@Component
public class CurrencyParser {

    private static final long MAN = 10_000L;
    private static final BigDecimal EOK = BigDecimal.valueOf(100_000_000L);
    private static final String WON_MARK = "원";

    private static final Pattern EOK_QUANTITY = Pattern.compile("(\\d+(?:\\.\\d+)?)억");
    private static final Pattern EOK_THEN_MAN = Pattern.compile("억(\\d+)만");
    private static final Pattern EOK_THEN_BARE = Pattern.compile("억(\\d+)$");
    private static final Pattern EOK_THEN_THOUSAND = Pattern.compile("억(\\d+)천");
    private static final Pattern MAN_QUANTITY = Pattern.compile("(\\d+)만");
    private static final Pattern THOUSAND_QUANTITY = Pattern.compile("(\\d+)천만?");
    private static final Pattern BARE_NUMBER = Pattern.compile("\\d+");

    public OptionalLong parseAmount(String text) {
        if (text == null) return OptionalLong.empty();

        String t = text.replaceAll("\\s+", "").replace(",", "");
        boolean hasWonMark = t.contains(WON_MARK);
        t = t.replace(WON_MARK, "");
        if (t.isEmpty()) return OptionalLong.empty();

        try {
            Matcher eok = EOK_QUANTITY.matcher(t);
            if (eok.find()) {
                long eokValue = new BigDecimal(eok.group(1))
                        .multiply(EOK)
                        .setScale(0, RoundingMode.HALF_UP)
                        .longValueExact();
                return OptionalLong.of(Math.addExact(eokValue, Math.multiplyExact(manAfterEok(t), MAN)));
            }

            Matcher man = MAN_QUANTITY.matcher(t);
            if (man.find()) {
                return OptionalLong.of(Math.multiplyExact(Long.parseLong(man.group(1)), MAN));
            }

            Matcher thousand = THOUSAND_QUANTITY.matcher(t);
            if (thousand.find()) {
                return OptionalLong.of(Math.multiplyExact(Long.parseLong(thousand.group(1)), 1000 * MAN));
            }

            if (BARE_NUMBER.matcher(t).matches()) {
                long n = Long.parseLong(t);
                return OptionalLong.of(hasWonMark ? n : Math.multiplyExact(n, MAN));
            }
        } catch (NumberFormatException | ArithmeticException e) {
            // digits or product too large for a long
            return OptionalLong.empty();
        }
        return OptionalLong.empty();
    }

    /**
     * The 만 amount trailing an 억 quantity: "억8000만", "억8000" or "억2천".
     */
    private long manAfterEok(String t) {
        Matcher m = EOK_THEN_MAN.matcher(t);
        if (m.find()) return Long.parseLong(m.group(1));

        m = EOK_THEN_BARE.matcher(t);
        if (m.find()) return Long.parseLong(m.group(1));

        m = EOK_THEN_THOUSAND.matcher(t);
        if (m.find()) return Math.multiplyExact(Long.parseLong(m.group(1)), 1000L);

        return 0;
    }
}
