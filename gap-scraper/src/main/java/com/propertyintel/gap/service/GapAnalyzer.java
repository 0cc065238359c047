package com.propertyintel.gap.service;

import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.model.Candidate;
import com.propertyintel.gap.model.DetailRecord;
import com.propertyintel.gap.model.ListingSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Computes the sale-vs-lease gap for each listing and keeps the ones the
 * configured {@link GapPolicy} accepts.
 */
@Service
@Slf4j
public class GapAnalyzer {

    private static final Pattern SALE_LABEL = Pattern.compile("^\\s*매매\\s*");

    private final CurrencyParser currencyParser;
    private final GapPolicy policy;

    public GapAnalyzer(CurrencyParser currencyParser, GapPolicy policy, GapScraperProperties properties) {
        this.currencyParser = currencyParser;
        this.policy = properties.getCollection().isGapFilterEnabled() ? policy : GapPolicy.acceptAll();
    }

    public OptionalLong salePrice(ListingSummary listing) {
        String raw = listing.getRawPriceText();
        if (raw == null) return OptionalLong.empty();
        return currencyParser.parseAmount(SALE_LABEL.matcher(raw).replaceFirst("").trim());
    }

    /**
     * Cheapest first; listings without a readable price go last. Only affects
     * which listings survive a backlog cap.
     */
    public List<ListingSummary> prioritise(Collection<ListingSummary> listings) {
        List<ListingSummary> sorted = new ArrayList<>(listings);
        sorted.sort(Comparator.comparingLong(l -> salePrice(l).orElse(Long.MAX_VALUE)));
        return sorted;
    }

    public Optional<Candidate> evaluate(ListingSummary listing, DetailRecord detail) {
        if (detail == null || detail.isSkip()) {
            return Optional.empty();
        }

        OptionalLong parsedSale = salePrice(listing);
        Long sale = parsedSale.isPresent() ? parsedSale.getAsLong() : null;
        Long lease = detail.getPreviousLeaseWon();
        if (!policy.accepts(sale, lease)) {
            return Optional.empty();
        }

        Long gapAmount = sale != null && lease != null ? sale - lease : null;
        Double gapRatio = gapAmount != null && sale != 0 ? (double) gapAmount / sale : null;

        return Optional.of(Candidate.builder()
                .listing(listing)
                .detail(detail)
                .saleWon(sale)
                .gapAmountWon(gapAmount)
                .gapRatio(gapRatio)
                .build());
    }

    /**
     * Evaluates every listing that has a detail record and ranks the survivors.
     */
    public List<Candidate> analyze(Collection<ListingSummary> listings, Map<String, DetailRecord> details) {
        List<Candidate> kept = new ArrayList<>();
        for (ListingSummary listing : listings) {
            evaluate(listing, details.get(listing.getId())).ifPresent(kept::add);
        }
        log.debug("{} of {} listings kept by gap policy", kept.size(), listings.size());
        return rank(kept);
    }

    /**
     * Ascending gap ratio: deepest negative gap first, unknown ratios last.
     */
    public List<Candidate> rank(Collection<Candidate> candidates) {
        List<Candidate> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparing(Candidate::getGapRatio, Comparator.nullsLast(Comparator.naturalOrder())));
        return ranked;
    }
}
