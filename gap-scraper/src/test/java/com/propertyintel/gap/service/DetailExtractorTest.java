package com.propertyintel.gap.service;

import com.propertyintel.gap.browser.FakeDetailTab;
import com.propertyintel.gap.browser.Pacer;
import com.propertyintel.gap.config.GapScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DetailExtractorTest {

    private static final String INFO = "https://m.land.naver.com/article/info/100";
    private static final String VIEW = "https://m.land.naver.com/article/view/100";

    private static final String NO_LEASE_PAGE = String.join("\n",
            "매물정보 매매 3억",
            "중개사",
            "김철수",
            "행복공인중개사사무소",
            "전화 02-123-4567",
            "이 매물은 현재 임차인이 없는 상태입니다");

    private static final String LEASE_TAB_PAGE = DetailTextParserTest.FULL_PAGE + "\n5년 내 최고 5억";

    private GapScraperProperties properties;
    private DetailExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new GapScraperProperties();
        extractor = new DetailExtractor(properties, new DetailTextParser(new CurrencyParser()), Pacer.none());
    }

    @Test
    void extract_shouldParsePrimaryPage() {
        FakeDetailTab tab = new FakeDetailTab().page(INFO, DetailTextParserTest.FULL_PAGE);

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(DetailOutcome.Kind.EXTRACTED, outcome.kind());
        assertTrue(outcome.usable());
        assertFalse(outcome.redirected());
        assertEquals(350_000_000L, outcome.record().getPreviousLeaseWon());
        assertEquals("김철수", outcome.record().getAgentName());
        assertEquals(List.of(INFO), tab.navigations());
    }

    @Test
    void extract_shouldReloadOnceWhenBouncedToRedirectHost() {
        FakeDetailTab tab = new FakeDetailTab()
                .redirect(INFO, "https://fin.land.naver.com/articles/100")
                .page(INFO, DetailTextParserTest.FULL_PAGE);

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(DetailOutcome.Kind.EXTRACTED, outcome.kind());
        assertTrue(outcome.redirected());
        assertEquals(List.of(INFO, INFO), tab.navigations());
    }

    @Test
    void extract_shouldUseAlternateUrlWhenPageNotFound() {
        FakeDetailTab tab = new FakeDetailTab()
                .page(INFO, "요청하신 페이지를 찾을 수 없어요")
                .page(VIEW, DetailTextParserTest.FULL_PAGE);

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(DetailOutcome.Kind.EXTRACTED, outcome.kind());
        assertTrue(outcome.redirected());
        assertEquals(List.of(INFO, VIEW), tab.navigations());
    }

    @Test
    void extract_shouldSkipWithoutFurtherWorkWhenPreviousLeaseMissing() {
        FakeDetailTab tab = new FakeDetailTab()
                .page(INFO, NO_LEASE_PAGE)
                .clickable("실거래가")
                .clickable("전세");

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(DetailOutcome.Kind.SKIPPED_NO_PREVIOUS_LEASE, outcome.kind());
        assertTrue(outcome.record().isSkip());
        assertFalse(outcome.usable());
        assertTrue(tab.clicks().isEmpty());
    }

    @Test
    void extract_shouldKeepListingWithoutPreviousLeaseWhenNotRequired() {
        properties.getCollection().setRequirePreviousLease(false);
        FakeDetailTab tab = new FakeDetailTab().page(INFO, NO_LEASE_PAGE);

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(DetailOutcome.Kind.EXTRACTED, outcome.kind());
        assertNull(outcome.record().getPreviousLeaseWon());
        assertEquals("행복공인중개사사무소", outcome.record().getAgencyName());
    }

    @Test
    void extract_shouldReadLeaseFactsFromLeaseTab() {
        FakeDetailTab tab = new FakeDetailTab()
                .page(INFO, DetailTextParserTest.FULL_PAGE.replace("2년 내 최고 4억 2,000만\n", ""))
                .clickable("실거래가")
                .onClick("전세", LEASE_TAB_PAGE);

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(List.of("실거래가", "전세"), tab.clicks());
        assertEquals(420_000_000L, outcome.record().getLeaseMaxWon());
        assertEquals(350_000_000L, outcome.record().getPreviousLeaseWon());
    }

    @Test
    void extract_shouldPauseForConfiguredTabSettleTimes() {
        properties.getBrowser().setHistoryTabSettleMs(11);
        properties.getBrowser().setLeaseTabSettleMs(22);
        List<Long> pauses = new ArrayList<>();
        DetailExtractor paced = new DetailExtractor(properties, new DetailTextParser(new CurrencyParser()), pauses::add);
        FakeDetailTab tab = new FakeDetailTab()
                .page(INFO, DetailTextParserTest.FULL_PAGE)
                .clickable("실거래가")
                .onClick("전세", LEASE_TAB_PAGE);

        paced.extract(tab, "100");

        assertTrue(pauses.contains(11L));
        assertTrue(pauses.indexOf(11L) < pauses.indexOf(22L));
    }

    @Test
    void extract_shouldKeepPageTextWhenLeaseTabMissing() {
        FakeDetailTab tab = new FakeDetailTab()
                .page(INFO, DetailTextParserTest.FULL_PAGE)
                .clickable("실거래가");

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(DetailOutcome.Kind.EXTRACTED, outcome.kind());
        assertEquals(2, outcome.record().getLeasePeriodYears());
    }

    @Test
    void extract_shouldReportFailureInsteadOfThrowing() {
        FakeDetailTab tab = new FakeDetailTab().failingNavigation();

        DetailOutcome outcome = extractor.extract(tab, "100");

        assertEquals(DetailOutcome.Kind.FAILED, outcome.kind());
        assertNull(outcome.record());
        assertNotNull(outcome.error());
    }

    @Test
    void primaryUrl_shouldFollowDetailMode() {
        assertEquals(INFO, extractor.primaryUrl("100"));

        properties.getBrowser().setUseMobileDetail(false);
        assertEquals("https://new.land.naver.com/complexes?articleNo=100", extractor.primaryUrl("100"));
    }
}
