package com.propertyintel.gap.config;

import com.propertyintel.gap.model.AssetType;
import com.propertyintel.gap.navigation.RegionBounds;
import com.propertyintel.gap.output.LabelLocale;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "gap-scraper")
@Data
public class GapScraperProperties {

    private Region region = new Region();
    private Start start = new Start();
    private Collection collection = new Collection();
    private Navigation navigation = new Navigation();
    private Browser browser = new Browser();
    private Labels labels = new Labels();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    /** Mainland Korea plus Jeju. */
    @Data
    public static class Region {
        private double minLat = 33.0;
        private double maxLat = 39.5;
        private double minLon = 124.0;
        private double maxLon = 132.1;

        public RegionBounds toBounds() {
            return new RegionBounds(minLat, maxLat, minLon, maxLon);
        }
    }

    /** Coordinates used by scheduled and on-startup runs. Defaults to Seoul City Hall. */
    @Data
    public static class Start {
        private double latitude = 37.5608;
        private double longitude = 126.9888;
        private int zoom = 15;
    }

    @Data
    public static class Collection {
        private int maxComplexes = 800;
        private int maxListings = 10000;
        private int minListingCount = 2;
        private boolean prioritizeByCount = false;
        private int workers = 12;
        private boolean requirePreviousLease = true;
        private boolean gapFilterEnabled = true;
        private boolean sortBySalePrice = true;
        private List<AssetType> assetTypes = new ArrayList<>(List.of(AssetType.APT, AssetType.VL));
        private long complexVisitDelayMs = 1000;
        private long saleTabDelayMs = 600;
        private int progressLogEvery = 100;
    }

    @Data
    public static class Navigation {
        private int gridRings = 1;
        private int gridStepPx = 480;
        private long sweepDwellMs = 600;
        private int zoomMin = 15;
        private int zoomMax = 17;
        private int coarseZoomMin = 9;
        private int coarseZoomMax = 12;

        private int wheelIterationCap = 20;
        private long wheelStepDelayMs = 300;
        private double wheelDelta = 300;

        private int dragIterationCap = 18;
        private double dragTolerancePx = 3.5;
        private double maxStepPx = 800;
        private long dragSettleMs = 350;
        private int dragSteps = 20;

        private long unreadableRetryMs = 300;
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;

        private double sweepNudgeDelta = -40;
        private double captureNudgeDelta = -60;
        private long captureSettleMs = 800;
        private long labelClickDelayMs = 500;
    }

    @Data
    public static class Browser {
        private boolean headless = true;
        private boolean blockHeavyResources = true;
        private List<String> blockedResourceTypes = new ArrayList<>(List.of("image", "media", "font"));
        private boolean useMobileDetail = true;

        private String mapBaseUrl = "https://new.land.naver.com";
        private String mobileDetailUrl = "https://m.land.naver.com/article/info/{id}";
        private String mobileAlternateUrl = "https://m.land.naver.com/article/view/{id}";
        private String desktopDetailUrl = "https://new.land.naver.com/complexes?articleNo={id}";
        private String redirectHost = "fin.land.naver.com";
        private String notFoundMarker = "요청하신 페이지를 찾을 수 없어요";
        private int minBodyLength = 50;

        private long navigationTimeoutMs = 30000;
        private long responseWaitTimeoutMs = 20000;
        private long clickTimeoutMs = 2000;
        private long pageSettleMs = 300;
        /** Pauses after clicking the price-history tab, then the lease tab. */
        private long historyTabSettleMs = 200;
        private long leaseTabSettleMs = 250;

        private String desktopUserAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
        private String mobileUserAgent = "Mozilla/5.0 (iPhone; CPU iPhone OS 16_0 like Mac OS X) "
                + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/16.0 Mobile/15E148 Safari/604.1";
        private String mobileReferer = "https://m.land.naver.com/";
        private String locale = "ko-KR";
        private String acceptLanguage = "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7";
    }

    /**
     * Visible-text labels for in-page clicks, tried in order.
     */
    @Data
    public static class Labels {
        private List<String> listingMode = new ArrayList<>(List.of("상세매물검색", "매물", "매물검색", "매물 보기"));
        private List<String> listingModeFallback = new ArrayList<>(List.of("단지", "매물"));
        private List<String> saleTab = new ArrayList<>(List.of("매매"));
        private List<String> priceHistoryTab = new ArrayList<>(List.of("실거래가"));
        private List<String> leaseTab = new ArrayList<>(List.of("전세"));
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.XLSX;
        private String outputDir = "./output";
        private boolean includeHeader = true;
        private LabelLocale locale = LabelLocale.KO;
        private int previewSize = 5;

        public enum OutputMode {
            CSV, XLSX, BOTH
        }
    }

    @Data
    public static class Scheduling {
        /** Spring cron expression; "-" disables the scheduled run. */
        private String cron = "-";
        private boolean runOnStartup = false;
    }
}
