package com.propertyintel.gap.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.gap.browser.CapturedResponse;
import com.propertyintel.gap.model.AssetType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns backend responses observed during map navigation into session
 * entries.
 *
 * Responses are classified by URL into a {@link ResponseChannel}; each
 * channel has its own handler. A response that cannot be read or has an
 * unexpected shape is counted and skipped, never thrown back into the
 * navigation loop.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResponseIngestor {

    private static final Pattern LISTING_PARENT = Pattern.compile("/api/articles/(complex|house)/(\\d+)");

    private final ObjectMapper objectMapper;
    private final PayloadMapper mapper;

    /**
     * A listener suitable for {@code BrowserTab.onResponse}, bound to one session.
     */
    public Consumer<CapturedResponse> listenerFor(CollectionSession session) {
        return response -> {
            IngestResult result = ingest(session, response);
            if (result.added() > 0) {
                log.debug("{} +{} from {} (listings now {})",
                        result.channel(), result.added(), response.url(), session.listingCount());
            }
        };
    }

    public IngestResult ingest(CollectionSession session, CapturedResponse response) {
        if (!session.isCaptureActive()) {
            return IngestResult.captureOff();
        }

        String url = response.url();
        ResponseChannel channel = ResponseChannel.classify(url);
        if (channel == ResponseChannel.NONE) {
            return IngestResult.unrecognised();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.readBody());
        } catch (Exception e) {
            // Non-JSON /api/ bodies are common (HTML errors, empty 204s)
            log.debug("Unreadable {} response from {}: {}", channel, url, e.getMessage());
            session.recordMalformed();
            return IngestResult.malformed(channel);
        }
        if (root == null || root.isMissingNode()) {
            session.recordMalformed();
            return IngestResult.malformed(channel);
        }

        try {
            return switch (channel) {
                case MARKER -> ingestMarkers(session, url, root);
                case LISTING_LIST -> ingestListingList(session, url, root);
                case PRICE_HISTORY -> ingestPriceHistory(session, root);
                case GENERIC -> IngestResult.accepted(channel, collectListings(session, root));
                case NONE -> IngestResult.unrecognised();
            };
        } catch (RuntimeException e) {
            log.warn("Skipping {} response from {}: {}", channel, url, e.getMessage());
            session.recordMalformed();
            return IngestResult.malformed(channel);
        }
    }

    // ── Channels ─────────────────────────────────────────────────────────────

    private IngestResult ingestMarkers(CollectionSession session, String url, JsonNode root) {
        if (!root.isArray()) {
            session.recordMalformed();
            return IngestResult.malformed(ResponseChannel.MARKER);
        }
        AssetType type = AssetType.ofMarkerUrl(url).orElse(AssetType.APT);

        int added = 0;
        for (JsonNode marker : root) {
            if (type.typeRestricted() && !mapper.isVilla(marker)) continue;

            String id = mapper.markerId(marker);
            if (id.isEmpty()) continue;

            if (session.observeMarker(id, type, mapper.markerName(marker), mapper.markerCount(marker))) {
                added++;
            }
        }
        return IngestResult.accepted(ResponseChannel.MARKER, added);
    }

    private IngestResult ingestListingList(CollectionSession session, String url, JsonNode root) {
        if (!root.isObject()) {
            session.recordMalformed();
            return IngestResult.malformed(ResponseChannel.LISTING_LIST);
        }

        Matcher m = LISTING_PARENT.matcher(url);
        String parentId = null;
        AssetType type = AssetType.ofListingUrl(url).orElse(AssetType.APT);
        if (m.find()) {
            parentId = m.group(2);
        }

        int total = PayloadMapper.integer(root, "totalCount", "count");
        if (parentId != null && total > 0) {
            session.observeMarker(parentId, type, "", total);
        }

        JsonNode articles = root.hasNonNull("articleList") ? root.get("articleList") : root.get("articles");
        int added = 0;
        if (articles != null && articles.isArray()) {
            for (JsonNode article : articles) {
                if (type.typeRestricted() && !mapper.isVilla(article)) continue;
                if (!mapper.isSale(article)) continue;

                String id = mapper.listingId(article);
                if (id.isEmpty() || session.hasListing(id)) continue;
                if (session.addListing(mapper.toListing(article, parentId))) {
                    added++;
                }
            }
        }
        return IngestResult.accepted(ResponseChannel.LISTING_LIST, added);
    }

    private IngestResult ingestPriceHistory(CollectionSession session, JsonNode root) {
        if (!root.isArray()) {
            session.recordMalformed();
            return IngestResult.malformed(ResponseChannel.PRICE_HISTORY);
        }
        int added = 0;
        for (JsonNode trade : root) {
            if (trade.isObject() && session.addTrade(mapper.toTrade(trade))) {
                added++;
            }
        }
        return IngestResult.accepted(ResponseChannel.PRICE_HISTORY, added);
    }

    /**
     * Walks an arbitrary payload looking for arrays of objects that carry a
     * listing id. An {@code articleList} field, when present, is the only
     * branch followed for that object.
     */
    private int collectListings(CollectionSession session, JsonNode node) {
        int added = 0;
        if (node.isObject()) {
            JsonNode articleList = node.get("articleList");
            if (articleList != null && articleList.isArray()) {
                return collectListings(session, articleList);
            }
            Iterator<JsonNode> values = node.elements();
            while (values.hasNext()) {
                added += collectListings(session, values.next());
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                String id = item.isObject() ? mapper.listingId(item) : "";
                if (id.isEmpty()) {
                    added += collectListings(session, item);
                    continue;
                }
                if (!mapper.isSale(item) || session.hasListing(id)) continue;
                if (session.addListing(mapper.toListing(item, null))) {
                    added++;
                }
            }
        }
        return added;
    }
}
