package com.xcpradar.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.xcpradar.common.RetryPolicy;
import com.xcpradar.config.CaffeineConfig;
import com.xcpradar.ingestion.config.IngestionAdapterConfig;
import com.xcpradar.ingestion.config.LedgerProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Counterparty API v2 client over WebClient. Event categories are read from {@code /events/{EVENT}},
 * newest first, following {@code next_cursor} until a page reaches below the requested block
 * (or {@code max-pages} is hit). Every request goes through the shared rate limiter and is retried
 * with exponential backoff on 5xx, 429 and transport errors.
 */
@Slf4j
@Component
public class CounterpartyApiClient implements LedgerClient {

    static final String EVENT_DISPENSE = "DISPENSE";
    static final String EVENT_OPEN_DISPENSER = "OPEN_DISPENSER";
    static final String EVENT_ORDER_MATCH = "ORDER_MATCH";
    static final String EVENT_OPEN_ORDER = "OPEN_ORDER";

    private static final int DISPENSER_STATUS_OPEN = 0;

    private final WebClient webClient;
    private final LedgerProperties properties;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final Cache<Long, Long> blockTimeCache;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CounterpartyApiClient(
            WebClient.Builder webClientBuilder,
            LedgerProperties properties,
            @Qualifier(IngestionAdapterConfig.LEDGER_RETRY_POLICY) RetryPolicy retryPolicy,
            @Qualifier(IngestionAdapterConfig.LEDGER_RATE_LIMITER) RateLimiter rateLimiter,
            @Qualifier(CaffeineConfig.BLOCK_TIME_CACHE) Cache<Long, Long> blockTimeCache,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.webClient = webClientBuilder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.blockTimeCache = blockTimeCache;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public long currentHeight() {
        JsonNode result = get("current height", b -> b.path("/").build()).path("result");
        JsonNode height = result.path("counterparty_height");
        if (!height.canConvertToLong()) {
            throw new LedgerException("Ledger height missing from indexer status response");
        }
        return height.asLong();
    }

    @Override
    public List<DispenseEvent> listSales(long sinceBlock) {
        List<DispenseEvent> sales = new ArrayList<>();
        for (JsonNode event : fetchEvents(EVENT_DISPENSE, sinceBlock)) {
            JsonNode p = event.path("params");
            long blockIndex = blockIndexOf(event);
            sales.add(new DispenseEvent(
                    txHashOf(event),
                    saleStatus(p.path("status")),
                    assetName(p, "asset"),
                    p.path("dispense_quantity").asLong(),
                    blockIndex,
                    blockTimeOf(event, blockIndex),
                    p.path("dispenser_tx_hash").asText(null)));
        }
        return sales;
    }

    @Override
    public List<DispenserEvent> listListings(Long sinceBlock) {
        if (sinceBlock == null) {
            return fetchPaged("open dispensers", "/dispensers", List.of("status", "open")).stream()
                    .map(this::toDispenser)
                    .toList();
        }
        return fetchEvents(EVENT_OPEN_DISPENSER, sinceBlock).stream()
                .map(this::toDispenser)
                .toList();
    }

    @Override
    public List<DispenserEvent> listListingsForAsset(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("asset must not be blank");
        }
        return fetchPaged("dispensers for " + asset, "/assets/" + asset.strip() + "/dispensers", List.of()).stream()
                .map(this::toDispenser)
                .toList();
    }

    @Override
    public List<OrderMatchEvent> listOrderMatches(long sinceBlock) {
        List<OrderMatchEvent> matches = new ArrayList<>();
        for (JsonNode event : fetchEvents(EVENT_ORDER_MATCH, sinceBlock)) {
            JsonNode p = event.path("params");
            long blockIndex = blockIndexOf(event);
            String txHash = event.path("tx_hash").asText("");
            if (txHash.isEmpty()) {
                txHash = p.path("tx1_hash").asText();
            }
            matches.add(new OrderMatchEvent(
                    txHash,
                    p.path("status").asText(""),
                    assetName(p, "forward_asset"),
                    p.path("forward_quantity").asLong(),
                    assetName(p, "backward_asset"),
                    p.path("backward_quantity").asLong(),
                    blockIndex,
                    blockTimeOf(event, blockIndex)));
        }
        return matches;
    }

    @Override
    public List<OrderEvent> listOrders(long sinceBlock) {
        List<OrderEvent> orders = new ArrayList<>();
        for (JsonNode event : fetchEvents(EVENT_OPEN_ORDER, sinceBlock)) {
            JsonNode p = event.path("params");
            long blockIndex = blockIndexOf(event);
            orders.add(new OrderEvent(
                    txHashOf(event),
                    p.path("status").asText(""),
                    assetName(p, "give_asset"),
                    p.path("give_quantity").asLong(),
                    assetName(p, "get_asset"),
                    p.path("get_quantity").asLong(),
                    blockIndex,
                    blockTimeOf(event, blockIndex)));
        }
        return orders;
    }

    /**
     * Walks one event category newest-first and keeps events at or above sinceBlock.
     */
    private List<JsonNode> fetchEvents(String eventName, long sinceBlock) {
        List<JsonNode> kept = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < properties.getMaxPages(); page++) {
            final String pageCursor = cursor;
            JsonNode body = get(eventName + " events", b -> {
                b.path("/events/" + eventName)
                        .queryParam("limit", properties.getPageSize())
                        .queryParam("verbose", true);
                if (pageCursor != null) {
                    b.queryParam("cursor", pageCursor);
                }
                return b.build();
            });
            boolean reachedOlder = false;
            for (JsonNode event : body.path("result")) {
                if (blockIndexOf(event) >= sinceBlock) {
                    kept.add(event);
                } else {
                    reachedOlder = true;
                }
            }
            cursor = nextCursor(body);
            if (reachedOlder || cursor == null) {
                return kept;
            }
        }
        log.warn("Stopped paging {} events at {} pages (since block {}); older events in range were skipped",
                eventName, properties.getMaxPages(), sinceBlock);
        return kept;
    }

    /**
     * Follows next_cursor on a plain collection endpoint.
     */
    private List<JsonNode> fetchPaged(String description, String path, List<String> extraQuery) {
        List<JsonNode> all = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < properties.getMaxPages(); page++) {
            final String pageCursor = cursor;
            JsonNode body = get(description, b -> {
                b.path(path)
                        .queryParam("limit", properties.getPageSize())
                        .queryParam("verbose", true);
                for (int i = 0; i + 1 < extraQuery.size(); i += 2) {
                    b.queryParam(extraQuery.get(i), extraQuery.get(i + 1));
                }
                if (pageCursor != null) {
                    b.queryParam("cursor", pageCursor);
                }
                return b.build();
            });
            body.path("result").forEach(all::add);
            cursor = nextCursor(body);
            if (cursor == null) {
                return all;
            }
        }
        log.warn("Stopped paging {} at {} pages", description, properties.getMaxPages());
        return all;
    }

    private DispenserEvent toDispenser(JsonNode node) {
        JsonNode p = node.has("params") ? node.path("params") : node;
        long blockIndex = blockIndexOf(node);
        return new DispenserEvent(
                txHashOf(node),
                dispenserStatus(p.path("status")),
                assetName(p, "asset"),
                p.path("give_quantity").asLong(),
                p.path("give_remaining").asLong(),
                p.path("satoshirate").asLong(),
                blockIndex,
                blockTimeOf(node, blockIndex),
                p.path("source").asText(null),
                p.path("escrow_quantity").asLong());
    }

    static String dispenserStatus(JsonNode status) {
        if (status.isNumber()) {
            return status.asInt() == DISPENSER_STATUS_OPEN ? DispenserEvent.STATUS_OPEN : DispenserEvent.STATUS_CLOSED;
        }
        String text = status.asText("");
        if (text.equalsIgnoreCase(DispenserEvent.STATUS_OPEN) || text.equals(String.valueOf(DISPENSER_STATUS_OPEN))) {
            return DispenserEvent.STATUS_OPEN;
        }
        return DispenserEvent.STATUS_CLOSED;
    }

    /**
     * DISPENSE payloads normally carry no status (a recorded dispense is valid); an explicit text status wins.
     */
    static String saleStatus(JsonNode status) {
        if (status.isTextual() && !status.asText().isBlank()) {
            return status.asText();
        }
        return DispenseEvent.STATUS_VALID;
    }

    /**
     * Subasset longname (PARENT.CHILD) when the verbose payload carries one, otherwise the asset name.
     */
    static String assetName(JsonNode params, String field) {
        for (JsonNode longname : List.of(params.path(field + "_info").path("asset_longname"),
                params.path(field + "_longname"))) {
            String value = longname.asText("");
            if (!value.isBlank()) {
                return value;
            }
        }
        return params.path(field).asText();
    }

    private static String txHashOf(JsonNode node) {
        String hash = node.path("tx_hash").asText("");
        if (hash.isEmpty()) {
            hash = node.path("params").path("tx_hash").asText("");
        }
        return hash;
    }

    private static long blockIndexOf(JsonNode node) {
        JsonNode idx = node.path("block_index");
        if (!idx.canConvertToLong()) {
            idx = node.path("params").path("block_index");
        }
        return idx.asLong(0L);
    }

    private static String nextCursor(JsonNode body) {
        JsonNode next = body.path("next_cursor");
        if (next.isMissingNode() || next.isNull()) {
            return null;
        }
        String value = next.asText("");
        return value.isEmpty() ? null : value;
    }

    /**
     * Block time from the payload when present, otherwise from /blocks/{index} (cached). Falls back to now.
     */
    private long blockTimeOf(JsonNode node, long blockIndex) {
        for (JsonNode candidate : List.of(node.path("block_time"), node.path("params").path("block_time"),
                node.path("timestamp"))) {
            if (candidate.canConvertToLong() && candidate.asLong() > 0) {
                return candidate.asLong();
            }
        }
        if (blockIndex <= 0) {
            return clock.instant().getEpochSecond();
        }
        Long cached = blockTimeCache.getIfPresent(blockIndex);
        if (cached != null) {
            return cached;
        }
        try {
            long time = get("block " + blockIndex, b -> b.path("/blocks/" + blockIndex).build())
                    .path("result").path("block_time").asLong(0L);
            if (time > 0) {
                blockTimeCache.put(blockIndex, time);
                return time;
            }
            log.warn("Block {} has no block_time; using current time", blockIndex);
        } catch (LedgerException e) {
            log.warn("Block time lookup failed for block {}; using current time: {}", blockIndex, e.getMessage());
        }
        return clock.instant().getEpochSecond();
    }

    private JsonNode get(String description, Function<UriBuilder, URI> uri) {
        LedgerException lastError = null;
        Duration timeout = Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds()));
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                retryPolicy.backoff(attempt - 1);
            }
            if (!rateLimiter.acquirePermission()) {
                lastError = new LedgerException("Local rate limit exceeded fetching " + description);
                log.warn("No rate limiter permit for {} (attempt {}/{})", description, attempt + 1, retryPolicy.getMaxAttempts());
                continue;
            }
            try {
                String body = webClient.get()
                        .uri(uri)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(timeout);
                return objectMapper.readTree(body == null ? "{}" : body);
            } catch (WebClientResponseException e) {
                if (!isRetryable(e.getStatusCode())) {
                    throw new LedgerException("Fetching " + description + " failed: HTTP " + e.getStatusCode().value(), e);
                }
                lastError = new LedgerException("Fetching " + description + " failed: HTTP " + e.getStatusCode().value(), e);
            } catch (WebClientRequestException e) {
                lastError = new LedgerException("Fetching " + description + " failed: " + e.getMessage(), e);
            } catch (IllegalStateException e) {
                // block(timeout) signals a timeout this way
                lastError = new LedgerException("Fetching " + description + " timed out after " + timeout.toSeconds() + "s", e);
            } catch (JsonProcessingException e) {
                throw new LedgerException("Malformed response fetching " + description, e);
            }
            log.warn("Ledger request for {} failed (attempt {}/{}): {}",
                    description, attempt + 1, retryPolicy.getMaxAttempts(), lastError.getMessage());
        }
        throw lastError;
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == 429;
    }
}
