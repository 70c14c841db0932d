package com.aiinpocket.whalecopy.service.hyperliquid;

import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.config.HyperliquidApiProperties;
import com.aiinpocket.whalecopy.model.dto.AccountState;
import com.aiinpocket.whalecopy.model.dto.Fill;
import com.aiinpocket.whalecopy.service.copier.CopySourceGateway;
import com.aiinpocket.whalecopy.service.copier.RateThrottle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Hyperliquid info 端點客戶端（{@code POST /info}）。
 * 所有呼叫共用同一個節流器，間隔未到時等待而不是丟棄。
 * 失敗一律包成 {@link ExchangeApiException}。
 */
@Service
@Slf4j
public class HyperliquidInfoClient implements CopySourceGateway {

    private static final String THROTTLE_KEY = "info";

    private final RestClient restClient;
    private final HyperliquidApiProperties props;
    private final ObjectMapper objectMapper;
    private final HyperliquidFillMapper fillMapper;
    private final RateThrottle throttle;

    public HyperliquidInfoClient(@Qualifier("hyperliquidRestClient") RestClient restClient,
                                 HyperliquidApiProperties props,
                                 CopyTradingProperties tradingProps,
                                 ObjectMapper objectMapper,
                                 HyperliquidFillMapper fillMapper,
                                 Clock clock) {
        this.restClient = restClient;
        this.props = props;
        this.objectMapper = objectMapper;
        this.fillMapper = fillMapper;
        this.throttle = new RateThrottle(Duration.ofMillis(tradingProps.copier().infoMinIntervalMs()), clock);
    }

    /**
     * 取得成交，依時間由舊到新排序。
     * {@code since} 為 null 時取最近一批成交；否則從 since（含）往後分頁讀取。
     */
    @Override
    public List<Fill> fetchFills(String address, Instant since) {
        if (since == null) {
            return toFills(post(Map.of("type", "userFills", "user", address)));
        }

        Map<String, Fill> byId = new LinkedHashMap<>();
        long start = since.toEpochMilli();
        for (int page = 0; page < props.maxPages(); page++) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", "userFillsByTime");
            payload.put("user", address);
            payload.put("startTime", start);
            List<Fill> batch = toFills(post(payload));
            if (batch.isEmpty()) break;

            long maxTime = start;
            for (Fill f : batch) {
                byId.putIfAbsent(f.providerId(), f);
                maxTime = Math.max(maxTime, f.time().toEpochMilli());
            }
            if (batch.size() < props.fillsPageSize() || maxTime == start) break;
            start = maxTime;
        }

        List<Fill> fills = new ArrayList<>(byId.values());
        fills.sort(Comparator.comparing(Fill::time));
        return fills;
    }

    @Override
    public AccountState fetchAccountState(String address) {
        JsonNode root = post(Map.of("type", "clearinghouseState", "user", address));
        JsonNode summary = root.get("marginSummary");
        BigDecimal accountValue = decimal(summary, "accountValue");
        if (accountValue == null) {
            throw new ExchangeApiException("clearinghouseState 缺少 accountValue: " + address);
        }

        List<AccountState.OpenPosition> positions = new ArrayList<>();
        JsonNode assetPositions = root.get("assetPositions");
        if (assetPositions != null && assetPositions.isArray()) {
            for (JsonNode ap : assetPositions) {
                JsonNode pos = ap.has("position") ? ap.get("position") : ap;
                JsonNode coin = pos.get("coin");
                BigDecimal size = decimal(pos, "szi");
                if (coin == null || coin.isNull() || size == null || size.signum() == 0) continue;
                BigDecimal positionValue = decimal(pos, "positionValue");
                BigDecimal mark = positionValue != null
                        ? positionValue.abs().divide(size.abs(), MathContext.DECIMAL64)
                        : null;
                positions.add(new AccountState.OpenPosition(
                        coin.asText().toUpperCase(Locale.ROOT),
                        size,
                        decimal(pos, "entryPx"),
                        mark,
                        decimal(pos, "unrealizedPnl")));
            }
        }
        return new AccountState(accountValue, List.copyOf(positions));
    }

    /** 永續合約的資產清單（universe）與數量精度 */
    public JsonNode fetchMeta() {
        return post(Map.of("type", "meta"));
    }

    /** 現貨交易對清單（universe）與代幣精度（tokens） */
    public JsonNode fetchSpotMeta() {
        return post(Map.of("type", "spotMeta"));
    }

    private JsonNode post(Map<String, Object> payload) {
        throttle.acquire(THROTTLE_KEY);
        try {
            String json = restClient.post()
                    .uri(props.infoPath())
                    .body(objectMapper.writeValueAsString(payload))
                    .retrieve()
                    .body(String.class);
            if (json == null || json.isBlank()) {
                throw new ExchangeApiException("Hyperliquid 回應為空: " + payload.get("type"));
            }
            return objectMapper.readTree(json);
        } catch (ExchangeApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExchangeApiException("Hyperliquid " + payload.get("type") + " 呼叫失敗: " + e.getMessage(), e);
        }
    }

    private List<Fill> toFills(JsonNode array) {
        if (array == null || !array.isArray()) return List.of();
        List<Fill> fills = new ArrayList<>();
        for (JsonNode node : array) {
            fillMapper.map(node).ifPresent(fills::add);
        }
        fills.sort(Comparator.comparing(Fill::time));
        return fills;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) return null;
        try {
            return new BigDecimal(child.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
