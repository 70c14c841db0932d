package com.aiinpocket.whalecopy.service;

import com.aiinpocket.whalecopy.config.BinanceApiProperties;
import com.aiinpocket.whalecopy.model.dto.PricePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance 1 分鐘 K 線收盤價，用於回補回測的標記價格。
 */
@Service
@Slf4j
public class BinanceApiService {

    static final String MINUTE_INTERVAL = "1m";

    private final RestClient binanceRestClient;
    private final BinanceApiProperties props;
    private final ObjectMapper objectMapper;

    public BinanceApiService(@Qualifier("binanceRestClient") RestClient binanceRestClient,
                             BinanceApiProperties props,
                             ObjectMapper objectMapper) {
        this.binanceRestClient = binanceRestClient;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    /** 資產在 Binance 上的交易對，例如 BTC → BTCUSDT */
    public String symbolFor(String asset) {
        return asset.toUpperCase() + props.quoteAsset();
    }

    /**
     * 分頁取得 [from, to] 區間的 1 分鐘收盤價（時間為 K 線開盤時間）。
     * 任一批次失敗就停止並回傳已取得的部分。
     */
    public List<PricePoint> fetchMinuteCloses(String asset, Instant from, Instant to) {
        String symbol = symbolFor(asset);
        List<PricePoint> points = new ArrayList<>();
        long start = from.toEpochMilli();
        long end = to.toEpochMilli();

        while (start <= end) {
            List<List<Object>> batch = fetchKlines(symbol, start, end, props.pageSize());
            if (batch.isEmpty()) break;

            for (List<Object> arr : batch) {
                points.add(new PricePoint(
                        Instant.ofEpochMilli(((Number) arr.get(0)).longValue()),
                        new BigDecimal(arr.get(4).toString())));
            }
            long lastCloseTime = ((Number) batch.get(batch.size() - 1).get(6)).longValue();
            start = lastCloseTime + 1;
            if (batch.size() < props.pageSize()) break;

            sleep(props.rateLimitMs());
        }

        log.info("Fetched {} minute closes for {} [{} → {}]", points.size(), symbol, from, to);
        return points;
    }

    private List<List<Object>> fetchKlines(String symbol, long startTime, long endTime, int limit) {
        try {
            String json = binanceRestClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path(props.klinesPath())
                            .queryParam("symbol", symbol)
                            .queryParam("interval", MINUTE_INTERVAL)
                            .queryParam("limit", limit)
                            .queryParam("startTime", startTime)
                            .queryParam("endTime", endTime)
                            .build())
                    .retrieve()
                    .body(String.class);

            List<List<Object>> raw = objectMapper.readValue(json, new TypeReference<>() {});
            return raw == null ? List.of() : raw;
        } catch (Exception e) {
            log.warn("Failed to fetch klines from Binance for {}: {}", symbol, e.getMessage());
            return List.of();
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
