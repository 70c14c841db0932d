package com.aiinpocket.whalecopy.service;

import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.model.dto.PricePoint;
import com.aiinpocket.whalecopy.model.entity.PriceHistory;
import com.aiinpocket.whalecopy.repository.PriceHistoryRepository;
import com.aiinpocket.whalecopy.service.backtest.PriceResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * 歷史價格：回測前盡力回補缺少的 1 分鐘收盤價，再把時間窗內的價格載入成 {@link PriceResolver}。
 * 回補失敗只記錄警告，回測會改用成交隱含價格。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceHistoryService {

    /** 超過此區間不回補（長區間回測步長較粗，成交隱含價格已足夠） */
    static final Duration MAX_BACKFILL_SPAN = Duration.ofDays(30);

    private final PriceHistoryRepository priceHistoryRepository;
    private final BinanceApiService binanceApiService;
    private final CopyTradingProperties props;

    public PriceResolver loadResolver(Collection<String> assets, Instant from, Instant to) {
        Set<String> symbols = normalize(assets);
        if (symbols.isEmpty()) return PriceResolver.empty();

        Instant start = from.truncatedTo(ChronoUnit.MINUTES);
        Instant end = to.truncatedTo(ChronoUnit.MINUTES);
        backfill(symbols, start.minus(Duration.ofMinutes(1)), end.plus(Duration.ofMinutes(1)));

        Duration padding = Duration.ofMinutes(props.backtest().priceWindowPaddingMinutes());
        Map<String, List<PricePoint>> series = new HashMap<>();
        for (PriceHistory row : priceHistoryRepository
                .findByAssetSymbolInAndTimestampBetweenOrderByAssetSymbolAscTimestampAsc(
                        symbols, start.minus(padding), end.plus(padding))) {
            series.computeIfAbsent(row.getAssetSymbol(), k -> new ArrayList<>())
                    .add(new PricePoint(row.getTimestamp(), row.getPriceUsd()));
        }
        log.debug("[價格] 載入 {} 個資產的價格序列 ({} → {})", series.size(), start, end);
        return PriceResolver.of(series);
    }

    /**
     * 資料不足的資產從 Binance 回補，冪等寫入（已存在的時間點跳過）。
     *
     * @return 新寫入的筆數
     */
    public int backfill(Collection<String> assets, Instant from, Instant to) {
        if (Duration.between(from, to).compareTo(MAX_BACKFILL_SPAN) > 0) {
            log.info("[價格] 區間 {} → {} 超過回補上限，略過回補", from, to);
            return 0;
        }
        long expected = Duration.between(from, to).toMinutes() + 1;
        int saved = 0;
        for (String asset : normalize(assets)) {
            try {
                long existing = priceHistoryRepository.countByAssetSymbolAndTimestampBetween(asset, from, to);
                if (existing >= expected) continue;

                List<PriceHistory> toSave = binanceApiService.fetchMinuteCloses(asset, from, to).stream()
                        .filter(p -> !priceHistoryRepository.existsByAssetSymbolAndTimestamp(asset, p.timestamp()))
                        .map(p -> PriceHistory.builder()
                                .assetSymbol(asset)
                                .timestamp(p.timestamp())
                                .priceUsd(p.price())
                                .build())
                        .toList();
                priceHistoryRepository.saveAll(toSave);
                saved += toSave.size();
            } catch (Exception e) {
                log.warn("[價格] {} 回補失敗，回測將使用成交隱含價格: {}", asset, e.getMessage());
            }
        }
        return saved;
    }

    private static Set<String> normalize(Collection<String> assets) {
        Set<String> symbols = new TreeSet<>();
        for (String a : assets) {
            if (a != null && !a.isBlank()) symbols.add(a.toUpperCase());
        }
        return symbols;
    }
}
