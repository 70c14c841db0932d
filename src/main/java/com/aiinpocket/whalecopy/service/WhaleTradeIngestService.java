package com.aiinpocket.whalecopy.service;

import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.model.dto.Fill;
import com.aiinpocket.whalecopy.model.entity.TrackedWhale;
import com.aiinpocket.whalecopy.model.entity.WhaleTrade;
import com.aiinpocket.whalecopy.repository.TrackedWhaleRepository;
import com.aiinpocket.whalecopy.repository.WhaleTradeRepository;
import com.aiinpocket.whalecopy.service.copier.CopySourceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 鯨魚成交匯入。
 * 從游標（最後匯入的成交時間）之後讀取成交，已存在的 hash 跳過，依時間由舊到新寫入。
 * 單一鯨魚失敗只累計錯誤次數，不影響其他鯨魚；連續失敗達門檻後停止追蹤。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WhaleTradeIngestService {

    private final TrackedWhaleRepository whaleRepository;
    private final WhaleTradeRepository tradeRepository;
    private final CopySourceGateway sourceGateway;
    private final CopyTradingProperties props;

    /** 開始追蹤一個地址；已存在則重新啟用 */
    public TrackedWhale track(String address, String label) {
        TrackedWhale whale = whaleRepository.findByAddressIgnoreCase(address)
                .orElseGet(() -> TrackedWhale.builder()
                        .address(address.toLowerCase())
                        .label(label)
                        .build());
        whale.setActive(true);
        if (label != null) whale.setLabel(label);
        return whaleRepository.save(whale);
    }

    /** @return 本輪新寫入的成交筆數 */
    public int ingestAll() {
        List<TrackedWhale> whales = whaleRepository.findByActiveTrue();
        if (whales.isEmpty()) {
            log.debug("[匯入] 沒有追蹤中的鯨魚");
            return 0;
        }
        int total = 0;
        for (TrackedWhale whale : whales) {
            try {
                total += ingest(whale);
            } catch (Exception e) {
                handleFailure(whale, e);
            }
        }
        log.info("[匯入] {} 個鯨魚共新增 {} 筆成交", whales.size(), total);
        return total;
    }

    /**
     * 匯入單一鯨魚的新成交。
     *
     * @return 新寫入的筆數
     */
    public int ingest(TrackedWhale whale) {
        List<Fill> fills = sourceGateway.fetchFills(whale.getAddress(), whale.getLastFillTime());

        Set<String> batchIds = new HashSet<>();
        List<WhaleTrade> newTrades = fills.stream()
                .filter(f -> batchIds.add(f.providerId()))
                .filter(f -> !tradeRepository.existsByWhaleIdAndTxHash(whale.getId(), f.providerId()))
                .map(f -> toEntity(whale.getId(), f))
                .toList();
        tradeRepository.saveAll(newTrades);

        Instant cursor = whale.getLastFillTime();
        for (Fill f : fills) {
            if (cursor == null || f.time().isAfter(cursor)) cursor = f.time();
        }
        whale.setLastFillTime(cursor);
        whale.setErrorCount(0);
        whaleRepository.save(whale);

        if (!newTrades.isEmpty()) {
            log.debug("[匯入] {} 新增 {} 筆成交，游標 {}", whale.getAddress(), newTrades.size(), cursor);
        }
        return newTrades.size();
    }

    static WhaleTrade toEntity(Long whaleId, Fill fill) {
        return WhaleTrade.builder()
                .whaleId(whaleId)
                .timestamp(fill.time())
                .baseAsset(fill.asset())
                .direction(fill.direction())
                .amountBase(fill.size())
                .valueUsd(fill.notionalUsd())
                .realizedPnlUsd(fill.realizedPnl())
                .txHash(fill.providerId())
                .build();
    }

    private void handleFailure(TrackedWhale whale, Exception e) {
        int errors = whale.getErrorCount() + 1;
        whale.setErrorCount(errors);
        int threshold = props.ingest().maxConsecutiveErrors();
        if (errors >= threshold) {
            whale.setActive(false);
            log.warn("[匯入] {} 連續 {} 次失敗，停止追蹤: {}", whale.getAddress(), errors, e.getMessage());
        } else {
            log.warn("[匯入] {} 匯入失敗 (連續第 {} 次): {}", whale.getAddress(), errors, e.getMessage());
        }
        whaleRepository.save(whale);
    }
}
