package com.aiinpocket.whalecopy.service.signal;

import com.aiinpocket.whalecopy.model.dto.Signal;
import com.aiinpocket.whalecopy.model.dto.TradeEvent;
import com.aiinpocket.whalecopy.model.enums.TradeDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 多鯨魚共識訊號。
 * <p>
 * 所有進場成交依時間排序後，對每筆尚未被使用的進場往後看一個時間窗，
 * 統計同資產、同方向家族的不同帳戶數；達到門檻就在第一筆的時間點產生訊號，
 * 名目價值取各帳戶第一筆的平均。同一 (資產, 方向) 在訊號後一個時間窗內不會重複觸發。
 */
@Component
@Slf4j
public class SignalAggregator {

    public List<Signal> aggregate(List<TradeEvent> events, Duration window, int minWhales) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("時間窗必須為非負值: " + window);
        }
        if (minWhales < 1) {
            throw new IllegalArgumentException("最少鯨魚數必須 >= 1: " + minWhales);
        }

        List<TradeEvent> entries = new ArrayList<>();
        for (TradeEvent e : events) {
            if (e.timestamp() != null && e.asset() != null && e.direction() != null && e.direction().isEntry()) {
                entries.add(e);
            }
        }
        entries.sort(Comparator.comparing(TradeEvent::timestamp));

        boolean[] consumed = new boolean[entries.size()];
        Map<String, Instant> lastFired = new HashMap<>();
        List<Signal> signals = new ArrayList<>();

        for (int i = 0; i < entries.size(); i++) {
            if (consumed[i]) continue;
            TradeEvent anchor = entries.get(i);
            String asset = anchor.asset().toUpperCase();
            TradeDirection family = anchor.direction().entryFamily();
            String key = asset + "|" + family;

            Instant fired = lastFired.get(key);
            if (fired != null && anchor.timestamp().isBefore(fired.plus(window))) {
                consumed[i] = true;
                continue;
            }

            Instant windowEnd = anchor.timestamp().plus(window);
            Map<String, Integer> firstByAccount = new LinkedHashMap<>();
            for (int j = i; j < entries.size(); j++) {
                TradeEvent candidate = entries.get(j);
                if (candidate.timestamp().isAfter(windowEnd)) break;
                if (consumed[j]) continue;
                if (!asset.equalsIgnoreCase(candidate.asset())) continue;
                if (candidate.direction().entryFamily() != family) continue;
                firstByAccount.putIfAbsent(candidate.accountId(), j);
            }

            if (firstByAccount.size() < minWhales) continue;

            BigDecimal total = BigDecimal.ZERO;
            for (int j : firstByAccount.values()) {
                total = total.add(entries.get(j).absoluteValueUsd());
                consumed[j] = true;
            }
            BigDecimal average = total.divide(BigDecimal.valueOf(firstByAccount.size()), MathContext.DECIMAL64);
            signals.add(new Signal(anchor.timestamp(), asset, family, average,
                    Collections.unmodifiableSet(new LinkedHashSet<>(firstByAccount.keySet()))));
            lastFired.put(key, anchor.timestamp());
        }

        log.info("[共識] {} 筆進場成交產生 {} 個訊號 (window={}, minWhales={})",
                entries.size(), signals.size(), window, minWhales);
        return signals;
    }

    /** 訊號轉為合成的進場事件（沒有成交數量，因此也沒有隱含價格） */
    public List<TradeEvent> toTradeEvents(List<Signal> signals) {
        return signals.stream()
                .map(s -> new TradeEvent(null, s.timestamp(), TradeEvent.CONSENSUS_ACCOUNT,
                        s.asset(), s.direction(), null, s.averageNotionalUsd(), null))
                .toList();
    }
}
