package com.aiinpocket.whalecopy.service.copier;

import com.aiinpocket.whalecopy.model.dto.CopyOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 紙上交易：只記錄訂單與槓桿設定，不對交易所送出簽章請求。
 * 保留最近的訂單供查詢。
 */
@Component
@Slf4j
public class PaperTradingGateway implements TradingGateway {

    static final int MAX_JOURNAL = 500;

    private final Deque<CopyOrder> journal = new ConcurrentLinkedDeque<>();
    private final Map<String, BigDecimal> leverageByAsset = new ConcurrentHashMap<>();

    @Override
    public void submitOrder(CopyOrder order) {
        journal.addLast(order);
        while (journal.size() > MAX_JOURNAL) {
            journal.pollFirst();
        }
        log.info("[紙上交易] session #{} {} {} {} @ {} ({})", order.sessionId(),
                order.buy() ? "BUY" : "SELL", order.size().toPlainString(), order.asset(),
                order.limitPrice().toPlainString(), order.timeInForce());
    }

    @Override
    public void updateLeverage(String asset, BigDecimal leverage, boolean cross) {
        leverageByAsset.put(asset, leverage);
        log.info("[紙上交易] {} 槓桿設為 {}x ({})", asset, leverage.toPlainString(), cross ? "cross" : "isolated");
    }

    public List<CopyOrder> recentOrders() {
        return new ArrayList<>(journal);
    }

    public BigDecimal currentLeverage(String asset) {
        return leverageByAsset.get(asset);
    }
}
