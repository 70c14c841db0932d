package com.aiinpocket.whalecopy.model.dto;

import com.aiinpocket.whalecopy.model.enums.TradeDirection;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

/**
 * 回測與共識訊號的輸入事件（唯讀）。
 *
 * @param tradeId       來源成交 ID，合成事件為 null
 * @param timestamp     成交時間
 * @param accountId     所屬帳戶（鯨魚地址，合成事件為 {@link #CONSENSUS_ACCOUNT}）
 * @param asset         資產代號（大寫）
 * @param direction     成交方向
 * @param baseQuantity  成交數量（絕對值），合成事件為 null
 * @param valueUsd      成交名目價值（USD）
 * @param realizedPnl   來源已計算的已實現損益，可為 null
 */
public record TradeEvent(
        Long tradeId,
        Instant timestamp,
        String accountId,
        String asset,
        TradeDirection direction,
        BigDecimal baseQuantity,
        BigDecimal valueUsd,
        BigDecimal realizedPnl
) {
    public static final String CONSENSUS_ACCOUNT = "consensus";

    /** 成交隱含價格 |value| / |quantity|；缺少數量或價值時回傳 null */
    public BigDecimal impliedPrice() {
        if (valueUsd == null || baseQuantity == null || baseQuantity.signum() == 0) {
            return null;
        }
        return valueUsd.abs().divide(baseQuantity.abs(), MathContext.DECIMAL64);
    }

    public BigDecimal absoluteValueUsd() {
        return valueUsd == null ? BigDecimal.ZERO : valueUsd.abs();
    }
}
