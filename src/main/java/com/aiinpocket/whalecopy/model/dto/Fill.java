package com.aiinpocket.whalecopy.model.dto;

import com.aiinpocket.whalecopy.model.enums.TradeDirection;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 交易所成交，已在邊界層正規化。
 *
 * @param providerId  交易所指派的唯一識別（hash / tid / oid），用於去重
 * @param time        成交時間
 * @param asset       資產代號（大寫）
 * @param direction   分類後的方向
 * @param buy         是否為買方成交
 * @param size        成交數量（正數）
 * @param price       成交價
 * @param realizedPnl 交易所回報的已實現損益，可為 null
 */
public record Fill(
        String providerId,
        Instant time,
        String asset,
        TradeDirection direction,
        boolean buy,
        BigDecimal size,
        BigDecimal price,
        BigDecimal realizedPnl
) {
    public BigDecimal notionalUsd() {
        return size.multiply(price).abs();
    }
}
