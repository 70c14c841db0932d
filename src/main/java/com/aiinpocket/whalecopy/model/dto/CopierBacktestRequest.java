package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 單一鯨魚的跟單回測請求。
 * {@code runName} 不為空時，結果會存成一筆可供即時跟單引用的 Run；
 * {@code includePricePoints} 為 true 時結果附上回測使用的價格序列。
 */
public record CopierBacktestRequest(
        String address,
        Instant start,
        Instant end,
        List<String> assetSymbols,
        Integer maxTrades,
        BigDecimal initialDepositUsd,
        BigDecimal leverage,
        BigDecimal positionSizePct,
        BigDecimal feeBps,
        BigDecimal slippageBps,
        String runName,
        boolean includePricePoints
) {}
