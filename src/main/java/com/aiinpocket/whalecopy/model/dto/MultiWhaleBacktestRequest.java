package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 多鯨魚共識回測請求。
 * {@code windowMinutes} / {@code minWhales} 為 null 時採用設定檔預設值。
 */
public record MultiWhaleBacktestRequest(
        List<String> addresses,
        Instant start,
        Instant end,
        List<String> assetSymbols,
        Integer windowMinutes,
        Integer minWhales,
        BigDecimal initialDepositUsd,
        BigDecimal leverage,
        BigDecimal positionSizePct,
        BigDecimal feeBps,
        BigDecimal slippageBps
) {}
