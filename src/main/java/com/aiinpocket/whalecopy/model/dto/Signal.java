package com.aiinpocket.whalecopy.model.dto;

import com.aiinpocket.whalecopy.model.enums.TradeDirection;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * 多位鯨魚在時間窗內同方向進場所形成的共識訊號。
 *
 * @param direction 方向家族（LONG 或 SHORT）
 * @param accounts  參與的帳戶
 */
public record Signal(
        Instant timestamp,
        String asset,
        TradeDirection direction,
        BigDecimal averageNotionalUsd,
        Set<String> accounts
) {}
