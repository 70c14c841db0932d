package com.aiinpocket.whalecopy.model.dto;

import com.aiinpocket.whalecopy.model.enums.CopySessionState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 跟單 session 的唯讀快照，讀取時不會改變 session 狀態。
 *
 * @param shadowPositions 依跟單成交推算的自身持倉（資產 → 有號數量）
 */
public record CopySessionStatus(
        long sessionId,
        Long whaleId,
        String address,
        CopySessionState state,
        boolean active,
        boolean execute,
        String leverage,
        String positionSizePct,
        Instant cursor,
        int processed,
        List<String> errors,
        List<String> notifications,
        Map<String, BigDecimal> shadowPositions,
        Instant createdAt
) {}
