package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * 來源帳戶快照：帳戶淨值與目前持倉。
 */
public record AccountState(
        BigDecimal accountValueUsd,
        List<OpenPosition> openPositions
) {
    /**
     * @param signedSize 正數為多單、負數為空單
     * @param markPrice  標記價格，可為 null（此時以進場價估算）
     */
    public record OpenPosition(
            String asset,
            BigDecimal signedSize,
            BigDecimal entryPrice,
            BigDecimal markPrice,
            BigDecimal unrealizedPnl
    ) {
        public BigDecimal notionalUsd() {
            BigDecimal px = markPrice != null ? markPrice : entryPrice;
            if (px == null) return BigDecimal.ZERO;
            return signedSize.abs().multiply(px);
        }
    }

    /** 所有持倉的名目價值合計 */
    public BigDecimal totalNotionalUsd() {
        return openPositions.stream()
                .map(OpenPosition::notionalUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
