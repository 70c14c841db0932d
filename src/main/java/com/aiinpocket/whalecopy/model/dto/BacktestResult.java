package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 跟單回測結果：摘要、逐筆交易與權益曲線。
 *
 * @param pricePoints 回測使用的各資產價格序列；未要求時為 null
 */
public record BacktestResult(
        Summary summary,
        List<TradeResult> trades,
        List<EquityCurvePoint> equityCurve,
        Map<String, List<PricePoint>> pricePoints
) {
    public BacktestResult withPricePoints(Map<String, List<PricePoint>> points) {
        return new BacktestResult(summary, trades, equityCurve, points);
    }

    /**
     * @param winRatePercent 沒有任何平倉時為 null
     */
    public record Summary(
            BigDecimal initialDepositUsd,
            BigDecimal recommendedPositionPct,
            BigDecimal usedPositionPct,
            BigDecimal leverageUsed,
            List<String> assetSymbols,
            BigDecimal totalFeesUsd,
            BigDecimal totalSlippageUsd,
            BigDecimal grossPnlUsd,
            BigDecimal netPnlUsd,
            BigDecimal roiPercent,
            int tradesCopied,
            int closingTrades,
            int winningTrades,
            BigDecimal winRatePercent,
            BigDecimal maxDrawdownPercent,
            BigDecimal maxDrawdownUsd,
            BigDecimal finalEquityUsd,
            Instant start,
            Instant end
    ) {}

    public record TradeResult(
            int sequence,
            Long sourceTradeId,
            Instant timestamp,
            String direction,
            String asset,
            BigDecimal priceUsd,
            BigDecimal notionalUsd,
            BigDecimal pnlUsd,
            BigDecimal feeUsd,
            BigDecimal slippageUsd,
            BigDecimal netPnlUsd,
            BigDecimal cumulativePnlUsd,
            BigDecimal equityUsd,
            BigDecimal unrealizedPnlUsd,
            BigDecimal positionSizeBase
    ) {}

    /** 權益 = 現金 + 保證金 + 未實現損益 */
    public record EquityCurvePoint(
            Instant timestamp,
            BigDecimal equityUsd,
            BigDecimal cashUsd,
            BigDecimal marginUsd,
            BigDecimal unrealizedPnlUsd
    ) {}
}
