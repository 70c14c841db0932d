package com.aiinpocket.whalecopy.service.backtest;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * 最大回撤：單次走訪權益序列並追蹤歷史高點。
 */
public final class DrawdownCalculator {

    private DrawdownCalculator() {}

    /**
     * @param equities 依時間排序的權益值
     * @return 最大回撤比例（%，0 ~ 100）與當時的金額落差
     */
    public static Drawdown compute(List<BigDecimal> equities) {
        if (equities.isEmpty()) return Drawdown.NONE;

        BigDecimal peak = equities.get(0);
        BigDecimal maxRatio = BigDecimal.ZERO;
        BigDecimal maxGap = BigDecimal.ZERO;
        for (BigDecimal equity : equities) {
            if (equity.compareTo(peak) > 0) peak = equity;
            if (peak.signum() <= 0) continue;
            BigDecimal gap = peak.subtract(equity);
            BigDecimal ratio = gap.divide(peak, MathContext.DECIMAL64);
            if (ratio.compareTo(maxRatio) > 0) {
                maxRatio = ratio;
                maxGap = gap;
            }
        }
        BigDecimal pct = maxRatio.multiply(BigDecimal.valueOf(100)).min(BigDecimal.valueOf(100));
        return new Drawdown(pct, maxGap);
    }

    public record Drawdown(BigDecimal maxPercent, BigDecimal maxUsd) {
        static final Drawdown NONE = new Drawdown(BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
