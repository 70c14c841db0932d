package com.aiinpocket.whalecopy.service.backtest;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 建議跟單比例。
 * 以鯨魚歷史進場名目價值的第 75 百分位數作為基準，建議比例 = 初始資金 / 基準，夾在 [0, 1]。
 */
public final class SizingCalculator {

    static final double ANCHOR_PERCENTILE = 75.0;

    private SizingCalculator() {}

    /**
     * 線性內插百分位數：rank = (n - 1) * pct / 100，在 floor 與 ceil 之間內插。
     * 空集合回傳 0。
     */
    public static BigDecimal percentile(Collection<BigDecimal> values, double pct) {
        if (values.isEmpty()) return BigDecimal.ZERO;
        List<BigDecimal> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        if (pct <= 0) return sorted.get(0);
        if (pct >= 100) return sorted.get(sorted.size() - 1);

        BigDecimal k = BigDecimal.valueOf(sorted.size() - 1)
                .multiply(BigDecimal.valueOf(pct))
                .divide(BigDecimal.valueOf(100), MathContext.DECIMAL64);
        int f = k.intValue();
        int c = Math.min(f + 1, sorted.size() - 1);
        if (f == c) return sorted.get(f);

        BigDecimal weightC = k.subtract(BigDecimal.valueOf(f));
        BigDecimal weightF = BigDecimal.ONE.subtract(weightC);
        return sorted.get(f).multiply(weightF).add(sorted.get(c).multiply(weightC));
    }

    /**
     * 建議跟單比例（0 ~ 1）。
     * 沒有正的歷史進場金額或基準非正時回傳 1（全額跟單）。
     */
    public static BigDecimal recommendedRatio(BigDecimal initialDeposit, Collection<BigDecimal> entryNotionals) {
        List<BigDecimal> positives = new ArrayList<>();
        for (BigDecimal v : entryNotionals) {
            if (v != null && v.abs().signum() > 0) positives.add(v.abs());
        }
        if (positives.isEmpty()) return BigDecimal.ONE;

        BigDecimal anchor = percentile(positives, ANCHOR_PERCENTILE);
        if (anchor.signum() <= 0) return BigDecimal.ONE;

        BigDecimal ratio = initialDeposit.divide(anchor, MathContext.DECIMAL64);
        return clamp(ratio, BigDecimal.ZERO, BigDecimal.ONE);
    }

    public static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }
}
