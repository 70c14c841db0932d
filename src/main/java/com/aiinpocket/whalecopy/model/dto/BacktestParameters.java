package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * 單次回測模擬的參數。
 *
 * @param initialDepositUsd    初始資金
 * @param leverage             槓桿（模擬時夾在 [0.1, 100]）
 * @param positionSizePct      跟單比例（%），null 代表使用建議值
 * @param feeBps               手續費（bps）
 * @param slippageBps          滑價（bps）
 * @param perTradeCapPct       單筆進場上限佔「權益 × 槓桿」的百分比
 * @param assetSymbols         資產白名單，空集合代表不限
 * @param entryNotionalHistory 計算建議比例用的歷史進場名目價值，null 代表取輸入事件中的進場
 */
public record BacktestParameters(
        BigDecimal initialDepositUsd,
        BigDecimal leverage,
        BigDecimal positionSizePct,
        BigDecimal feeBps,
        BigDecimal slippageBps,
        BigDecimal perTradeCapPct,
        Set<String> assetSymbols,
        List<BigDecimal> entryNotionalHistory
) {
    public static final BigDecimal DEFAULT_PER_TRADE_CAP_PCT = BigDecimal.valueOf(5);

    public BacktestParameters {
        if (initialDepositUsd == null || initialDepositUsd.signum() < 0) {
            throw new IllegalArgumentException("初始資金不可為負數或空值");
        }
        if (leverage == null) leverage = BigDecimal.ONE;
        if (feeBps == null) feeBps = BigDecimal.ZERO;
        if (slippageBps == null) slippageBps = BigDecimal.ZERO;
        if (perTradeCapPct == null) perTradeCapPct = DEFAULT_PER_TRADE_CAP_PCT;
        assetSymbols = assetSymbols == null ? Set.of() : Set.copyOf(assetSymbols);
    }
}
