package com.aiinpocket.whalecopy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 跟單引擎設定（application.yml 的 {@code copytrade.*}）。
 */
@ConfigurationProperties(prefix = "copytrade")
public record CopyTradingProperties(
        BacktestParams backtest,
        CopierParams copier,
        SignalParams signal,
        IngestParams ingest
) {
    /** 回測預設值：手續費與滑價以 bps 表示 */
    public record BacktestParams(
            double defaultFeeBps,
            double defaultSlippageBps,
            double defaultLeverage,
            double perTradeCapPct,
            int priceWindowPaddingMinutes
    ) {}

    /** 即時跟單輪詢、節流與退避設定 */
    public record CopierParams(
            long pollIntervalMs,
            long leverageThrottleMs,
            long infoMinIntervalMs,
            long accountStateTtlMs,
            double slippagePct,
            long backoffBaseMs,
            long backoffMaxMs,
            int maxMessages,
            boolean crossMargin
    ) {}

    public record SignalParams(
            int defaultWindowMinutes,
            int defaultMinWhales
    ) {}

    public record IngestParams(
            String cron,
            int maxConsecutiveErrors
    ) {}
}
