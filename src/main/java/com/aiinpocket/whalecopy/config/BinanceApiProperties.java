package com.aiinpocket.whalecopy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binance 公開行情 API 設定，僅用於回補回測所需的 1 分鐘收盤價。
 */
@ConfigurationProperties(prefix = "binance.api")
public record BinanceApiProperties(
        String baseUrl,
        String klinesPath,
        String quoteAsset,
        long rateLimitMs,
        int pageSize
) {}
