package com.aiinpocket.whalecopy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hyperliquid.api")
public record HyperliquidApiProperties(
        String baseUrl,
        String infoPath,
        int fillsPageSize,
        int maxPages
) {}
