package com.aiinpocket.whalecopy.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * REST 客戶端配置。
 *
 * <ul>
 *   <li>{@code hyperliquidRestClient}：Hyperliquid info 端點（成交、帳戶狀態、meta）</li>
 *   <li>{@code binanceRestClient}：Binance K 線，用於回補歷史價格</li>
 * </ul>
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient hyperliquidRestClient(HyperliquidApiProperties props) {
        return RestClient.builder()
                .baseUrl(props.baseUrl())
                .defaultHeader("Accept", "application/json")
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Bean
    public RestClient binanceRestClient(BinanceApiProperties props) {
        return RestClient.builder()
                .baseUrl(props.baseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }
}
