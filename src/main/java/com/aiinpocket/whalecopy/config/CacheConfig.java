package com.aiinpocket.whalecopy.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 快取配置。
 * 使用 Caffeine 本地快取，目前只快取 Hyperliquid meta 的下單精度（TTL 1 小時）。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ASSET_SIZING_CACHE = "assetSizing";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(ASSET_SIZING_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.HOURS)
                .maximumSize(500));
        return manager;
    }
}
