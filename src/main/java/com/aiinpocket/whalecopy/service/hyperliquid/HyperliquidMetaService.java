package com.aiinpocket.whalecopy.service.hyperliquid;

import com.aiinpocket.whalecopy.config.CacheConfig;
import com.aiinpocket.whalecopy.model.dto.AssetSizing;
import com.aiinpocket.whalecopy.service.copier.AssetSizingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import tools.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * 從 Hyperliquid meta 取得資產編號與數量精度。
 * 先查永續合約 universe，找不到再查現貨 spotMeta（數量精度取交易對第一個代幣的 szDecimals）。
 * 結果以 Caffeine 快取 1 小時（見 {@link CacheConfig}）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HyperliquidMetaService implements AssetSizingProvider {

    private final HyperliquidInfoClient infoClient;

    @Override
    @Cacheable(value = CacheConfig.ASSET_SIZING_CACHE, key = "#asset.toUpperCase()")
    public Optional<AssetSizing> resolve(String asset) {
        Optional<AssetSizing> perp = resolvePerp(asset);
        if (perp.isPresent()) return perp;

        Optional<AssetSizing> spot = resolveSpot(asset);
        if (spot.isEmpty()) {
            log.warn("[Hyperliquid] meta 與 spotMeta 中都找不到資產 {}", asset);
        }
        return spot;
    }

    private Optional<AssetSizing> resolvePerp(String asset) {
        JsonNode universe = infoClient.fetchMeta().get("universe");
        if (universe == null || !universe.isArray()) {
            throw new ExchangeApiException("meta 回應缺少 universe");
        }
        int index = 0;
        for (JsonNode entry : universe) {
            JsonNode name = entry.get("name");
            JsonNode szDecimals = entry.get("szDecimals");
            if (name != null && szDecimals != null && name.asText().equalsIgnoreCase(asset)) {
                AssetSizing sizing = AssetSizing.perp(name.asText().toUpperCase(), index, szDecimals.asInt());
                log.debug("[Hyperliquid] {} 資產編號 {} 數量精度 {}", asset, index, sizing.sizeDecimals());
                return Optional.of(sizing);
            }
            index++;
        }
        return Optional.empty();
    }

    private Optional<AssetSizing> resolveSpot(String asset) {
        JsonNode spotMeta = infoClient.fetchSpotMeta();
        if (spotMeta == null) return Optional.empty();
        JsonNode universe = spotMeta.get("universe");
        JsonNode tokens = spotMeta.get("tokens");
        if (universe == null || !universe.isArray() || tokens == null || !tokens.isArray()) {
            return Optional.empty();
        }
        for (JsonNode pair : universe) {
            JsonNode name = pair.get("name");
            JsonNode index = pair.get("index");
            JsonNode tokenIndices = pair.get("tokens");
            if (name == null || index == null || tokenIndices == null || tokenIndices.isEmpty()) continue;
            if (!name.asText().equalsIgnoreCase(asset)) continue;

            int tokenIdx = tokenIndices.get(0).asInt();
            JsonNode token = tokenIdx < tokens.size() ? tokens.get(tokenIdx) : null;
            JsonNode szDecimals = token != null ? token.get("szDecimals") : null;
            if (szDecimals == null || szDecimals.isNull()) continue;

            AssetSizing sizing = AssetSizing.spot(name.asText().toUpperCase(), index.asInt(), szDecimals.asInt());
            log.debug("[Hyperliquid] 現貨 {} 資產編號 {} 數量精度 {}", asset, sizing.assetIndex(), sizing.sizeDecimals());
            return Optional.of(sizing);
        }
        return Optional.empty();
    }
}
