package com.aiinpocket.whalecopy.service.hyperliquid;

import com.aiinpocket.whalecopy.model.dto.Fill;
import com.aiinpocket.whalecopy.model.enums.TradeDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * 把 Hyperliquid 的成交 JSON 轉成 {@link Fill}。
 * 方向判斷只在這裡發生，核心邏輯不會接觸交易所的原始欄位。
 */
@Component
@Slf4j
public class HyperliquidFillMapper {

    /**
     * 由交易所的方向提示分類。
     * {@code dir} 含 close 時為平倉（依 long/short 區分），否則含 short/long 為進場；
     * 沒有可辨識的 {@code dir} 時以 {@code side} 判斷：A（賣方）視為做空，其餘視為做多。
     */
    public static TradeDirection classify(String dir, String side) {
        String d = dir == null ? "" : dir.toLowerCase(Locale.ROOT);
        if (d.contains("close") && d.contains("short")) return TradeDirection.CLOSE_SHORT;
        if (d.contains("close") && d.contains("long")) return TradeDirection.CLOSE_LONG;
        if (d.contains("short")) return TradeDirection.SHORT;
        if (d.contains("long")) return TradeDirection.LONG;
        return "A".equalsIgnoreCase(side) ? TradeDirection.SHORT : TradeDirection.LONG;
    }

    /** 交易所的買賣方：B 為買、A 為賣 */
    public static boolean isBuy(String side) {
        return "B".equalsIgnoreCase(side) || "BUY".equalsIgnoreCase(side);
    }

    /**
     * 同一筆鏈上交易可能拆成多筆成交，因此以 hash + tid 當唯一識別；
     * 缺少時依序退回 hash、tid、oid。
     */
    public static String providerId(String hash, String tid, String oid) {
        boolean hasHash = hash != null && !hash.isBlank();
        boolean hasTid = tid != null && !tid.isBlank();
        if (hasHash && hasTid) return hash + ":" + tid;
        if (hasHash) return hash;
        if (hasTid) return tid;
        return oid != null && !oid.isBlank() ? oid : null;
    }

    /** @return 缺少必要欄位（時間、資產、數量、價格、識別碼）時回傳 empty */
    public Optional<Fill> map(JsonNode node) {
        try {
            String coin = text(node, "coin");
            String px = text(node, "px");
            String sz = text(node, "sz");
            JsonNode timeNode = node.get("time");
            String id = providerId(text(node, "hash"), text(node, "tid"), text(node, "oid"));
            if (coin == null || px == null || sz == null || timeNode == null || timeNode.isNull() || id == null) {
                return Optional.empty();
            }
            String side = text(node, "side");
            String closedPnl = text(node, "closedPnl");
            return Optional.of(new Fill(
                    id,
                    Instant.ofEpochMilli(timeNode.asLong()),
                    coin.toUpperCase(Locale.ROOT),
                    classify(text(node, "dir"), side),
                    isBuy(side),
                    new BigDecimal(sz).abs(),
                    new BigDecimal(px),
                    closedPnl != null ? new BigDecimal(closedPnl) : null));
        } catch (NumberFormatException e) {
            log.warn("[Hyperliquid] 無法解析成交: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) return null;
        String value = child.asText();
        return value.isBlank() ? null : value;
    }
}
