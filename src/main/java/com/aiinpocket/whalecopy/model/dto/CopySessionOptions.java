package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.util.Set;

/**
 * 建立即時跟單 session 的參數。
 *
 * @param depositUsd 使用者投入的資金，自動部位比例以此對照來源帳戶淨值
 * @param execute    true 才會真的送單；false 為 dry-run
 */
public record CopySessionOptions(
        Long whaleId,
        String address,
        AdaptiveSetting leverage,
        AdaptiveSetting positionSizePct,
        Set<String> assetSymbols,
        BigDecimal depositUsd,
        boolean execute
) {
    public CopySessionOptions {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("來源地址不可為空");
        }
        if (leverage == null) leverage = AdaptiveSetting.fixed(BigDecimal.ONE);
        if (positionSizePct == null) positionSizePct = AdaptiveSetting.auto();
        assetSymbols = assetSymbols == null ? Set.of() : Set.copyOf(assetSymbols);
        if (positionSizePct.isAuto() && (depositUsd == null || depositUsd.signum() <= 0)) {
            throw new IllegalArgumentException("自動部位比例需要正的投入資金");
        }
    }
}
