package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * 資產下單精度。
 * 數量四捨五入到 {@code sizeDecimals} 位；價格先取 5 位有效數字，再截到 {@code priceDecimals} 位。
 *
 * @param assetIndex 交易所的資產編號
 */
public record AssetSizing(
        String asset,
        int assetIndex,
        int sizeDecimals,
        int priceDecimals
) {
    public static final int SPOT_INDEX_OFFSET = 10000;

    private static final MathContext PRICE_SIG_FIGS = new MathContext(5, RoundingMode.HALF_EVEN);

    /** 永續合約的價格小數位數上限為 6 減去數量小數位數 */
    public static AssetSizing perp(String asset, int assetIndex, int sizeDecimals) {
        return new AssetSizing(asset, assetIndex, sizeDecimals, Math.max(0, 6 - sizeDecimals));
    }

    /** 現貨的資產編號為 10000 + 現貨 index，價格小數位數上限為 8 減去數量小數位數 */
    public static AssetSizing spot(String asset, int spotIndex, int sizeDecimals) {
        return new AssetSizing(asset, SPOT_INDEX_OFFSET + spotIndex, sizeDecimals, Math.max(0, 8 - sizeDecimals));
    }

    public BigDecimal minSizeIncrement() {
        return BigDecimal.ONE.movePointLeft(sizeDecimals);
    }

    public BigDecimal priceIncrement() {
        return BigDecimal.ONE.movePointLeft(priceDecimals);
    }

    public BigDecimal roundSize(BigDecimal size) {
        return size.setScale(sizeDecimals, RoundingMode.HALF_EVEN);
    }

    public BigDecimal roundPrice(BigDecimal price) {
        if (price.signum() == 0) return BigDecimal.ZERO;
        BigDecimal sig = price.round(PRICE_SIG_FIGS);
        return sig.setScale(priceDecimals, RoundingMode.HALF_EVEN);
    }
}
