package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;

/**
 * 固定值或「自動」的設定（槓桿、部位比例）。
 * {@code value} 為 null 代表自動，依來源帳戶狀態即時計算。
 */
public record AdaptiveSetting(BigDecimal value) {

    public static AdaptiveSetting auto() {
        return new AdaptiveSetting(null);
    }

    public static AdaptiveSetting fixed(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("固定設定值不可為 null");
        }
        return new AdaptiveSetting(value);
    }

    public static AdaptiveSetting ofNullable(BigDecimal value) {
        return new AdaptiveSetting(value);
    }

    public boolean isAuto() {
        return value == null;
    }

    @Override
    public String toString() {
        return isAuto() ? "auto" : value.toPlainString();
    }
}
