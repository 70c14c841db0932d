package com.aiinpocket.whalecopy.model.enums;

/**
 * 成交方向。
 * 進場方向（BUY / LONG / SHORT）建立或加碼部位；
 * 平倉方向（SELL / WITHDRAW / CLOSE_LONG / CLOSE_SHORT）只減少既有部位；
 * DEPOSIT 不參與模擬與跟單。
 */
public enum TradeDirection {
    BUY,
    SELL,
    DEPOSIT,
    WITHDRAW,
    LONG,
    SHORT,
    CLOSE_LONG,
    CLOSE_SHORT;

    public boolean isEntry() {
        return this == BUY || this == LONG || this == SHORT;
    }

    public boolean isClose() {
        return this == SELL || this == WITHDRAW || this == CLOSE_LONG || this == CLOSE_SHORT;
    }

    public boolean isIgnored() {
        return this == DEPOSIT;
    }

    /** 進場方向的數量符號：做多 +1、做空 -1，非進場方向為 0 */
    public int entrySign() {
        return switch (this) {
            case BUY, LONG -> 1;
            case SHORT -> -1;
            default -> 0;
        };
    }

    /**
     * 共識訊號使用的方向家族：BUY 與 LONG 同屬 LONG，SHORT 自成一類。
     *
     * @throws IllegalStateException 非進場方向沒有家族
     */
    public TradeDirection entryFamily() {
        return switch (this) {
            case BUY, LONG -> LONG;
            case SHORT -> SHORT;
            default -> throw new IllegalStateException("非進場方向沒有方向家族: " + this);
        };
    }
}
