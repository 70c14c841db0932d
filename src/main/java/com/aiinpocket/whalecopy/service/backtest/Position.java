package com.aiinpocket.whalecopy.service.backtest;

import java.math.BigDecimal;

/**
 * 單一帳戶在單一資產上的持倉（可變）。
 * 數量為正代表多單、負代表空單；數量為 0 時均價與保證金也必須為 0。
 */
public final class Position {

    private BigDecimal quantity = BigDecimal.ZERO;
    private BigDecimal averagePrice = BigDecimal.ZERO;
    private BigDecimal margin = BigDecimal.ZERO;

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getAveragePrice() {
        return averagePrice;
    }

    public BigDecimal getMargin() {
        return margin;
    }

    public boolean isFlat() {
        return quantity.signum() == 0;
    }

    public boolean isLong() {
        return quantity.signum() > 0;
    }

    void update(BigDecimal quantity, BigDecimal averagePrice, BigDecimal margin) {
        if (quantity.signum() == 0) {
            reset();
            return;
        }
        this.quantity = quantity;
        this.averagePrice = averagePrice;
        this.margin = margin;
    }

    void reset() {
        quantity = BigDecimal.ZERO;
        averagePrice = BigDecimal.ZERO;
        margin = BigDecimal.ZERO;
    }

    @Override
    public String toString() {
        return "Position{qty=" + quantity.toPlainString()
                + ", avg=" + averagePrice.toPlainString()
                + ", margin=" + margin.toPlainString() + "}";
    }
}
