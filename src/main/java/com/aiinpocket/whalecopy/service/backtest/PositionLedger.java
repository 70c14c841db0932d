package com.aiinpocket.whalecopy.service.backtest;

import com.aiinpocket.whalecopy.model.enums.TradeDirection;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * 持倉帳本：均價成本累積、比例平倉與未實現損益彙總。
 * 回測模擬與即時跟單的影子持倉共用同一套邏輯。
 */
public final class PositionLedger {

    static final MathContext MC = MathContext.DECIMAL64;

    private PositionLedger() {}

    /**
     * 進場或加碼。
     * 新數量為 0（同一刻反向抵銷）時持倉歸零；否則以加權平均重算均價並累加保證金。
     *
     * @param quantity       進場數量（取絕對值，方向由 {@code direction} 決定）
     * @param marginRequired 本次進場保留的保證金
     * @throws IllegalArgumentException 方向不是進場方向
     */
    public static void applyEntry(Position position, TradeDirection direction,
                                  BigDecimal quantity, BigDecimal price, BigDecimal marginRequired) {
        if (!direction.isEntry()) {
            throw new IllegalArgumentException("不是進場方向: " + direction);
        }
        BigDecimal signedQty = direction.entrySign() > 0 ? quantity.abs() : quantity.abs().negate();
        if (signedQty.signum() == 0) return;

        BigDecimal qty = position.getQuantity();
        BigDecimal newQty = qty.add(signedQty);
        if (newQty.signum() == 0) {
            position.reset();
            return;
        }
        BigDecimal existingCost = position.getAveragePrice().multiply(qty);
        BigDecimal addedCost = price.multiply(signedQty);
        BigDecimal newAvg = existingCost.add(addedCost).divide(newQty, MC);
        position.update(newQty, newAvg, position.getMargin().add(marginRequired));
    }

    /**
     * 平倉，數量上限為目前持倉。
     *
     * @return 平倉結果；持倉為空時回傳 empty（沒有可平的部位）
     */
    public static Optional<CloseResult> applyClose(Position position, BigDecimal closeQuantity, BigDecimal price) {
        if (position.isFlat()) return Optional.empty();

        BigDecimal qty = position.getQuantity();
        BigDecimal absQty = qty.abs();
        BigDecimal closeQty = closeQuantity.abs().min(absQty);
        if (closeQty.signum() == 0) return Optional.empty();

        BigDecimal avg = position.getAveragePrice();
        BigDecimal pnl = position.isLong()
                ? price.subtract(avg).multiply(closeQty)
                : avg.subtract(price).multiply(closeQty);

        BigDecimal remaining = position.isLong() ? qty.subtract(closeQty) : qty.add(closeQty);
        BigDecimal released;
        if (remaining.signum() == 0) {
            released = position.getMargin();
            position.reset();
        } else {
            released = position.getMargin().multiply(closeQty).divide(absQty, MC);
            position.update(remaining, avg, position.getMargin().subtract(released));
        }
        return Optional.of(new CloseResult(closeQty, pnl, released));
    }

    /**
     * 彙總所有持倉在 {@code asOf} 的未實現損益與保證金。
     * 查不到標記價格的持倉，未實現損益以 0 計，但保證金照算。
     */
    public static MarkToMarket unrealizedAndMargin(Map<String, Position> positions, Instant asOf,
                                                   PriceResolver prices) {
        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal margin = BigDecimal.ZERO;
        for (Map.Entry<String, Position> e : positions.entrySet()) {
            Position pos = e.getValue();
            margin = margin.add(pos.getMargin());
            if (pos.isFlat()) continue;
            BigDecimal mark = prices.priceAt(e.getKey(), asOf, null);
            if (mark == null) continue;
            BigDecimal avg = pos.getAveragePrice();
            unrealized = pos.isLong()
                    ? unrealized.add(mark.subtract(avg).multiply(pos.getQuantity()))
                    : unrealized.add(avg.subtract(mark).multiply(pos.getQuantity().abs()));
        }
        return new MarkToMarket(unrealized, margin);
    }

    /**
     * @param closedQuantity 實際平倉數量
     * @param realizedPnl    平倉部分的已實現損益（未扣費用）
     * @param releasedMargin 依平倉比例釋放的保證金
     */
    public record CloseResult(BigDecimal closedQuantity, BigDecimal realizedPnl, BigDecimal releasedMargin) {}

    public record MarkToMarket(BigDecimal unrealizedPnl, BigDecimal margin) {}
}
