package com.aiinpocket.whalecopy.service.backtest;

import com.aiinpocket.whalecopy.model.dto.BacktestResult.EquityCurvePoint;
import com.aiinpocket.whalecopy.model.dto.BacktestResult.TradeResult;
import com.aiinpocket.whalecopy.service.backtest.PositionLedger.MarkToMarket;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 單次回測的可變狀態，只屬於一次模擬呼叫。
 */
final class SimulationState {

    static final int USD_SCALE = 8;

    BigDecimal cash;
    final Map<String, Position> positions = new LinkedHashMap<>();
    BigDecimal grossPnl = BigDecimal.ZERO;
    BigDecimal totalFees = BigDecimal.ZERO;
    BigDecimal totalSlippage = BigDecimal.ZERO;
    int wins;
    int closingTrades;
    final List<TradeResult> trades = new ArrayList<>();
    final List<EquityCurvePoint> equityCurve = new ArrayList<>();
    final List<BigDecimal> rawEquities = new ArrayList<>();

    SimulationState(BigDecimal initialCash) {
        this.cash = initialCash;
    }

    Position position(String asset) {
        return positions.computeIfAbsent(asset, k -> new Position());
    }

    MarkToMarket markToMarket(Instant asOf, PriceResolver prices) {
        return PositionLedger.unrealizedAndMargin(positions, asOf, prices);
    }

    BigDecimal equity(MarkToMarket mtm) {
        return cash.add(mtm.margin()).add(mtm.unrealizedPnl());
    }

    /** 記錄一個權益點：權益 = 現金 + 保證金 + 未實現損益 */
    BigDecimal recordEquity(Instant pointTime, Instant markTime, PriceResolver prices) {
        MarkToMarket mtm = markToMarket(markTime, prices);
        BigDecimal equity = equity(mtm);
        rawEquities.add(equity);
        equityCurve.add(new EquityCurvePoint(pointTime,
                usd(equity), usd(cash), usd(mtm.margin()), usd(mtm.unrealizedPnl())));
        return equity;
    }

    static BigDecimal usd(BigDecimal v) {
        return v.setScale(USD_SCALE, RoundingMode.HALF_UP);
    }
}
