package com.aiinpocket.whalecopy.service.backtest;

import com.aiinpocket.whalecopy.model.dto.BacktestParameters;
import com.aiinpocket.whalecopy.model.dto.BacktestResult;
import com.aiinpocket.whalecopy.model.dto.BacktestResult.Summary;
import com.aiinpocket.whalecopy.model.dto.BacktestResult.TradeResult;
import com.aiinpocket.whalecopy.model.dto.TradeEvent;
import com.aiinpocket.whalecopy.model.enums.SimulationStep;
import com.aiinpocket.whalecopy.service.backtest.DrawdownCalculator.Drawdown;
import com.aiinpocket.whalecopy.service.backtest.PositionLedger.CloseResult;
import com.aiinpocket.whalecopy.service.backtest.PositionLedger.MarkToMarket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.*;

import static com.aiinpocket.whalecopy.service.backtest.SimulationState.usd;

/**
 * 跟單回測模擬器，純記憶體計算，每次呼叫擁有獨立狀態。
 * <p>
 * 以固定步長的時鐘從第一筆事件走到最後一筆事件，每個步長內依原始順序處理事件，
 * 步長結束時記錄一個權益點。
 * <ul>
 *   <li>進場：單筆名目上限為「目前權益 × 槓桿」的 5%；現金不足時按比例縮小而不是拒絕</li>
 *   <li>平倉：不受權益上限限制，只受現有持倉數量限制；費用以實際成交名目計算</li>
 *   <li>價格：優先使用價格序列，否則用成交隱含價格；兩者皆無則略過該筆</li>
 * </ul>
 */
@Component
@Slf4j
public class BacktestSimulator {

    static final BigDecimal MIN_LEVERAGE = new BigDecimal("0.1");
    static final BigDecimal MAX_LEVERAGE = BigDecimal.valueOf(100);
    static final BigDecimal MAX_POSITION_PCT = BigDecimal.valueOf(200);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);
    private static final MathContext MC = MathContext.DECIMAL64;
    /** 可負擔比例與保證金一律無條件捨去，縮小後的成本不會超過現金 */
    private static final MathContext MC_DOWN = new MathContext(16, RoundingMode.DOWN);

    public BacktestResult simulate(List<TradeEvent> events, BacktestParameters params, PriceResolver prices) {
        BigDecimal deposit = params.initialDepositUsd();
        BigDecimal leverage = SizingCalculator.clamp(params.leverage(), MIN_LEVERAGE, MAX_LEVERAGE);
        BigDecimal feeRate = params.feeBps().divide(BPS, MC);
        BigDecimal slippageRate = params.slippageBps().divide(BPS, MC);
        BigDecimal capRatio = params.perTradeCapPct().divide(HUNDRED, MC);
        PriceResolver resolver = prices != null ? prices : PriceResolver.empty();

        List<TradeEvent> timeline = filterAndSort(events, params.assetSymbols());

        List<BigDecimal> entryHistory = params.entryNotionalHistory() != null
                ? params.entryNotionalHistory()
                : timeline.stream().filter(e -> e.direction().isEntry()).map(TradeEvent::absoluteValueUsd).toList();
        BigDecimal recommendedPct = SizingCalculator.recommendedRatio(deposit, entryHistory).multiply(HUNDRED);
        BigDecimal usedPct = params.positionSizePct() != null
                ? SizingCalculator.clamp(params.positionSizePct(), BigDecimal.ZERO, MAX_POSITION_PCT)
                : recommendedPct;
        BigDecimal scale = usedPct.divide(HUNDRED, MC);

        SimulationState state = new SimulationState(deposit);
        if (timeline.isEmpty()) {
            log.info("[回測] 篩選後沒有可模擬的成交，回傳零值結果");
            return buildResult(state, params, deposit, deposit, recommendedPct, usedPct, leverage, null, null);
        }

        Instant first = timeline.get(0).timestamp();
        Instant last = timeline.get(timeline.size() - 1).timestamp();
        SimulationStep step = SimulationStep.forSpan(first, last);
        Instant bucket = step.truncate(first);
        Instant lastBucket = step.truncate(last);

        int idx = 0;
        BigDecimal finalEquity = deposit;
        while (!bucket.isAfter(lastBucket)) {
            Instant bucketEnd = bucket.plus(step.getDuration());
            while (idx < timeline.size() && timeline.get(idx).timestamp().isBefore(bucketEnd)) {
                TradeEvent event = timeline.get(idx++);
                processEvent(event, state, resolver, deposit, leverage, scale, capRatio, feeRate, slippageRate);
            }
            finalEquity = state.recordEquity(bucket, bucketEnd.minusMillis(1), resolver);
            bucket = bucketEnd;
        }

        return buildResult(state, params, deposit, finalEquity, recommendedPct, usedPct, leverage, first, last);
    }

    private List<TradeEvent> filterAndSort(List<TradeEvent> events, Set<String> assetSymbols) {
        Set<String> allow = new HashSet<>();
        assetSymbols.forEach(a -> allow.add(a.toUpperCase()));
        List<TradeEvent> timeline = new ArrayList<>();
        for (TradeEvent e : events) {
            if (e.timestamp() == null || e.direction() == null || e.direction().isIgnored()) continue;
            if (!allow.isEmpty() && (e.asset() == null || !allow.contains(e.asset().toUpperCase()))) continue;
            timeline.add(e);
        }
        // List.sort 為穩定排序，同時間的事件保持輸入順序
        timeline.sort(Comparator.comparing(TradeEvent::timestamp));
        return timeline;
    }

    private void processEvent(TradeEvent event, SimulationState state, PriceResolver prices,
                              BigDecimal deposit, BigDecimal leverage, BigDecimal scale, BigDecimal capRatio,
                              BigDecimal feeRate, BigDecimal slippageRate) {
        String asset = event.asset() != null ? event.asset().toUpperCase() : "UNKNOWN";
        BigDecimal desiredNotional = event.absoluteValueUsd().multiply(scale, MC);
        if (desiredNotional.signum() <= 0) return;

        BigDecimal price = prices.priceAt(asset, event.timestamp(), event.impliedPrice());
        if (price == null || price.signum() <= 0) {
            log.debug("[回測] {} {} @ {} 無可用價格，略過", event.direction(), asset, event.timestamp());
            return;
        }

        BigDecimal pnl = BigDecimal.ZERO;
        BigDecimal fee;
        BigDecimal slippage;
        BigDecimal notional;
        BigDecimal netChange;
        Position position;

        if (event.direction().isEntry()) {
            MarkToMarket before = state.markToMarket(event.timestamp(), prices);
            BigDecimal equityNow = state.equity(before);
            BigDecimal maxOverall = equityNow.multiply(leverage);
            if (maxOverall.signum() <= 0) return;
            notional = desiredNotional.min(maxOverall.multiply(capRatio, MC));

            fee = notional.multiply(feeRate, MC);
            slippage = notional.multiply(slippageRate, MC);
            BigDecimal margin = notional.divide(leverage, MC_DOWN);
            BigDecimal totalCost = margin.add(fee).add(slippage);
            if (totalCost.compareTo(state.cash) > 0) {
                BigDecimal afford = totalCost.signum() > 0 ? state.cash.divide(totalCost, MC_DOWN) : BigDecimal.ZERO;
                notional = notional.multiply(afford, MC_DOWN);
                fee = notional.multiply(feeRate, MC_DOWN);
                slippage = notional.multiply(slippageRate, MC_DOWN);
                margin = notional.divide(leverage, MC_DOWN);
                totalCost = margin.add(fee).add(slippage);
                if (notional.signum() <= 0 || totalCost.compareTo(state.cash) > 0) {
                    log.debug("[回測] {} {} 現金不足，略過 (cash={})", event.direction(), asset, state.cash);
                    return;
                }
            }

            position = state.position(asset);
            BigDecimal quantity = notional.divide(price, MC);
            PositionLedger.applyEntry(position, event.direction(), quantity, price, margin);
            state.cash = state.cash.subtract(totalCost);
            netChange = fee.add(slippage).negate();
        } else {
            position = state.positions.get(asset);
            if (position == null || position.isFlat()) {
                log.debug("[回測] {} {} 沒有可平的部位，略過", event.direction(), asset);
                return;
            }
            BigDecimal requestedQty = desiredNotional.divide(price, MC);
            Optional<CloseResult> closed = PositionLedger.applyClose(position, requestedQty, price);
            if (closed.isEmpty()) return;

            CloseResult result = closed.get();
            notional = result.closedQuantity().multiply(price);
            fee = notional.multiply(feeRate, MC);
            slippage = notional.multiply(slippageRate, MC);
            pnl = result.realizedPnl();
            netChange = pnl.subtract(fee).subtract(slippage);
            state.cash = state.cash.add(result.releasedMargin()).add(netChange);
            state.grossPnl = state.grossPnl.add(pnl);
            state.closingTrades++;
            if (netChange.signum() > 0) state.wins++;
        }

        state.totalFees = state.totalFees.add(fee);
        state.totalSlippage = state.totalSlippage.add(slippage);

        MarkToMarket after = state.markToMarket(event.timestamp(), prices);
        BigDecimal equity = state.equity(after);
        state.trades.add(new TradeResult(
                state.trades.size() + 1,
                event.tradeId(),
                event.timestamp(),
                event.direction().name(),
                asset,
                usd(price),
                usd(notional),
                usd(pnl),
                usd(fee),
                usd(slippage),
                usd(netChange),
                usd(equity.subtract(deposit)),
                usd(equity),
                usd(after.unrealizedPnl()),
                position.getQuantity().setScale(10, RoundingMode.HALF_UP)));
    }

    private BacktestResult buildResult(SimulationState state, BacktestParameters params,
                                       BigDecimal deposit, BigDecimal finalEquity,
                                       BigDecimal recommendedPct, BigDecimal usedPct, BigDecimal leverage,
                                       Instant start, Instant end) {
        BigDecimal net = finalEquity.subtract(deposit);
        BigDecimal roi = deposit.signum() > 0
                ? net.divide(deposit, MC).multiply(HUNDRED)
                : BigDecimal.ZERO;
        BigDecimal winRate = state.closingTrades > 0
                ? BigDecimal.valueOf(state.wins).multiply(HUNDRED)
                        .divide(BigDecimal.valueOf(state.closingTrades), 4, RoundingMode.HALF_UP)
                : null;
        Drawdown drawdown = DrawdownCalculator.compute(state.rawEquities);
        List<String> assets = params.assetSymbols().stream().map(String::toUpperCase).sorted().toList();

        Summary summary = new Summary(
                usd(deposit),
                recommendedPct.setScale(4, RoundingMode.HALF_UP),
                usedPct.setScale(4, RoundingMode.HALF_UP),
                leverage,
                assets,
                usd(state.totalFees),
                usd(state.totalSlippage),
                usd(state.grossPnl),
                usd(net),
                roi.setScale(4, RoundingMode.HALF_UP),
                state.trades.size(),
                state.closingTrades,
                state.wins,
                winRate,
                drawdown.maxPercent().setScale(4, RoundingMode.HALF_UP),
                usd(drawdown.maxUsd()),
                usd(finalEquity),
                start,
                end);

        if (!state.trades.isEmpty()) {
            log.info("══════════════ Copier Backtest Report ══════════════");
            log.info("Period:      {} → {}", start, end);
            log.info("Sizing:      used {}% (recommended {}%), leverage {}x",
                    summary.usedPositionPct(), summary.recommendedPositionPct(), leverage);
            log.info("Trades:      {} copied, {} closes, WinRate: {}%",
                    summary.tradesCopied(), summary.closingTrades(), winRate);
            log.info("PnL:         gross {} fees {} slippage {} net {} (ROI {}%)",
                    summary.grossPnlUsd(), summary.totalFeesUsd(), summary.totalSlippageUsd(),
                    summary.netPnlUsd(), summary.roiPercent());
            log.info("Risk:        MaxDD {}% ({} USD)", summary.maxDrawdownPercent(), summary.maxDrawdownUsd());
            log.info("══════════════════════════════════════════════════");
        }

        return new BacktestResult(summary, List.copyOf(state.trades), List.copyOf(state.equityCurve), null);
    }
}
