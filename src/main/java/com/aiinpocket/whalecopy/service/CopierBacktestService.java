package com.aiinpocket.whalecopy.service;

import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.model.dto.*;
import com.aiinpocket.whalecopy.model.entity.BacktestRun;
import com.aiinpocket.whalecopy.model.entity.TrackedWhale;
import com.aiinpocket.whalecopy.model.entity.WhaleTrade;
import com.aiinpocket.whalecopy.model.enums.TradeDirection;
import com.aiinpocket.whalecopy.repository.BacktestRunRepository;
import com.aiinpocket.whalecopy.repository.TrackedWhaleRepository;
import com.aiinpocket.whalecopy.repository.WhaleTradeRepository;
import com.aiinpocket.whalecopy.service.backtest.BacktestSimulator;
import com.aiinpocket.whalecopy.service.backtest.PriceResolver;
import com.aiinpocket.whalecopy.service.signal.SignalAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

/**
 * 跟單回測的協調層：解析鯨魚、讀取成交與價格、執行模擬，必要時存成 Run。
 * <p>
 * 找不到鯨魚是呼叫端錯誤（{@link IllegalArgumentException}）；
 * 篩選後沒有成交則回傳零值結果，而不是錯誤。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CopierBacktestService {

    static final Set<TradeDirection> IGNORED_DIRECTIONS = EnumSet.of(TradeDirection.DEPOSIT);
    static final Set<TradeDirection> ENTRY_DIRECTIONS =
            EnumSet.of(TradeDirection.BUY, TradeDirection.LONG, TradeDirection.SHORT);

    private final TrackedWhaleRepository whaleRepository;
    private final WhaleTradeRepository tradeRepository;
    private final BacktestRunRepository runRepository;
    private final PriceHistoryService priceHistoryService;
    private final BacktestSimulator simulator;
    private final SignalAggregator signalAggregator;
    private final CopyTradingProperties props;
    private final ObjectMapper objectMapper;

    public BacktestResult runCopierBacktest(CopierBacktestRequest request) {
        TrackedWhale whale = resolveWhale(request.address());
        Set<String> assets = normalizeAssets(request.assetSymbols());

        List<TradeEvent> events = loadTrades(whale, request.start(), request.end(), assets).stream()
                .limit(request.maxTrades() != null && request.maxTrades() > 0 ? request.maxTrades() : Long.MAX_VALUE)
                .map(t -> toTradeEvent(t, whale.getAddress()))
                .toList();
        List<BigDecimal> entryHistory = tradeRepository.findEntryValues(whale.getId(), ENTRY_DIRECTIONS)
                .stream().map(BigDecimal::abs).toList();

        BacktestParameters params = new BacktestParameters(
                request.initialDepositUsd(),
                leverageOrDefault(request.leverage()),
                request.positionSizePct(),
                feeOrDefault(request.feeBps()),
                slippageOrDefault(request.slippageBps()),
                BigDecimal.valueOf(props.backtest().perTradeCapPct()),
                assets,
                entryHistory);

        log.info("[回測] 鯨魚 {} 共 {} 筆成交 (assets={}, {} → {})",
                whale.getAddress(), events.size(), assets, request.start(), request.end());
        PriceResolver prices = loadPrices(events);
        BacktestResult result = simulator.simulate(events, params, prices);
        if (request.includePricePoints()) {
            result = result.withPricePoints(prices.pointsByAsset());
        }

        if (request.runName() != null && !request.runName().isBlank()) {
            saveRun(request.runName(), whale.getId(), result);
        }
        return result;
    }

    /**
     * 多鯨魚共識回測：各鯨魚的進場成交先彙整成共識訊號，再把訊號當成成交模擬。
     * 訊號只追蹤進場，因此不會產生平倉。
     */
    public BacktestResult runMultiWhaleBacktest(MultiWhaleBacktestRequest request) {
        if (request.addresses() == null || request.addresses().isEmpty()) {
            throw new IllegalArgumentException("至少需要一個鯨魚地址");
        }
        Set<String> assets = normalizeAssets(request.assetSymbols());
        List<TradeEvent> entries = new ArrayList<>();
        for (String address : new LinkedHashSet<>(request.addresses())) {
            TrackedWhale whale = resolveWhale(address);
            loadTrades(whale, request.start(), request.end(), assets).stream()
                    .filter(t -> t.getDirection().isEntry())
                    .map(t -> toTradeEvent(t, whale.getAddress()))
                    .forEach(entries::add);
        }

        int windowMinutes = request.windowMinutes() != null
                ? request.windowMinutes() : props.signal().defaultWindowMinutes();
        int minWhales = request.minWhales() != null
                ? request.minWhales() : props.signal().defaultMinWhales();
        List<Signal> signals = signalAggregator.aggregate(entries, Duration.ofMinutes(windowMinutes), minWhales);
        List<TradeEvent> synthetic = signalAggregator.toTradeEvents(signals);

        BacktestParameters params = new BacktestParameters(
                request.initialDepositUsd(),
                leverageOrDefault(request.leverage()),
                request.positionSizePct(),
                feeOrDefault(request.feeBps()),
                slippageOrDefault(request.slippageBps()),
                BigDecimal.valueOf(props.backtest().perTradeCapPct()),
                assets,
                entries.stream().map(TradeEvent::absoluteValueUsd).toList());

        log.info("[回測] 共識回測 {} 個鯨魚，{} 筆進場 → {} 個訊號",
                request.addresses().size(), entries.size(), signals.size());
        return simulator.simulate(synthetic, params, loadPrices(synthetic));
    }

    /** 鯨魚交易過的資產 */
    public List<String> listAssets(String address) {
        TrackedWhale whale = resolveWhale(address);
        return tradeRepository.findDistinctAssets(whale.getId());
    }

    public BacktestRun saveRun(String name, Long whaleId, BacktestResult result) {
        BacktestResult.Summary s = result.summary();
        BacktestRun run = BacktestRun.builder()
                .name(name)
                .whaleId(whaleId)
                .leverage(s.leverageUsed())
                .positionSizePct(s.usedPositionPct())
                .assetSymbols(s.assetSymbols().isEmpty() ? null : String.join(",", s.assetSymbols()))
                .winRatePercent(s.winRatePercent())
                .tradesCopied(s.tradesCopied())
                .maxDrawdownPercent(s.maxDrawdownPercent())
                .maxDrawdownUsd(s.maxDrawdownUsd())
                .initialDepositUsd(s.initialDepositUsd())
                .netPnlUsd(s.netPnlUsd())
                .roiPercent(s.roiPercent())
                .summaryJson(objectMapper.writeValueAsString(s))
                .build();
        BacktestRun saved = runRepository.save(run);
        log.info("[回測] 已儲存 Run #{} '{}' (ROI {}%)", saved.getId(), name, s.roiPercent());
        return saved;
    }

    /** 鯨魚的回測紀錄；未指定地址時回傳最近 20 筆 */
    public List<BacktestRun> listRuns(String address) {
        if (address == null || address.isBlank()) {
            return runRepository.findTop20ByOrderByCreatedAtDesc();
        }
        return runRepository.findByWhaleIdOrderByCreatedAtDesc(resolveWhale(address).getId());
    }

    TrackedWhale resolveWhale(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("鯨魚地址不可為空");
        }
        return whaleRepository.findByAddressIgnoreCase(address.trim())
                .orElseThrow(() -> new IllegalArgumentException("找不到鯨魚: " + address));
    }

    private List<WhaleTrade> loadTrades(TrackedWhale whale, Instant start, Instant end, Set<String> assets) {
        Stream<WhaleTrade> stream = tradeRepository
                .findByWhaleIdAndDirectionNotInOrderByTimestampAscIdAsc(whale.getId(), IGNORED_DIRECTIONS)
                .stream();
        if (start != null) stream = stream.filter(t -> !t.getTimestamp().isBefore(start));
        if (end != null) stream = stream.filter(t -> !t.getTimestamp().isAfter(end));
        if (!assets.isEmpty()) stream = stream.filter(t -> assets.contains(t.getBaseAsset().toUpperCase()));
        return stream.toList();
    }

    private PriceResolver loadPrices(List<TradeEvent> events) {
        if (events.isEmpty()) return PriceResolver.empty();
        Set<String> assets = new TreeSet<>();
        Instant from = events.get(0).timestamp();
        Instant to = from;
        for (TradeEvent e : events) {
            if (e.asset() != null) assets.add(e.asset());
            if (e.timestamp().isBefore(from)) from = e.timestamp();
            if (e.timestamp().isAfter(to)) to = e.timestamp();
        }
        return priceHistoryService.loadResolver(assets, from, to);
    }

    static TradeEvent toTradeEvent(WhaleTrade t, String address) {
        return new TradeEvent(t.getId(), t.getTimestamp(), address, t.getBaseAsset(), t.getDirection(),
                t.getAmountBase(), t.getValueUsd(), t.getRealizedPnlUsd());
    }

    private static Set<String> normalizeAssets(List<String> assets) {
        Set<String> normalized = new TreeSet<>();
        if (assets != null) {
            assets.stream().filter(a -> a != null && !a.isBlank()).map(String::toUpperCase).forEach(normalized::add);
        }
        return normalized;
    }

    private BigDecimal leverageOrDefault(BigDecimal leverage) {
        return leverage != null ? leverage : BigDecimal.valueOf(props.backtest().defaultLeverage());
    }

    private BigDecimal feeOrDefault(BigDecimal feeBps) {
        return feeBps != null ? feeBps : BigDecimal.valueOf(props.backtest().defaultFeeBps());
    }

    private BigDecimal slippageOrDefault(BigDecimal slippageBps) {
        return slippageBps != null ? slippageBps : BigDecimal.valueOf(props.backtest().defaultSlippageBps());
    }
}
