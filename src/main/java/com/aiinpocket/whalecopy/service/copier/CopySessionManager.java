package com.aiinpocket.whalecopy.service.copier;

import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.config.CopyTradingProperties.CopierParams;
import com.aiinpocket.whalecopy.model.dto.*;
import com.aiinpocket.whalecopy.model.enums.TradeDirection;
import com.aiinpocket.whalecopy.service.backtest.Position;
import com.aiinpocket.whalecopy.service.backtest.PositionLedger;
import com.aiinpocket.whalecopy.service.backtest.SizingCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 即時跟單 session 管理。
 * <p>
 * session map 的建立、移除與查詢由單一互斥鎖保護；輪詢時先在鎖內複製啟用中的 session，
 * 所有外部 I/O（成交、帳戶狀態、下單）都在鎖外依序執行。
 *
 * <p>每筆新成交的處理流程：
 * <ol>
 *   <li>依交易所 ID 去重並推進游標</li>
 *   <li>資產白名單過濾</li>
 *   <li>開倉前既有持倉的平倉不跟（超出部分照常跟單）</li>
 *   <li>計算跟單比例與槓桿（固定值或依來源帳戶自動計算）</li>
 *   <li>槓桿有變動且為實單模式時更新槓桿（每個 session + 資產節流）</li>
 *   <li>以滑價調整後的價格建立 IOC 單，實單模式才送出</li>
 * </ol>
 */
@Service
@Slf4j
public class CopySessionManager {

    static final BigDecimal MIN_LEVERAGE = new BigDecimal("0.1");
    static final BigDecimal MAX_LEVERAGE = BigDecimal.valueOf(100);
    static final BigDecimal MAX_POSITION_PCT = BigDecimal.valueOf(200);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final MathContext MC = MathContext.DECIMAL64;

    private final CopySourceGateway sourceGateway;
    private final TradingGateway tradingGateway;
    private final AssetSizingProvider sizingProvider;
    private final CopierParams params;
    private final Clock clock;
    private final RateThrottle leverageThrottle;
    private final AddressBackoff backoff;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, CopySession> sessions = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public CopySessionManager(CopySourceGateway sourceGateway,
                              TradingGateway tradingGateway,
                              AssetSizingProvider sizingProvider,
                              CopyTradingProperties props,
                              Clock clock) {
        this.sourceGateway = sourceGateway;
        this.tradingGateway = tradingGateway;
        this.sizingProvider = sizingProvider;
        this.params = props.copier();
        this.clock = clock;
        this.leverageThrottle = new RateThrottle(Duration.ofMillis(params.leverageThrottleMs()), clock);
        this.backoff = new AddressBackoff(
                Duration.ofMillis(params.backoffBaseMs()), Duration.ofMillis(params.backoffMaxMs()), clock);
    }

    // ======== session 生命週期 ========

    /**
     * 建立並啟用 session。
     * 游標設在來源帳戶最新一筆成交（沒有歷史成交或讀取失敗時設在建立時間），歷史成交不會被重播；
     * 同時記下目前持倉，之後這些持倉的平倉不會被跟單。讀取失敗不會阻擋建立，只記錄錯誤。
     */
    public CopySessionStatus createSession(CopySessionOptions options) {
        Instant latestFill = null;
        List<Fill> seedFills = List.of();
        String fillsError = null;
        try {
            seedFills = sourceGateway.fetchFills(options.address(), null);
            for (Fill f : seedFills) {
                if (f.time() != null && (latestFill == null || f.time().isAfter(latestFill))) {
                    latestFill = f.time();
                }
            }
        } catch (RuntimeException e) {
            fillsError = "讀取歷史成交失敗: " + e.getMessage();
            log.warn("[跟單] {} 讀取歷史成交失敗，游標從建立時間開始: {}", options.address(), e.getMessage());
        }

        Map<String, BigDecimal> prePositions = new TreeMap<>();
        AccountState account = null;
        String accountError = null;
        try {
            account = sourceGateway.fetchAccountState(options.address());
            for (AccountState.OpenPosition p : account.openPositions()) {
                if (p.asset() != null && p.signedSize() != null && p.signedSize().signum() != 0) {
                    prePositions.put(p.asset().toUpperCase(), p.signedSize());
                }
            }
        } catch (RuntimeException e) {
            accountError = "讀取帳戶持倉失敗: " + e.getMessage();
            log.warn("[跟單] {} 讀取帳戶持倉失敗，不處理開倉前持倉: {}", options.address(), e.getMessage());
        }

        Instant createdAt = clock.instant();
        CopySession session = new CopySession(nextId.getAndIncrement(), options, createdAt, params.maxMessages());
        if (latestFill != null) {
            session.advanceCursor(latestFill);
            for (Fill f : seedFills) {
                if (f.providerId() != null && f.time() != null && !f.time().isBefore(latestFill)) {
                    session.markSeen(f.providerId(), f.time());
                }
            }
            session.addNotification("略過 " + latestFill + " 之前的歷史成交");
        } else {
            // 沒有歷史成交可參考時，建立時間之前的成交一律視為歷史
            session.advanceCursor(createdAt);
        }
        prePositions.forEach(session::rememberPreSessionPosition);
        if (!prePositions.isEmpty()) {
            session.addNotification("偵測到開倉前既有持倉: " + String.join(", ", prePositions.keySet()));
        }
        if (account != null) {
            session.cacheAccount(account.accountValueUsd(), account.totalNotionalUsd(), createdAt);
        }
        if (fillsError != null) session.addError(fillsError);
        if (accountError != null) session.addError(accountError);

        // 狀態完整後才放進 map，輪詢不會看到半初始化的 session
        lock.lock();
        try {
            sessions.put(session.getId(), session);
        } finally {
            lock.unlock();
        }

        log.info("[跟單] 建立 session #{} address={} leverage={} size={} assets={} execute={}",
                session.getId(), session.getAddress(), session.getLeverage(),
                session.getPositionSizePct(), session.getAssetSymbols(), session.isExecute());
        return session.snapshot(false);
    }

    /** 停止 session；輪詢下一輪起不再處理，進行中的呼叫允許完成 */
    public boolean stopSession(long sessionId) {
        lock.lock();
        try {
            CopySession session = sessions.get(sessionId);
            if (session == null) return false;
            session.deactivate();
        } finally {
            lock.unlock();
        }
        log.info("[跟單] 停止 session #{}", sessionId);
        return true;
    }

    public boolean removeSession(long sessionId) {
        CopySession removed;
        lock.lock();
        try {
            removed = sessions.remove(sessionId);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            removed.deactivate();
            log.info("[跟單] 移除 session #{}", sessionId);
        }
        return removed != null;
    }

    public Optional<CopySessionStatus> getStatus(long sessionId) {
        CopySession session;
        lock.lock();
        try {
            session = sessions.get(sessionId);
        } finally {
            lock.unlock();
        }
        return Optional.ofNullable(session).map(s -> s.snapshot(backoff.isBackingOff(s.getAddress())));
    }

    public List<CopySessionStatus> listStatuses() {
        List<CopySession> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
        return snapshot.stream().map(s -> s.snapshot(backoff.isBackingOff(s.getAddress()))).toList();
    }

    // ======== 輪詢 ========

    /**
     * 處理所有啟用中的 session 一輪。
     * 單一 session 的例外只記錄在該 session，不影響其他 session。
     */
    public void tick() {
        List<CopySession> active;
        lock.lock();
        try {
            active = sessions.values().stream().filter(CopySession::isActive).toList();
        } finally {
            lock.unlock();
        }
        for (CopySession session : active) {
            try {
                processSession(session);
            } catch (Exception e) {
                log.error("[跟單] session #{} 處理失敗: {}", session.getId(), e.getMessage(), e);
                session.addError("處理失敗: " + e.getMessage());
            }
        }
    }

    void processSession(CopySession session) {
        String address = session.getAddress();
        if (backoff.isBackingOff(address)) {
            log.debug("[跟單] session #{} 地址 {} 退避中，略過本輪", session.getId(), address);
            return;
        }

        List<Fill> fills;
        try {
            fills = sourceGateway.fetchFills(address, session.getCursor());
        } catch (RuntimeException e) {
            Duration delay = backoff.recordFailure(address);
            session.addError("讀取成交失敗: " + e.getMessage());
            log.warn("[跟單] session #{} 讀取成交失敗，退避 {} 秒: {}",
                    session.getId(), delay.toSeconds(), e.getMessage());
            return;
        }
        backoff.recordSuccess(address);
        if (fills == null || fills.isEmpty()) return;

        List<Fill> ordered = new ArrayList<>(fills);
        ordered.sort(Comparator.comparing(Fill::time, Comparator.nullsFirst(Comparator.naturalOrder())));
        for (Fill fill : ordered) {
            if (!session.isActive()) break;
            handleFill(session, fill);
        }
        session.pruneSeen();
    }

    private void handleFill(CopySession session, Fill fill) {
        if (fill.time() == null || fill.providerId() == null) return;
        Instant cursor = session.getCursor();
        if (cursor != null && fill.time().isBefore(cursor)) return;
        if (!session.markSeen(fill.providerId(), fill.time())) return;
        session.advanceCursor(fill.time());

        if (fill.asset() == null) return;
        String asset = fill.asset().toUpperCase();
        if (!session.allows(asset)) return;
        if (fill.size() == null || fill.size().signum() <= 0 || fill.price() == null || fill.price().signum() <= 0) {
            return;
        }

        BigDecimal size = suppressPreSessionClose(session, asset, fill);
        if (size.signum() <= 0) return;

        BigDecimal pct = resolvePositionPct(session);
        if (pct == null) {
            session.addError("無法取得來源帳戶淨值，略過 " + asset + " 成交 " + fill.providerId());
            return;
        }
        BigDecimal scaled = size.multiply(pct).divide(HUNDRED, MC);
        if (scaled.signum() <= 0) return;

        BigDecimal leverage = resolveLeverage(session, fill);
        applyLeverage(session, asset, leverage);

        Optional<AssetSizing> sizing;
        try {
            sizing = sizingProvider.resolve(asset);
        } catch (RuntimeException e) {
            Duration delay = backoff.recordFailure(session.getAddress());
            session.addError("讀取 " + asset + " 下單精度失敗，略過成交 " + fill.providerId() + ": " + e.getMessage());
            log.warn("[跟單] session #{} 讀取 {} 下單精度失敗，退避 {} 秒: {}",
                    session.getId(), asset, delay.toSeconds(), e.getMessage());
            return;
        }
        if (sizing.isEmpty()) {
            session.addError("未知資產 " + asset + "，無法建立訂單");
            return;
        }
        CopyOrder order = buildOrder(session.getId(), sizing.get(), fill.buy(), scaled, fill.price());
        if (order.size().signum() <= 0) {
            log.debug("[跟單] session #{} {} 數量 {} 低於最小下單單位，略過", session.getId(), asset, scaled);
            return;
        }

        boolean filled = true;
        if (session.isExecute()) {
            try {
                tradingGateway.submitOrder(order);
            } catch (RuntimeException e) {
                filled = false;
                session.addError("下單失敗 " + asset + ": " + e.getMessage());
                log.warn("[跟單] session #{} 下單失敗 {}: {}", session.getId(), asset, e.getMessage());
            }
        }
        if (filled) {
            applyToShadow(session, asset, fill.direction(), fill.buy(), order.size(), fill.price(), leverage);
        }
        session.incrementProcessed();
        log.debug("[跟單] session #{} {} {} {} @ {} (execute={})", session.getId(),
                order.buy() ? "BUY" : "SELL", order.size(), asset, order.limitPrice(), session.isExecute());
    }

    /**
     * 減少開倉前持倉的成交不跟單，並把記住的數量往 0 扣減。
     *
     * @return 需要跟單的數量（反向超出開倉前持倉的部分，或原數量）
     */
    private BigDecimal suppressPreSessionClose(CopySession session, String asset, Fill fill) {
        BigDecimal pre = session.preSessionPosition(asset);
        if (pre.signum() == 0) return fill.size();
        boolean reduces = (pre.signum() > 0 && !fill.buy()) || (pre.signum() < 0 && fill.buy());
        if (!reduces) return fill.size();

        BigDecimal suppressed = fill.size().min(pre.abs());
        BigDecimal remaining = pre.signum() > 0 ? pre.subtract(suppressed) : pre.add(suppressed);
        session.rememberPreSessionPosition(asset, remaining);
        session.addNotification("忽略開倉前持倉 " + asset + " 的平倉（剩餘 "
                + remaining.stripTrailingZeros().toPlainString() + "）於 " + fill.time());
        return fill.size().subtract(suppressed);
    }

    /** 跟單比例（%）；自動模式 = 投入資金 / 來源帳戶淨值 × 100，取不到淨值時回傳 null */
    private BigDecimal resolvePositionPct(CopySession session) {
        if (!session.getPositionSizePct().isAuto()) {
            return SizingCalculator.clamp(session.getPositionSizePct().value(), BigDecimal.ZERO, MAX_POSITION_PCT);
        }
        BigDecimal accountValue = accountValue(session);
        if (accountValue == null || accountValue.signum() <= 0) return null;
        BigDecimal pct = session.getDepositUsd().divide(accountValue, MC).multiply(HUNDRED);
        return SizingCalculator.clamp(pct, BigDecimal.ZERO, MAX_POSITION_PCT);
    }

    /**
     * 槓桿；自動模式 = 來源帳戶總持倉名目 / 帳戶淨值（沒有持倉時以本筆成交名目計算）。
     * 取不到帳戶淨值時用 1 倍。
     */
    private BigDecimal resolveLeverage(CopySession session, Fill fill) {
        if (!session.getLeverage().isAuto()) {
            return SizingCalculator.clamp(session.getLeverage().value(), MIN_LEVERAGE, MAX_LEVERAGE);
        }
        BigDecimal accountValue = accountValue(session);
        if (accountValue == null || accountValue.signum() <= 0) return BigDecimal.ONE;
        BigDecimal notional = session.getCachedOpenNotional();
        if (notional == null || notional.signum() <= 0) notional = fill.notionalUsd();
        return SizingCalculator.clamp(notional.divide(accountValue, MC), MIN_LEVERAGE, MAX_LEVERAGE);
    }

    /** 來源帳戶淨值，在 TTL 內沿用快取 */
    private BigDecimal accountValue(CopySession session) {
        Instant fetchedAt = session.getAccountFetchedAt();
        Instant now = clock.instant();
        if (fetchedAt != null && Duration.between(fetchedAt, now).toMillis() < params.accountStateTtlMs()) {
            return session.getCachedAccountValue();
        }
        if (backoff.isBackingOff(session.getAddress())) {
            return session.getCachedAccountValue();
        }
        try {
            AccountState state = sourceGateway.fetchAccountState(session.getAddress());
            backoff.recordSuccess(session.getAddress());
            session.cacheAccount(state.accountValueUsd(), state.totalNotionalUsd(), now);
            return state.accountValueUsd();
        } catch (RuntimeException e) {
            Duration delay = backoff.recordFailure(session.getAddress());
            session.addError("讀取帳戶狀態失敗: " + e.getMessage());
            log.warn("[跟單] session #{} 讀取帳戶狀態失敗，退避 {} 秒: {}",
                    session.getId(), delay.toSeconds(), e.getMessage());
            return session.getCachedAccountValue();
        }
    }

    /** 槓桿變動時更新（僅實單模式）；同一 session + 資產在節流間隔內只更新一次，失敗忽略 */
    private void applyLeverage(CopySession session, String asset, BigDecimal leverage) {
        BigDecimal last = session.lastLeverage(asset);
        if (last != null && last.compareTo(leverage) == 0) return;
        if (!session.isExecute()) {
            session.recordLeverage(asset, leverage);
            return;
        }
        String key = session.getId() + ":" + asset;
        if (!leverageThrottle.canRun(key)) return;
        leverageThrottle.touch(key);
        try {
            tradingGateway.updateLeverage(asset, leverage, params.crossMargin());
            session.recordLeverage(asset, leverage);
        } catch (RuntimeException e) {
            session.addError("槓桿更新失敗（忽略）: " + e.getMessage());
            log.warn("[跟單] session #{} {} 槓桿更新失敗（忽略）: {}", session.getId(), asset, e.getMessage());
        }
    }

    /** 價格往吃單不利方向調整滑價百分比，再依資產精度取整 */
    CopyOrder buildOrder(long sessionId, AssetSizing sizing, boolean buy, BigDecimal size, BigDecimal price) {
        BigDecimal slip = BigDecimal.valueOf(params.slippagePct()).divide(HUNDRED, MC);
        BigDecimal factor = buy ? BigDecimal.ONE.add(slip) : BigDecimal.ONE.subtract(slip);
        BigDecimal limitPrice = sizing.roundPrice(price.multiply(factor, MC));
        return new CopyOrder(sessionId, sizing.asset(), sizing.assetIndex(), buy,
                sizing.roundSize(size), limitPrice, false, CopyOrder.IOC);
    }

    private void applyToShadow(CopySession session, String asset, TradeDirection direction, boolean buy,
                               BigDecimal size, BigDecimal price, BigDecimal leverage) {
        Position position = session.shadowPosition(asset);
        if (direction != null && direction.isClose()) {
            PositionLedger.applyClose(position, size, price);
        } else {
            TradeDirection side = buy ? TradeDirection.LONG : TradeDirection.SHORT;
            BigDecimal margin = size.multiply(price).divide(leverage, MC);
            PositionLedger.applyEntry(position, side, size, price, margin);
        }
    }
}
