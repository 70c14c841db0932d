package com.aiinpocket.whalecopy.service.copier;

import com.aiinpocket.whalecopy.model.dto.AdaptiveSetting;
import com.aiinpocket.whalecopy.model.dto.CopySessionOptions;
import com.aiinpocket.whalecopy.model.dto.CopySessionStatus;
import com.aiinpocket.whalecopy.model.enums.CopySessionState;
import com.aiinpocket.whalecopy.service.backtest.Position;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一個即時跟單 session 的狀態。
 * <p>
 * 建立到停止之間只由輪詢執行緒修改；狀態快照可以在任何執行緒讀取。
 * 游標只會往前推進，已處理的成交 ID 只保留游標當下（含）之後的部分。
 */
@Getter
public class CopySession {

    private final long id;
    private final Long whaleId;
    private final String address;
    private final AdaptiveSetting leverage;
    private final AdaptiveSetting positionSizePct;
    private final Set<String> assetSymbols;
    private final BigDecimal depositUsd;
    private final boolean execute;
    private final Instant createdAt;

    private volatile boolean active = true;
    private volatile Instant cursor;

    private volatile BigDecimal cachedAccountValue;
    private volatile BigDecimal cachedOpenNotional;
    private volatile Instant accountFetchedAt;

    private final AtomicInteger processed = new AtomicInteger();
    private final int maxMessages;
    private final List<String> errors = new CopyOnWriteArrayList<>();
    private final List<String> notifications = new CopyOnWriteArrayList<>();

    private final Map<String, Instant> seenFills = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> preSessionPositions = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> appliedLeverage = new ConcurrentHashMap<>();
    private final Map<String, Position> shadowPositions = new ConcurrentHashMap<>();

    CopySession(long id, CopySessionOptions options, Instant createdAt, int maxMessages) {
        this.id = id;
        this.whaleId = options.whaleId();
        this.address = options.address();
        this.leverage = options.leverage();
        this.positionSizePct = options.positionSizePct();
        Set<String> assets = new TreeSet<>();
        options.assetSymbols().forEach(a -> assets.add(a.toUpperCase()));
        this.assetSymbols = Collections.unmodifiableSet(assets);
        this.depositUsd = options.depositUsd();
        this.execute = options.execute();
        this.createdAt = createdAt;
        this.maxMessages = maxMessages;
    }

    void deactivate() {
        active = false;
    }

    boolean allows(String asset) {
        return assetSymbols.isEmpty() || assetSymbols.contains(asset);
    }

    /** 游標只往前推進 */
    void advanceCursor(Instant time) {
        if (cursor == null || time.isAfter(cursor)) {
            cursor = time;
        }
    }

    /** @return 第一次看到此成交時回傳 true */
    boolean markSeen(String providerId, Instant time) {
        return seenFills.putIfAbsent(providerId, time) == null;
    }

    /** 游標之前的成交不會再被處理，對應的 ID 不必保留 */
    void pruneSeen() {
        Instant c = cursor;
        if (c == null) return;
        seenFills.values().removeIf(t -> t.isBefore(c));
    }

    void rememberPreSessionPosition(String asset, BigDecimal signedSize) {
        if (signedSize.signum() == 0) {
            preSessionPositions.remove(asset);
        } else {
            preSessionPositions.put(asset, signedSize);
        }
    }

    BigDecimal preSessionPosition(String asset) {
        return preSessionPositions.getOrDefault(asset, BigDecimal.ZERO);
    }

    void cacheAccount(BigDecimal accountValue, BigDecimal openNotional, Instant fetchedAt) {
        this.cachedAccountValue = accountValue;
        this.cachedOpenNotional = openNotional;
        this.accountFetchedAt = fetchedAt;
    }

    Position shadowPosition(String asset) {
        return shadowPositions.computeIfAbsent(asset, k -> new Position());
    }

    BigDecimal lastLeverage(String asset) {
        return appliedLeverage.get(asset);
    }

    void recordLeverage(String asset, BigDecimal value) {
        appliedLeverage.put(asset, value);
    }

    void incrementProcessed() {
        processed.incrementAndGet();
    }

    void addError(String message) {
        append(errors, message);
    }

    void addNotification(String message) {
        append(notifications, message);
    }

    private void append(List<String> target, String message) {
        target.add(message);
        while (target.size() > maxMessages) {
            target.remove(0);
        }
    }

    CopySessionStatus snapshot(boolean backingOff) {
        CopySessionState state = !active ? CopySessionState.STOPPED
                : backingOff ? CopySessionState.BACKING_OFF
                : CopySessionState.ACTIVE;
        Map<String, BigDecimal> shadow = new TreeMap<>();
        shadowPositions.forEach((asset, pos) -> {
            if (!pos.isFlat()) shadow.put(asset, pos.getQuantity());
        });
        return new CopySessionStatus(
                id, whaleId, address, state, active, execute,
                leverage.toString(), positionSizePct.toString(),
                cursor, processed.get(),
                List.copyOf(errors), List.copyOf(notifications),
                Collections.unmodifiableMap(shadow), createdAt);
    }
}
