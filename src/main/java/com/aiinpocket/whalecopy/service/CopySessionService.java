package com.aiinpocket.whalecopy.service;

import com.aiinpocket.whalecopy.model.dto.AdaptiveSetting;
import com.aiinpocket.whalecopy.model.dto.CopySessionOptions;
import com.aiinpocket.whalecopy.model.dto.CopySessionStatus;
import com.aiinpocket.whalecopy.model.entity.BacktestRun;
import com.aiinpocket.whalecopy.model.entity.TrackedWhale;
import com.aiinpocket.whalecopy.repository.BacktestRunRepository;
import com.aiinpocket.whalecopy.repository.TrackedWhaleRepository;
import com.aiinpocket.whalecopy.service.copier.CopySessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 由已儲存的 Run 或直接指定參數建立即時跟單 session。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CopySessionService {

    private final BacktestRunRepository runRepository;
    private final TrackedWhaleRepository whaleRepository;
    private final CopySessionManager sessionManager;

    /**
     * 以 Run 的槓桿、跟單比例與資產白名單建立 session。
     *
     * @param positionSizeOverride 不為 null 時取代 Run 的跟單比例（可為 auto）
     * @param depositUsd           null 時沿用 Run 的初始資金
     */
    public CopySessionStatus startFromRun(long runId, BigDecimal depositUsd, boolean execute,
                                          AdaptiveSetting positionSizeOverride) {
        BacktestRun run = runRepository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("找不到回測紀錄: " + runId));
        TrackedWhale whale = whaleRepository.findById(run.getWhaleId())
                .orElseThrow(() -> new IllegalArgumentException("回測紀錄對應的鯨魚不存在: " + run.getWhaleId()));

        AdaptiveSetting positionSize = positionSizeOverride != null
                ? positionSizeOverride
                : AdaptiveSetting.ofNullable(run.getPositionSizePct());
        AdaptiveSetting leverage = run.getLeverage() != null
                ? AdaptiveSetting.fixed(run.getLeverage())
                : AdaptiveSetting.fixed(BigDecimal.ONE);

        CopySessionOptions options = new CopySessionOptions(
                whale.getId(),
                whale.getAddress(),
                leverage,
                positionSize,
                parseAssets(run.getAssetSymbols()),
                depositUsd != null ? depositUsd : run.getInitialDepositUsd(),
                execute);
        log.info("[跟單] 由 Run #{} '{}' 建立 session", runId, run.getName());
        return sessionManager.createSession(options);
    }

    public CopySessionStatus start(String address, AdaptiveSetting leverage, AdaptiveSetting positionSize,
                                   Set<String> assets, BigDecimal depositUsd, boolean execute) {
        TrackedWhale whale = whaleRepository.findByAddressIgnoreCase(address)
                .orElseThrow(() -> new IllegalArgumentException("找不到鯨魚: " + address));
        return sessionManager.createSession(new CopySessionOptions(
                whale.getId(), whale.getAddress(), leverage, positionSize, assets, depositUsd, execute));
    }

    static Set<String> parseAssets(String csv) {
        if (csv == null || csv.isBlank()) return Set.of();
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toUpperCase)
                .collect(Collectors.toSet());
    }
}
