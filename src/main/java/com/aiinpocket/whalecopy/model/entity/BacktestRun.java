package com.aiinpocket.whalecopy.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 已命名的回測紀錄（Run）。
 * 保存回測參數與摘要數據，之後可以直接用來建立即時跟單 session。
 *
 * <p>完整摘要以 JSON 存在 {@code summaryJson}，對應
 * {@link com.aiinpocket.whalecopy.model.dto.BacktestResult.Summary}。
 */
@Entity
@Table(name = "backtest_run", indexes = {
        @Index(name = "idx_backtest_run_whale", columnList = "whale_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "whale_id", nullable = false)
    private Long whaleId;

    @Column(precision = 10, scale = 4)
    private BigDecimal leverage;

    /** 回測實際使用的跟單比例（%） */
    @Column(precision = 10, scale = 4)
    private BigDecimal positionSizePct;

    /** 資產白名單，逗號分隔；空值代表不限 */
    @Column(length = 500)
    private String assetSymbols;

    @Column(precision = 10, scale = 4)
    private BigDecimal winRatePercent;

    private Integer tradesCopied;

    @Column(precision = 10, scale = 4)
    private BigDecimal maxDrawdownPercent;

    @Column(precision = 30, scale = 8)
    private BigDecimal maxDrawdownUsd;

    @Column(precision = 30, scale = 8)
    private BigDecimal initialDepositUsd;

    @Column(precision = 30, scale = 8)
    private BigDecimal netPnlUsd;

    @Column(precision = 20, scale = 8)
    private BigDecimal roiPercent;

    @Column(columnDefinition = "TEXT")
    private String summaryJson;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
    }
}
