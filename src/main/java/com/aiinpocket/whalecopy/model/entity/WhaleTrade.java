package com.aiinpocket.whalecopy.model.entity;

import com.aiinpocket.whalecopy.model.enums.TradeDirection;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "whale_trade", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"whale_id", "tx_hash"})
}, indexes = {
        @Index(name = "idx_whale_trade_whale_time", columnList = "whale_id, trade_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WhaleTrade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "whale_id", nullable = false)
    private Long whaleId;

    @Column(name = "trade_time", nullable = false)
    private Instant timestamp;

    @Column(name = "base_asset", nullable = false, length = 30)
    private String baseAsset;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TradeDirection direction;

    @Column(name = "amount_base", precision = 30, scale = 10)
    private BigDecimal amountBase;

    @Column(name = "value_usd", precision = 30, scale = 8)
    private BigDecimal valueUsd;

    @Column(name = "realized_pnl_usd", precision = 30, scale = 8)
    private BigDecimal realizedPnlUsd;

    @Column(name = "tx_hash", nullable = false, length = 120)
    private String txHash;
}
