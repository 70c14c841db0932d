package com.aiinpocket.whalecopy.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "price_history", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"asset_symbol", "price_time"})
}, indexes = {
        @Index(name = "idx_price_history_asset_time", columnList = "asset_symbol, price_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "asset_symbol", nullable = false, length = 30)
    private String assetSymbol;

    @Column(name = "price_time", nullable = false)
    private Instant timestamp;

    @Column(name = "price_usd", nullable = false, precision = 30, scale = 10)
    private BigDecimal priceUsd;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String source = "binance";
}
