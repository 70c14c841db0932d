package com.aiinpocket.whalecopy.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 追蹤中的鯨魚帳戶。
 * {@code lastFillTime} 是成交匯入的游標，只會往前推進。
 */
@Entity
@Table(name = "tracked_whale", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"chain", "address"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackedWhale {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 地址一律存小寫 */
    @Column(nullable = false, length = 80)
    private String address;

    @Column(length = 100)
    private String label;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String chain = "hyperliquid";

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    /** 最後匯入的成交時間 */
    private Instant lastFillTime;

    /** 連續匯入失敗次數，成功後歸零 */
    @Column(nullable = false)
    @Builder.Default
    private int errorCount = 0;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
        if (address != null) {
            address = address.toLowerCase();
        }
    }
}
