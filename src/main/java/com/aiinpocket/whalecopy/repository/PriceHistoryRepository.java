package com.aiinpocket.whalecopy.repository;

import com.aiinpocket.whalecopy.model.entity.PriceHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface PriceHistoryRepository extends JpaRepository<PriceHistory, Long> {

    /** 回測時間窗內的價格，依資產與時間排序 */
    List<PriceHistory> findByAssetSymbolInAndTimestampBetweenOrderByAssetSymbolAscTimestampAsc(
            Collection<String> assets, Instant from, Instant to);

    boolean existsByAssetSymbolAndTimestamp(String assetSymbol, Instant timestamp);

    long countByAssetSymbolAndTimestampBetween(String assetSymbol, Instant from, Instant to);
}
