package com.aiinpocket.whalecopy.repository;

import com.aiinpocket.whalecopy.model.entity.WhaleTrade;
import com.aiinpocket.whalecopy.model.enums.TradeDirection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

/**
 * 鯨魚成交紀錄 Repository。
 * 回測依時間（同時間再依 id）排序讀取，保持成交的原始順序。
 */
public interface WhaleTradeRepository extends JpaRepository<WhaleTrade, Long> {

    List<WhaleTrade> findByWhaleIdAndDirectionNotInOrderByTimestampAscIdAsc(
            Long whaleId, Collection<TradeDirection> excluded);

    /** 某鯨魚全部進場成交的名目價值（建議跟單比例用） */
    @Query("SELECT t.valueUsd FROM WhaleTrade t WHERE t.whaleId = :whaleId " +
           "AND t.direction IN :directions AND t.valueUsd IS NOT NULL ORDER BY t.timestamp ASC")
    List<BigDecimal> findEntryValues(@Param("whaleId") Long whaleId,
                                     @Param("directions") Collection<TradeDirection> directions);

    @Query("SELECT DISTINCT t.baseAsset FROM WhaleTrade t WHERE t.whaleId = :whaleId ORDER BY t.baseAsset")
    List<String> findDistinctAssets(@Param("whaleId") Long whaleId);

    boolean existsByWhaleIdAndTxHash(Long whaleId, String txHash);
}
