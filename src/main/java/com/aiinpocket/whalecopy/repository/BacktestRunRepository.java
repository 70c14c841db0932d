package com.aiinpocket.whalecopy.repository;

import com.aiinpocket.whalecopy.model.entity.BacktestRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * 回測紀錄 Repository。
 */
public interface BacktestRunRepository extends JpaRepository<BacktestRun, Long> {

    /** 某鯨魚的回測紀錄，最新的在前 */
    List<BacktestRun> findByWhaleIdOrderByCreatedAtDesc(Long whaleId);

    List<BacktestRun> findTop20ByOrderByCreatedAtDesc();
}
