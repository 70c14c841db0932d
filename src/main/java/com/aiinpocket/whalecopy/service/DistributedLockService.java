package com.aiinpocket.whalecopy.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 以 PostgreSQL advisory lock 做跨實例互斥。
 * 多個實例同時被 Quartz 觸發時，只有取得鎖的實例會執行任務，其餘直接跳過。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributedLockService {

    static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(?)";
    static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(?)";

    private final JdbcTemplate jdbcTemplate;

    /**
     * 在鎖保護下執行任務。
     * 取鎖與釋放在同一條連線上進行，任務執行期間該連線保持借出。
     *
     * @return 任務結果；沒取得鎖時為 empty
     */
    public <T> Optional<T> callWithLock(long lockId, String taskName, Supplier<T> task) {
        return jdbcTemplate.execute((ConnectionCallback<Optional<T>>) con -> {
            if (!advisory(con, TRY_LOCK_SQL, lockId)) {
                log.debug("[分散式鎖] {} 由其他實例執行中，跳過 (lockId={})", taskName, lockId);
                return Optional.empty();
            }
            try {
                return Optional.ofNullable(task.get());
            } finally {
                if (!advisory(con, UNLOCK_SQL, lockId)) {
                    log.warn("[分散式鎖] {} 釋放鎖失敗 (lockId={})", taskName, lockId);
                }
            }
        });
    }

    private static boolean advisory(Connection con, String sql, long lockId) throws SQLException {
        try (PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setLong(1, lockId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
