package com.aiinpocket.whalecopy.job;

import com.aiinpocket.whalecopy.service.copier.CopySessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 即時跟單輪詢（固定間隔，預設每秒）。
 * 同一時間只會有一輪在執行，上一輪未完成時下一次觸發會延後。
 */
@Component
@DisallowConcurrentExecution
@RequiredArgsConstructor
@Slf4j
public class CopySessionPollJob extends QuartzJobBean {

    private final CopySessionManager sessionManager;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        try {
            sessionManager.tick();
        } catch (Exception e) {
            log.error("[跟單] 輪詢失敗: {}", e.getMessage(), e);
        }
    }
}
