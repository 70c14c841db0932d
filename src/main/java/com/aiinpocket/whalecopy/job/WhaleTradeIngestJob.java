package com.aiinpocket.whalecopy.job;

import com.aiinpocket.whalecopy.service.DistributedLockService;
import com.aiinpocket.whalecopy.service.WhaleTradeIngestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 定時匯入鯨魚成交（預設每 5 分鐘），以 advisory lock 確保多實例只有一個在執行。
 */
@Component
@DisallowConcurrentExecution
@RequiredArgsConstructor
@Slf4j
public class WhaleTradeIngestJob extends QuartzJobBean {

    /** Advisory lock ID：成交匯入專用 */
    private static final long INGEST_LOCK_ID = 3_000_001L;

    private final WhaleTradeIngestService ingestService;
    private final DistributedLockService lockService;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.callWithLock(INGEST_LOCK_ID, "WhaleTradeIngestJob", ingestService::ingestAll)
                .ifPresent(count -> log.debug("[匯入] 排程完成，新增 {} 筆", count));
    }
}
