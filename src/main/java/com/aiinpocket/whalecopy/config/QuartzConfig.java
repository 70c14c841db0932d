package com.aiinpocket.whalecopy.config;

import com.aiinpocket.whalecopy.job.CopySessionPollJob;
import com.aiinpocket.whalecopy.job.WhaleTradeIngestJob;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QuartzConfig {

    // CopySessionPollJob：固定間隔輪詢所有啟用中的跟單 session
    @Bean
    public JobDetail copySessionPollJobDetail() {
        return JobBuilder.newJob(CopySessionPollJob.class)
                .withIdentity("copySessionPollJob", "copytrade")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger copySessionPollTrigger(JobDetail copySessionPollJobDetail, CopyTradingProperties props) {
        return TriggerBuilder.newTrigger()
                .forJob(copySessionPollJobDetail)
                .withIdentity("copySessionPollTrigger", "copytrade")
                .withSchedule(SimpleScheduleBuilder.simpleSchedule()
                        .withIntervalInMilliseconds(props.copier().pollIntervalMs())
                        .repeatForever()
                        .withMisfireHandlingInstructionNextWithRemainingCount())
                .build();
    }

    // WhaleTradeIngestJob：定期匯入追蹤中鯨魚的新成交
    @Bean
    public JobDetail whaleTradeIngestJobDetail() {
        return JobBuilder.newJob(WhaleTradeIngestJob.class)
                .withIdentity("whaleTradeIngestJob", "copytrade")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger whaleTradeIngestTrigger(JobDetail whaleTradeIngestJobDetail, CopyTradingProperties props) {
        return TriggerBuilder.newTrigger()
                .forJob(whaleTradeIngestJobDetail)
                .withIdentity("whaleTradeIngestTrigger", "copytrade")
                .withSchedule(CronScheduleBuilder.cronSchedule(props.ingest().cron()))
                .build();
    }
}
