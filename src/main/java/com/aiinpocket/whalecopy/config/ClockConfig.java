package com.aiinpocket.whalecopy.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 節流、退避與帳戶狀態快取共用的時鐘（測試可替換為固定時鐘） */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
