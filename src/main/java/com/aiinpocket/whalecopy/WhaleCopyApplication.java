package com.aiinpocket.whalecopy;

import com.aiinpocket.whalecopy.config.BinanceApiProperties;
import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.config.HyperliquidApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CopyTradingProperties.class,
        HyperliquidApiProperties.class,
        BinanceApiProperties.class
})
public class WhaleCopyApplication {

    public static void main(String[] args) {
        SpringApplication.run(WhaleCopyApplication.class, args);
    }

}
