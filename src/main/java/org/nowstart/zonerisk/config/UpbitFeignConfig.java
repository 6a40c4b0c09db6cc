package org.nowstart.zonerisk.config;

import feign.Request;
import java.util.concurrent.TimeUnit;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class UpbitFeignConfig {

    @Bean
    @RefreshScope
    public Request.Options upbitRequestOptions(ZoneRiskProperties zoneRiskProperties) {
        ZoneRiskProperties.Upbit upbit = zoneRiskProperties.upbit();
        return new Request.Options(
                upbit.connectTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                upbit.readTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                true
        );
    }
}
