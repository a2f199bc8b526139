package com.vigil.service.core.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /** Time source for acknowledgement expiry, downtime windows and flapping transitions. */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock vigilClock() {
        return Clock.systemUTC();
    }
}
