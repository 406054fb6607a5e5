package com.silentrisk.common.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by every Silent Risk service.
 */
@Configuration
public class CommonConfiguration {

    /**
     * Wall clock used by the ownership freshness check and status timestamps.
     * Tests substitute a fixed clock.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
