package com.typewarden.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CampaignConfig {

    @Bean
    public Clock campaignClock() {
        return Clock.systemUTC();
    }
}
