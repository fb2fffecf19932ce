package com.contacthub.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC clock source. Token expiry, cache TTLs and rate-limit windows all read it.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
