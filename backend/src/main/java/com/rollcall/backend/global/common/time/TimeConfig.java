package com.rollcall.backend.global.common.time;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Provides the single UTC clock every module reads "now" and "today" from.
 * Setting {@code rollcall.clock.fixed-instant} pins the clock, which demo environments use
 * to replay a semester at a known date.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock(@Value("${rollcall.clock.fixed-instant:}") String fixedInstant) {
        if (StringUtils.hasText(fixedInstant)) {
            return Clock.fixed(Instant.parse(fixedInstant.trim()), ZoneOffset.UTC);
        }
        return Clock.system(ZoneOffset.UTC);
    }
}
