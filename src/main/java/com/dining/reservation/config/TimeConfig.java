package com.dining.reservation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single clock source for "today" when a search omits its date. Restaurant hours are local
 * wall-clock times, so the clock uses the server's default zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
