package com.wingz.api.ride.service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * The single source of "now" for timestamps and time windows.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
