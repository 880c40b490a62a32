package com.conflictdata.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    // Timestamps written by the application are UTC.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
