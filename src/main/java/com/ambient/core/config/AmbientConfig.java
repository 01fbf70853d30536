package com.ambient.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AmbientConfig {

    /** Source of session names, workflow ids and status timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
