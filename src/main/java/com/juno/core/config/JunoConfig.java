package com.juno.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class JunoConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
