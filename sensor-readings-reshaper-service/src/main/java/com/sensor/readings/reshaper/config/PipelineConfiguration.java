package com.sensor.readings.reshaper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.sensor.readings.reshaper.service.Sleeper;

/**
 * Beans shared by the transfer and retry stages.
 */
@Configuration
public class PipelineConfiguration {

    /** Sleeper used between upload attempts and between ledger retries. */
    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
