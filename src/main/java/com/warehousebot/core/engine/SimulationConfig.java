package com.warehousebot.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SimulationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
