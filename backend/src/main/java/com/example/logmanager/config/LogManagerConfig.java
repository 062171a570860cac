package com.example.logmanager.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableCaching
@EnableConfigurationProperties(LogManagerProperties.class)
public class LogManagerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
