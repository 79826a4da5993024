package com.example.toolstore.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ToolStoreProperties.class)
public class ToolStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
