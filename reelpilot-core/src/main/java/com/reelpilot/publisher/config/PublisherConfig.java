package com.reelpilot.publisher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpilot.publisher.store.PersistentStateStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.Random;

@Configuration
@EnableConfigurationProperties(PublisherProperties.class)
public class PublisherConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random scheduleRandom() {
        return new Random();
    }

    @Bean
    public PersistentStateStore persistentStateStore(PublisherProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new PersistentStateStore(Paths.get(properties.getState().getDir()), objectMapper, clock);
    }
}
