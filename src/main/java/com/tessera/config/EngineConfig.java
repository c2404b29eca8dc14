package com.tessera.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Infrastructure beans the engine needs when the host application does not provide them
 */
@Configuration
public class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        logger.info("No MeterRegistry found, metrics are kept in memory");
        return new SimpleMeterRegistry();
    }

    /**
     * Used for the SQL plugin responses and the model worker protocol
     */
    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
