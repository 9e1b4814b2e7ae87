package com.vuong.restkit.config;

import org.modelmapper.ModelMapper;
import org.modelmapper.convention.MatchingStrategies;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration class for the REST kit.
 * Enables component scanning for the kit's packages and provides the shared ModelMapper.
 */
@Configuration
@ComponentScan(basePackages = "com.vuong.restkit")
public class RestKitAutoConfiguration {

    /**
     * Creates the ModelMapper used to build entities from validated data and
     * to map entities onto response DTOs.
     * @return a ModelMapper with strict matching
     */
    @Bean
    @ConditionalOnMissingBean(ModelMapper.class)
    public ModelMapper modelMapper() {
        ModelMapper modelMapper = new ModelMapper();
        modelMapper.getConfiguration().setMatchingStrategy(MatchingStrategies.STRICT);
        return modelMapper;
    }
}
