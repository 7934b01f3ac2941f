package com.statementradar.consolidation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ConsolidationProperties.class)
public class ConsolidationConfig {
}
