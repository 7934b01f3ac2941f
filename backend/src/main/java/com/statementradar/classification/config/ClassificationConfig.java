package com.statementradar.classification.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ClassificationProperties.class)
public class ClassificationConfig {
}
