package com.statementradar.consolidation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tolerances for the arithmetic identity checks run after merging.
 * Two amounts agree when |a - b| <= max(absoluteTolerance, relativeTolerance * max(|a|, |b|)).
 */
@ConfigurationProperties(prefix = "statementradar.consolidation")
@NoArgsConstructor
@Getter
@Setter
public class ConsolidationProperties {

    private double relativeTolerance = 0.01;

    private double absoluteTolerance = 1.0;
}
