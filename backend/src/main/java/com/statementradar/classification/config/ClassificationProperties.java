package com.statementradar.classification.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Page classification thresholds. Documented in application.yml under statementradar.classification.
 */
@ConfigurationProperties(prefix = "statementradar.classification")
@NoArgsConstructor
@Getter
@Setter
public class ClassificationProperties {

    /** Minimum winning score for a page to count as a financial statement. Default 3.0. */
    private double financialThreshold = 3.0;

    /** Pages whose trimmed text is shorter than this are skipped without scoring. Default 20. */
    private int minTextLength = 20;

    /** Documents with more pages than this are scored on the classification pool. Default 10. */
    private int parallelPageThreshold = 10;
}
