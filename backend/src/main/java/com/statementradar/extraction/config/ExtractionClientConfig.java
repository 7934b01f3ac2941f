package com.statementradar.extraction.config;

import com.statementradar.extraction.ExtractionErrorClassifier;
import com.statementradar.extraction.ExtractionResponseParser;
import com.statementradar.extraction.VisionExtractionClient;
import com.statementradar.extraction.WebClientVisionExtractionClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the vision extraction client and the local request limiter in front of it.
 */
@Configuration
@EnableConfigurationProperties({ ExtractionProperties.class, VisionProperties.class })
public class ExtractionClientConfig {

    public static final String EXTRACTION_RATE_LIMITER = "extractionRateLimiter";

    @Bean
    @ConditionalOnMissingBean(VisionExtractionClient.class)
    public VisionExtractionClient visionExtractionClient(WebClient.Builder webClientBuilder,
                                                         VisionProperties visionProperties,
                                                         ExtractionResponseParser parser,
                                                         ExtractionErrorClassifier errorClassifier) {
        return new WebClientVisionExtractionClient(webClientBuilder, visionProperties, parser, errorClassifier);
    }

    /** Requests per minute budget; a task waits up to limiterTimeoutMs for a permit. */
    @Bean(name = EXTRACTION_RATE_LIMITER)
    public RateLimiter extractionRateLimiter(ExtractionProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of(EXTRACTION_RATE_LIMITER, config);
    }
}
