package com.statementradar.extraction.config;

import com.statementradar.StatementRadarApplication;
import com.statementradar.extraction.VisionExtractionClient;
import com.statementradar.extraction.WebClientVisionExtractionClient;
import com.statementradar.pipeline.StatementPipeline;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = StatementRadarApplication.class, properties = {
        "statementradar.extraction.requests-per-minute=30",
        "statementradar.extraction.limiter-timeout-ms=2500",
        "statementradar.vision.base-url=http://localhost:9"
})
class ExtractionClientConfigTest {

    @Autowired
    VisionExtractionClient visionExtractionClient;

    @Autowired
    @Qualifier(ExtractionClientConfig.EXTRACTION_RATE_LIMITER)
    RateLimiter rateLimiter;

    @Autowired
    VisionProperties visionProperties;

    @Autowired
    StatementPipeline statementPipeline;

    @Test
    @DisplayName("default client is the WebClient implementation bound to vision properties")
    void visionClientWired() {
        assertThat(visionExtractionClient).isInstanceOf(WebClientVisionExtractionClient.class);
        assertThat(visionProperties.getBaseUrl()).isEqualTo("http://localhost:9");
        assertThat(visionProperties.getApiVersion()).isEqualTo("2023-06-01");
        assertThat(statementPipeline).isNotNull();
    }

    @Test
    @DisplayName("rate limiter allows requests-per-minute calls per one-minute window")
    void rateLimiterConfigured() {
        assertThat(rateLimiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(30);
        assertThat(rateLimiter.getRateLimiterConfig().getLimitRefreshPeriod()).isEqualTo(Duration.ofMinutes(1));
        assertThat(rateLimiter.getRateLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofMillis(2500));
    }
}
