package com.statementradar.extraction.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Page selection, concurrency and retry settings for extraction. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "statementradar.extraction")
@NoArgsConstructor
@Getter
@Setter
public class ExtractionProperties {

    /** Number of top-ranked classified pages sent for extraction. Default 10. */
    private int topK = 10;

    /** Extractions in flight at once. Default 5. */
    private int concurrency = 5;

    /** Total calls per page for rate-limited failures, first call included. Default 3. */
    private int maxRetries = 3;

    /** Backoff base in ms; doubles per attempt. Default 1000. */
    private long baseDelayMs = 1_000L;

    /** Upper bound of the uniform jitter added to each backoff, in ms. Default 1000. */
    private long jitterMs = 1_000L;

    /** Backoff cap in ms. Default 60000. */
    private long maxDelayMs = 60_000L;

    /** Pages with less text than this are rejected before calling the service. Default 20. */
    private int minTextLength = 20;

    /** Local limiter budget in front of the vision service. Default 80 requests per minute. */
    private int requestsPerMinute = 80;

    /** How long a task may wait for a limiter permit before counting as rate-limited. Default 60000. */
    private long limiterTimeoutMs = 60_000L;
}
