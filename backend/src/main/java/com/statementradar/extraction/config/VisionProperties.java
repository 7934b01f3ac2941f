package com.statementradar.extraction.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the vision extraction service.
 */
@ConfigurationProperties(prefix = "statementradar.vision")
@NoArgsConstructor
@Getter
@Setter
public class VisionProperties {

    /** Messages API base URL. */
    private String baseUrl = "https://api.anthropic.com";

    /** API key sent as x-api-key; usually injected from the environment. */
    private String apiKey = "";

    private String apiVersion = "2023-06-01";

    /** Vision-capable model id. */
    private String model = "claude-3-5-sonnet-20241022";

    private int maxTokens = 4_096;

    /** Per-request response timeout in ms. */
    private long timeoutMs = 120_000L;
}
